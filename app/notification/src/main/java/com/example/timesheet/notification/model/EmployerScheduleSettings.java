/*
 * どこで: Notification ドメインモデル
 * 何を: 雇用主ごとのタイムゾーンと曜日別の配信時刻
 * なぜ: 雇用主のローカル時刻の解釈はすべてこの設定を通すため
 */
package com.example.timesheet.notification.model;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * {@code weeklyLocalTimes} maps a weekday to an {@code "HH:MM"} string. An empty string or a
 * missing key means the day is disabled.
 */
public record EmployerScheduleSettings(
    String employerId,
    String timezone,
    Map<Weekday, String> weeklyLocalTimes,
    Instant createdAt,
    Instant updatedAt) {

  public EmployerScheduleSettings {
    final Map<Weekday, String> copy = new EnumMap<>(Weekday.class);
    if (weeklyLocalTimes != null) {
      copy.putAll(weeklyLocalTimes);
    }
    weeklyLocalTimes = Collections.unmodifiableMap(copy);
  }

  public String localTimeFor(Weekday weekday) {
    return weeklyLocalTimes.getOrDefault(weekday, "");
  }

  public ZoneId zoneId() {
    return ZoneId.of(timezone);
  }
}
