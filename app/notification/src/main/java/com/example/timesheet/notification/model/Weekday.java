/*
 * どこで: Notification ドメインモデル
 * 何を: 従業員の週次スケジュールのキーになる曜日名
 * なぜ: 設定 JSON と API は小文字の曜日名、java.time は DayOfWeek を使うため
 */
package com.example.timesheet.notification.model;

import java.time.DayOfWeek;
import java.util.Locale;
import java.util.Optional;

public enum Weekday {
  MONDAY(DayOfWeek.MONDAY),
  TUESDAY(DayOfWeek.TUESDAY),
  WEDNESDAY(DayOfWeek.WEDNESDAY),
  THURSDAY(DayOfWeek.THURSDAY),
  FRIDAY(DayOfWeek.FRIDAY),
  SATURDAY(DayOfWeek.SATURDAY),
  SUNDAY(DayOfWeek.SUNDAY);

  private final DayOfWeek dayOfWeek;

  Weekday(DayOfWeek dayOfWeek) {
    this.dayOfWeek = dayOfWeek;
  }

  public DayOfWeek dayOfWeek() {
    return dayOfWeek;
  }

  /** Lower-case name as stored in settings, e.g. {@code "monday"}. */
  public String key() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Weekday of(DayOfWeek dayOfWeek) {
    return values()[dayOfWeek.getValue() - 1];
  }

  public static Optional<Weekday> fromKey(String key) {
    if (key == null) {
      return Optional.empty();
    }
    final String normalized = key.trim().toUpperCase(Locale.ROOT);
    for (Weekday weekday : values()) {
      if (weekday.name().equals(normalized)) {
        return Optional.of(weekday);
      }
    }
    return Optional.empty();
  }
}
