/*
 * どこで: Notification API
 * 何を: 雇用主のタイムゾーンと曜日別配信時刻の部分更新
 * なぜ: 本文に含まれる曜日だけを変更扱いにするため
 */
package com.example.timesheet.notification.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code weeklyLocalTimes} maps weekday names ({@code "monday"} ...) to {@code "HH:MM"}, or to
 * {@code ""}/{@code null} to disable that day. Both fields are optional.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ScheduleSettingsUpdateRequest(String timezone, Map<String, String> weeklyLocalTimes) {

  public ScheduleSettingsUpdateRequest {
    // null 値を保持したいので Map.copyOf は使わない
    weeklyLocalTimes =
        weeklyLocalTimes == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(weeklyLocalTimes));
  }
}
