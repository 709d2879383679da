package com.example.timesheet.notification.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ScheduleSettingsResponse(
    String employerId, String timezone, Map<String, String> weeklyLocalTimes, Instant updatedAt) {

  public ScheduleSettingsResponse {
    weeklyLocalTimes = weeklyLocalTimes == null ? Map.of() : Map.copyOf(weeklyLocalTimes);
  }
}
