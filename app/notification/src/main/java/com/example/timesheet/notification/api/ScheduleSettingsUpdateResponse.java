package com.example.timesheet.notification.api;

import com.example.timesheet.notification.service.RescheduleSummary;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ScheduleSettingsUpdateResponse(
    ScheduleSettingsResponse settings, RescheduleSummary reschedule) {}
