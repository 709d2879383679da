package com.example.timesheet.notification.api;

import com.example.timesheet.notification.model.NotificationStatus;
import com.example.timesheet.notification.model.NotificationType;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationSummary(
    UUID notificationId,
    String recipientEmail,
    String subject,
    NotificationType notificationType,
    String referenceDayOfWeek,
    Instant scheduledTimeUtc,
    NotificationStatus status,
    int attempts,
    String lastAttemptError,
    Instant sentAt,
    Instant createdAt,
    Instant updatedAt) {}
