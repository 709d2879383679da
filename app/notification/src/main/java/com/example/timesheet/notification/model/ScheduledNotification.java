/*
 * どこで: Notification ドメインモデル
 * 何を: scheduled_notifications 1 行のスナップショット
 * なぜ: claim/配信、再スケジュール、API で共有するため
 */
package com.example.timesheet.notification.model;

import java.time.Instant;
import java.util.UUID;

public record ScheduledNotification(
    UUID notificationId,
    String employerId,
    String recipientEmail,
    String subject,
    String messageBody,
    NotificationType notificationType,
    Weekday referenceDayOfWeek,
    Instant scheduledTimeUtc,
    NotificationStatus status,
    int attempts,
    String lastAttemptError,
    String lockedBy,
    Instant lockedAt,
    Instant sentAt,
    Instant createdAt,
    Instant updatedAt) {

  public static ScheduledNotification pending(
      UUID notificationId,
      String employerId,
      String recipientEmail,
      String subject,
      String messageBody,
      NotificationType notificationType,
      Weekday referenceDayOfWeek,
      Instant scheduledTimeUtc,
      Instant now) {
    return new ScheduledNotification(
        notificationId,
        employerId,
        recipientEmail,
        subject,
        messageBody,
        notificationType,
        referenceDayOfWeek,
        scheduledTimeUtc,
        NotificationStatus.PENDING,
        0,
        null,
        null,
        null,
        null,
        now,
        now);
  }
}
