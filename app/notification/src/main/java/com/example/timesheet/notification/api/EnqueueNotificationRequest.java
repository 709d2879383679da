/*
 * どこで: Notification API
 * 何を: 雇用主向けに通知を 1 件登録するリクエスト
 * なぜ: UTC 時刻を直接指定するか、曜日を雇用主設定から解決するかを選べるようにするため
 */
package com.example.timesheet.notification.api;

import com.example.timesheet.notification.model.NotificationType;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EnqueueNotificationRequest(
    @NotBlank(message = "recipient_email is required")
        @Email(message = "recipient_email must be an email address")
        String recipientEmail,
    @NotBlank(message = "subject is required") String subject,
    @NotBlank(message = "message_body is required") String messageBody,
    NotificationType notificationType,
    String referenceDayOfWeek,
    Instant scheduledTimeUtc) {

  @AssertTrue(message = "scheduled_time_utc or reference_day_of_week is required")
  public boolean isScheduleSpecified() {
    return scheduledTimeUtc != null
        || (referenceDayOfWeek != null && !referenceDayOfWeek.isBlank());
  }
}
