/*
 * どこで: Notification サービス層
 * 何を: 雇用主向けの通知を登録し、一覧を返す
 * なぜ: 登録側は UTC 時刻か、設定から解決する曜日のどちらかを渡すため
 */
package com.example.timesheet.notification.service;

import com.example.timesheet.notification.api.EnqueueNotificationRequest;
import com.example.timesheet.notification.api.NotificationListResponse;
import com.example.timesheet.notification.api.NotificationSummary;
import com.example.timesheet.notification.api.ScheduleDisabledException;
import com.example.timesheet.notification.model.EmployerScheduleSettings;
import com.example.timesheet.notification.model.NotificationType;
import com.example.timesheet.notification.model.ScheduledNotification;
import com.example.timesheet.notification.model.Weekday;
import com.example.timesheet.notification.repository.ScheduledNotificationRepository;
import com.example.timesheet.notification.schedule.ScheduleCalculator;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ScheduledNotificationService {

  private static final Logger logger = LoggerFactory.getLogger(ScheduledNotificationService.class);

  private final ScheduledNotificationRepository notificationRepository;
  private final EmployerScheduleSettingsService settingsService;
  private final ScheduleCalculator scheduleCalculator;
  private final Clock clock;

  public NotificationSummary enqueue(String employerId, EnqueueNotificationRequest request) {
    final Instant now = Instant.now(clock);
    final Weekday referenceDay = parseReferenceDay(request.referenceDayOfWeek());
    final Instant scheduledTimeUtc =
        request.scheduledTimeUtc() != null
            ? request.scheduledTimeUtc()
            : resolveFromSettings(employerId, referenceDay, now);
    final ScheduledNotification record =
        ScheduledNotification.pending(
            UUID.randomUUID(),
            employerId,
            request.recipientEmail().trim(),
            request.subject(),
            request.messageBody(),
            request.notificationType() == null
                ? NotificationType.ACTION_ALERT
                : request.notificationType(),
            referenceDay,
            scheduledTimeUtc,
            now);
    notificationRepository.insert(record);
    logger.info(
        "notification queued id={} employerId={} scheduledTimeUtc={}",
        record.notificationId(),
        employerId,
        scheduledTimeUtc);
    return toSummary(record);
  }

  public NotificationListResponse list(String employerId) {
    final List<NotificationSummary> items =
        notificationRepository.findByEmployerId(employerId).stream()
            .map(this::toSummary)
            .toList();
    return new NotificationListResponse(employerId, items);
  }

  private Instant resolveFromSettings(String employerId, Weekday referenceDay, Instant now) {
    if (referenceDay == null) {
      throw new IllegalArgumentException(
          "scheduled_time_utc or reference_day_of_week is required");
    }
    final EmployerScheduleSettings settings = settingsService.resolve(employerId);
    return scheduleCalculator
        .nextOccurrenceUtc(
            referenceDay.key(), settings.localTimeFor(referenceDay), settings.timezone(), now)
        .orElseThrow(
            () ->
                new ScheduleDisabledException(
                    "notifications are disabled on " + referenceDay.key() + " for employer_id="
                        + employerId));
  }

  private Weekday parseReferenceDay(String referenceDayOfWeek) {
    if (referenceDayOfWeek == null || referenceDayOfWeek.isBlank()) {
      return null;
    }
    return Weekday.fromKey(referenceDayOfWeek)
        .orElseThrow(
            () ->
                new IllegalArgumentException(
                    "reference_day_of_week is not a weekday: " + referenceDayOfWeek));
  }

  private NotificationSummary toSummary(ScheduledNotification record) {
    return new NotificationSummary(
        record.notificationId(),
        record.recipientEmail(),
        record.subject(),
        record.notificationType(),
        record.referenceDayOfWeek() == null ? null : record.referenceDayOfWeek().key(),
        record.scheduledTimeUtc(),
        record.status(),
        record.attempts(),
        record.lastAttemptError(),
        record.sentAt(),
        record.createdAt(),
        record.updatedAt());
  }
}
