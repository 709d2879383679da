package com.example.timesheet.notification.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.timesheet.notification.api.EnqueueNotificationRequest;
import com.example.timesheet.notification.api.NotificationSummary;
import com.example.timesheet.notification.api.ScheduleDisabledException;
import com.example.timesheet.notification.model.EmployerScheduleSettings;
import com.example.timesheet.notification.model.NotificationStatus;
import com.example.timesheet.notification.model.NotificationType;
import com.example.timesheet.notification.model.ScheduledNotification;
import com.example.timesheet.notification.model.Weekday;
import com.example.timesheet.notification.repository.ScheduledNotificationRepository;
import com.example.timesheet.notification.schedule.ScheduleCalculator;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ScheduledNotificationServiceTest {

  // 日曜 22:00 IST
  private static final Instant FIXED_NOW = Instant.parse("2026-01-04T16:30:00Z");
  private static final String EMPLOYER_ID = "employer-1";

  @Mock private ScheduledNotificationRepository notificationRepository;
  @Mock private EmployerScheduleSettingsService settingsService;

  private ScheduledNotificationService service;

  @BeforeEach
  void setUp() {
    service =
        new ScheduledNotificationService(
            notificationRepository,
            settingsService,
            new ScheduleCalculator(),
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void referenceDayIsResolvedThroughEmployerSettings() {
    when(settingsService.resolve(EMPLOYER_ID))
        .thenReturn(
            new EmployerScheduleSettings(
                EMPLOYER_ID,
                "Asia/Kolkata",
                Map.of(Weekday.MONDAY, "09:00"),
                FIXED_NOW,
                FIXED_NOW));

    final NotificationSummary summary =
        service.enqueue(EMPLOYER_ID, request("monday", null, null));

    final ArgumentCaptor<ScheduledNotification> inserted =
        ArgumentCaptor.forClass(ScheduledNotification.class);
    verify(notificationRepository).insert(inserted.capture());
    assertThat(inserted.getValue().scheduledTimeUtc())
        .isEqualTo(Instant.parse("2026-01-05T03:30:00Z"));
    assertThat(inserted.getValue().status()).isEqualTo(NotificationStatus.PENDING);
    assertThat(inserted.getValue().attempts()).isZero();
    assertThat(inserted.getValue().referenceDayOfWeek()).isEqualTo(Weekday.MONDAY);
    assertThat(inserted.getValue().notificationType()).isEqualTo(NotificationType.ACTION_ALERT);
    assertThat(summary.referenceDayOfWeek()).isEqualTo("monday");
  }

  @Test
  void explicitInstantIsStoredAsGiven() {
    final Instant at = Instant.parse("2026-01-10T12:00:00Z");

    final NotificationSummary summary =
        service.enqueue(EMPLOYER_ID, request(null, at, NotificationType.DAILY_SUMMARY));

    assertThat(summary.scheduledTimeUtc()).isEqualTo(at);
    assertThat(summary.notificationType()).isEqualTo(NotificationType.DAILY_SUMMARY);
    verify(settingsService, never()).resolve(any());
  }

  @Test
  void disabledReferenceDayIsRejected() {
    when(settingsService.resolve(EMPLOYER_ID))
        .thenReturn(
            new EmployerScheduleSettings(
                EMPLOYER_ID, "Asia/Kolkata", Map.of(Weekday.MONDAY, ""), FIXED_NOW, FIXED_NOW));

    assertThatThrownBy(() -> service.enqueue(EMPLOYER_ID, request("monday", null, null)))
        .isInstanceOf(ScheduleDisabledException.class);
    verify(notificationRepository, never()).insert(any());
  }

  @Test
  void unknownReferenceDayIsRejected() {
    assertThatThrownBy(() -> service.enqueue(EMPLOYER_ID, request("someday", null, null)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("someday");
  }

  private EnqueueNotificationRequest request(
      String referenceDay, Instant scheduledTimeUtc, NotificationType type) {
    return new EnqueueNotificationRequest(
        "employee@example.com",
        "Timesheet reminder",
        "Please submit your timesheet",
        type,
        referenceDay,
        scheduledTimeUtc);
  }
}
