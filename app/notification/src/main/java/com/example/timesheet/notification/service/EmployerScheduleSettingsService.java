/*
 * どこで: Notification サービス層
 * 何を: スケジュール設定の部分更新を反映し、再スケジュールを行う
 * なぜ: 設定行のロック内で再スケジュールし、並行更新をコミット順に反映させるため
 */
package com.example.timesheet.notification.service;

import com.example.timesheet.notification.api.EmployerSettingsNotFoundException;
import com.example.timesheet.notification.api.ScheduleSettingsResponse;
import com.example.timesheet.notification.api.ScheduleSettingsUpdateRequest;
import com.example.timesheet.notification.api.ScheduleSettingsUpdateResponse;
import com.example.timesheet.notification.config.NotificationScheduleProperties;
import com.example.timesheet.notification.model.EmployerScheduleSettings;
import com.example.timesheet.notification.model.Weekday;
import com.example.timesheet.notification.repository.EmployerScheduleSettingsRepository;
import com.example.timesheet.notification.schedule.LocalTimes;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class EmployerScheduleSettingsService {

  private static final Logger logger =
      LoggerFactory.getLogger(EmployerScheduleSettingsService.class);

  private final EmployerScheduleSettingsRepository settingsRepository;
  private final NotificationRescheduler rescheduler;
  private final NotificationScheduleProperties scheduleProperties;
  private final PlatformTransactionManager transactionManager;
  private final Clock clock;

  public ScheduleSettingsResponse get(String employerId) {
    return settingsRepository
        .findByEmployerId(employerId)
        .map(this::toResponse)
        .orElseThrow(() -> new EmployerSettingsNotFoundException(employerId));
  }

  /** Settings for the employer, or the configured defaults with every day disabled. */
  public EmployerScheduleSettings resolve(String employerId) {
    return settingsRepository
        .findByEmployerId(employerId)
        .orElseGet(() -> defaults(employerId, Instant.now(clock)));
  }

  /**
   * Upserts the settings and reschedules the employer's pending notifications for exactly the
   * weekdays present in {@code request}, all in one transaction that holds the settings row lock.
   * Concurrent updates for the same employer therefore reschedule in commit order. A failing
   * record write is rolled back to its own savepoint and reported in the summary; a failure to
   * read the pending records rolls back the settings write as well.
   */
  public ScheduleSettingsUpdateResponse update(
      String employerId, ScheduleSettingsUpdateRequest request) {
    final Optional<ZoneId> requestedZone = parseTimezone(request.timezone());
    final Map<Weekday, String> changedTimes = parseWeeklyTimes(request.weeklyLocalTimes());

    final ScheduleSettingsUpdateResponse response =
        transactionTemplate()
            .execute(
                status -> {
                  final EmployerScheduleSettings saved =
                      applyUpdate(employerId, requestedZone, changedTimes);
                  final RescheduleSummary summary = rescheduleUnderLock(saved, changedTimes);
                  return new ScheduleSettingsUpdateResponse(toResponse(saved), summary);
                });
    if (response == null) {
      throw new IllegalStateException("settings update returned no result employerId=" + employerId);
    }
    return response;
  }

  private EmployerScheduleSettings applyUpdate(
      String employerId, Optional<ZoneId> requestedZone, Map<Weekday, String> changedTimes) {
    final Instant now = Instant.now(clock);
    final EmployerScheduleSettings current =
        settingsRepository
            .findByEmployerIdForUpdate(employerId)
            .orElseGet(() -> defaults(employerId, now));
    final Map<Weekday, String> merged = new EnumMap<>(Weekday.class);
    merged.putAll(current.weeklyLocalTimes());
    merged.putAll(changedTimes);
    final EmployerScheduleSettings updated =
        new EmployerScheduleSettings(
            employerId,
            requestedZone.map(ZoneId::getId).orElse(current.timezone()),
            merged,
            current.createdAt(),
            now);
    settingsRepository.upsert(updated);
    logger.info(
        "schedule settings updated employerId={} timezone={} changedDays={}",
        employerId,
        updated.timezone(),
        changedTimes.keySet());
    return updated;
  }

  private RescheduleSummary rescheduleUnderLock(
      EmployerScheduleSettings saved, Map<Weekday, String> changedTimes) {
    if (changedTimes.isEmpty()) {
      return RescheduleSummary.empty();
    }
    // 一覧の読み出し失敗はそのまま伝播させ、設定の書き込みごとロールバックさせる
    return rescheduler.reschedule(saved.employerId(), saved.zoneId(), changedTimes);
  }

  private Optional<ZoneId> parseTimezone(String timezone) {
    if (timezone == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(ZoneId.of(timezone.trim()));
    } catch (DateTimeException ex) {
      throw new IllegalArgumentException("timezone is not a valid IANA zone id: " + timezone, ex);
    }
  }

  private Map<Weekday, String> parseWeeklyTimes(Map<String, String> weeklyLocalTimes) {
    final Map<Weekday, String> changed = new EnumMap<>(Weekday.class);
    weeklyLocalTimes.forEach(
        (key, value) -> {
          final Weekday weekday =
              Weekday.fromKey(key)
                  .orElseThrow(
                      () -> new IllegalArgumentException("unknown weekday in weekly_local_times: " + key));
          if (!LocalTimes.isValidSetting(value)) {
            throw new IllegalArgumentException(
                "weekly_local_times." + weekday.key() + " must be HH:MM or empty");
          }
          changed.put(weekday, LocalTimes.isDisabled(value) ? "" : value.trim());
        });
    return changed;
  }

  private EmployerScheduleSettings defaults(String employerId, Instant now) {
    return new EmployerScheduleSettings(
        employerId, scheduleProperties.defaultTimezone(), Map.of(), now, now);
  }

  private ScheduleSettingsResponse toResponse(EmployerScheduleSettings settings) {
    final Map<String, String> times = new LinkedHashMap<>();
    for (Weekday weekday : Weekday.values()) {
      times.put(weekday.key(), settings.localTimeFor(weekday));
    }
    return new ScheduleSettingsResponse(
        settings.employerId(), settings.timezone(), times, settings.updatedAt());
  }

  TransactionTemplate transactionTemplate() {
    return new TransactionTemplate(transactionManager);
  }
}
