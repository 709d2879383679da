/*
 * どこで: Notification サービス層
 * 何を: 曜日別時刻の変更後に PENDING 通知を再計算またはキャンセルする
 * なぜ: 保存済みの UTC 時刻を雇用主のローカルスケジュールに追従させるため
 */
package com.example.timesheet.notification.service;

import com.example.timesheet.notification.model.ScheduledNotification;
import com.example.timesheet.notification.model.Weekday;
import com.example.timesheet.notification.repository.ScheduledNotificationRepository;
import com.example.timesheet.notification.schedule.ScheduleCalculator;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class NotificationRescheduler {

  private static final Logger logger = LoggerFactory.getLogger(NotificationRescheduler.class);

  private final ScheduledNotificationRepository notificationRepository;
  private final ScheduleCalculator scheduleCalculator;
  private final NotificationMetrics metrics;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;

  /**
   * Applies a weekly-time change to the employer's PENDING notifications.
   *
   * <p>A record is affected only when its effective local weekday (its UTC instant viewed in
   * {@code timezone}) is a key of {@code changedTimes}. Affected records get the next occurrence
   * of the new time with attempts reset, or are cancelled when the day is now disabled. Each
   * write is conditional on the record still being PENDING and runs in its own nested
   * transaction, so a failing write rolls back to its savepoint and does not stop the pass or
   * poison a surrounding settings transaction.
   *
   * @param changedTimes weekday to new {@code "HH:MM"} value, or empty/null for disabled
   */
  public RescheduleSummary reschedule(
      String employerId, ZoneId timezone, Map<Weekday, String> changedTimes) {
    if (changedTimes == null || changedTimes.isEmpty()) {
      return RescheduleSummary.empty();
    }
    final Instant now = Instant.now(clock);
    final List<ScheduledNotification> pending =
        notificationRepository.findPendingByEmployerId(employerId);
    int rescheduled = 0;
    int cancelled = 0;
    int unchanged = 0;
    int untouched = 0;
    int skipped = 0;
    int failed = 0;
    for (ScheduledNotification record : pending) {
      final Weekday effectiveDay =
          Weekday.of(record.scheduledTimeUtc().atZone(timezone).getDayOfWeek());
      if (!changedTimes.containsKey(effectiveDay)) {
        untouched++;
        continue;
      }
      final Optional<Instant> next =
          scheduleCalculator.nextOccurrenceUtc(
              effectiveDay.key(), changedTimes.get(effectiveDay), timezone.getId(), now);
      if (next.isPresent() && next.get().equals(record.scheduledTimeUtc())) {
        unchanged++;
        continue;
      }
      try {
        final int updated = writeIsolated(record, next, now);
        if (updated == 0) {
          skipped++;
          logger.info(
              "reschedule skipped because notification left PENDING id={} employerId={}",
              record.notificationId(),
              employerId);
        } else if (next.isPresent()) {
          rescheduled++;
          logger.debug(
              "notification rescheduled id={} from={} to={}",
              record.notificationId(),
              record.scheduledTimeUtc(),
              next.get());
        } else {
          cancelled++;
          logger.debug(
              "notification cancelled by setting change id={} weekday={}",
              record.notificationId(),
              effectiveDay.key());
        }
      } catch (DataAccessException ex) {
        failed++;
        logger.error(
            "reschedule failed id={} employerId={}; continuing with remaining records",
            record.notificationId(),
            employerId,
            ex);
      }
    }
    final RescheduleSummary summary =
        new RescheduleSummary(rescheduled, cancelled, unchanged, untouched, skipped, failed);
    recordMetrics(summary);
    logger.info(
        "reschedule finished employerId={} changedDays={} rescheduled={} cancelled={} unchanged={}"
            + " untouched={} skipped={} failed={}",
        employerId,
        changedTimes.keySet(),
        rescheduled,
        cancelled,
        unchanged,
        untouched,
        skipped,
        failed);
    return summary;
  }

  private int writeIsolated(ScheduledNotification record, Optional<Instant> next, Instant now) {
    final Integer updated =
        perRecordTransaction()
            .execute(
                status ->
                    next.isPresent()
                        ? notificationRepository.rescheduleIfPending(
                            record.notificationId(), next.get(), now)
                        : notificationRepository.cancelIfPending(record.notificationId(), now));
    return updated == null ? 0 : updated;
  }

  // 外側に設定更新のトランザクションがあれば savepoint、無ければ単独トランザクションになる
  private TransactionTemplate perRecordTransaction() {
    final TransactionTemplate template = new TransactionTemplate(transactionManager);
    template.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
    return template;
  }

  private void recordMetrics(RescheduleSummary summary) {
    metrics.recordRescheduleOutcome("rescheduled", summary.rescheduled());
    metrics.recordRescheduleOutcome("cancelled", summary.cancelled());
    metrics.recordRescheduleOutcome("unchanged", summary.unchanged());
    metrics.recordRescheduleOutcome("skipped", summary.skipped());
    metrics.recordRescheduleOutcome("failed", summary.failed());
  }
}
