/*
 * どこで: Notification サービス層
 * 何を: 配信結果、配信遅延、上限到達ラン、再スケジュール結果、滞留 claim を記録する
 * なぜ: ワーカーと再スケジュール処理は呼び出し元へ返さずログとメトリクスだけで報告するため
 */
package com.example.timesheet.notification.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class NotificationMetrics {

  private static final String METRIC_DELIVERY_TOTAL = "notification.delivery.total";
  private static final String METRIC_DELIVERY_DELAY = "notification.delivery.delay";
  private static final String METRIC_RUN_CAPPED_TOTAL = "notification.delivery.run.capped.total";
  private static final String METRIC_RESCHEDULE_TOTAL = "notification.reschedule.total";
  private static final String METRIC_ORPHANED_CLAIMS = "notification.orphaned.claims.current";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger orphanedClaims = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> deliveryCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> rescheduleCounters = new ConcurrentHashMap<>();
  private final Counter runCappedCounter;
  private final Timer deliveryDelayTimer;

  public NotificationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_ORPHANED_CLAIMS, orphanedClaims, AtomicInteger::get)
        .description("PROCESSING notifications claimed longer ago than the stale threshold")
        .register(meterRegistry);
    this.runCappedCounter =
        Counter.builder(METRIC_RUN_CAPPED_TOTAL)
            .description("Delivery runs that stopped at max-notifications-per-run")
            .register(meterRegistry);
    this.deliveryDelayTimer =
        Timer.builder(METRIC_DELIVERY_DELAY)
            .description("Delay between scheduled_time_utc and sent_at")
            .register(meterRegistry);
  }

  public void recordDeliveryResult(String result) {
    deliveryCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_DELIVERY_TOTAL)
                    .description("Notification delivery outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordDeliveryDelay(Instant scheduledAt, Instant sentAt) {
    if (scheduledAt == null || sentAt == null || sentAt.isBefore(scheduledAt)) {
      return;
    }
    deliveryDelayTimer.record(Duration.between(scheduledAt, sentAt));
  }

  public void recordRunCapped() {
    runCappedCounter.increment();
  }

  public void recordRescheduleOutcome(String outcome, int count) {
    if (count <= 0) {
      return;
    }
    rescheduleCounters
        .computeIfAbsent(
            outcome,
            ignored ->
                Counter.builder(METRIC_RESCHEDULE_TOTAL)
                    .description("Pending notification outcomes of settings changes")
                    .tags(Tags.of("outcome", outcome))
                    .register(meterRegistry))
        .increment(count);
  }

  public void updateOrphanedClaims(int count) {
    orphanedClaims.set(Math.max(count, 0));
  }
}
