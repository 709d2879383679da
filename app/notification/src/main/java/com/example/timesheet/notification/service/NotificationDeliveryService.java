/*
 * どこで: Notification サービス層
 * 何を: 1 回の配信ラン: 期限到来分をバッチで claim し、並行送信して結果を記録する
 * なぜ: バッチ内の並行数と 1 ランの処理量を抑え、1 件の失敗を他に波及させないため
 */
package com.example.timesheet.notification.service;

import com.example.timesheet.common.TraceIds;
import com.example.timesheet.notification.config.NotificationDeliveryConfig;
import com.example.timesheet.notification.config.NotificationDeliveryProperties;
import com.example.timesheet.notification.model.NotificationStatus;
import com.example.timesheet.notification.model.ScheduledNotification;
import com.example.timesheet.notification.repository.ScheduledNotificationRepository;
import com.example.timesheet.notification.transport.EmailTransport;
import com.google.common.annotations.VisibleForTesting;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;

@Service
public class NotificationDeliveryService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationDeliveryService.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";

  private final ScheduledNotificationRepository notificationRepository;
  private final EmailTransport transport;
  private final NotificationDeliveryProperties properties;
  private final NotificationMetrics metrics;
  private final Clock clock;
  private final Executor sendExecutor;
  private final String workerId;

  public NotificationDeliveryService(
      ScheduledNotificationRepository notificationRepository,
      EmailTransport transport,
      NotificationDeliveryProperties properties,
      NotificationMetrics metrics,
      Clock clock,
      @Qualifier(NotificationDeliveryConfig.SEND_EXECUTOR) Executor sendExecutor) {
    this.notificationRepository = notificationRepository;
    this.transport = transport;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
    this.sendExecutor = sendExecutor;
    this.workerId = resolveWorkerId(properties.workerId());
  }

  public DeliveryRunSummary runOnce() {
    return runOnce(TraceIds.newTraceId());
  }

  /**
   * Drains due notifications until the queue has less than a full batch left or the run has
   * processed max-notifications-per-run records. Batches run one after another; the sends of a
   * batch run concurrently and are all joined before the next claim.
   */
  public DeliveryRunSummary runOnce(String runId) {
    final String claimToken = workerId + "/" + runId;
    final int batchSize = properties.batchSize();
    final int maxPerRun = properties.maxNotificationsPerRun();
    int processed = 0;
    int batches = 0;
    int sent = 0;
    int failed = 0;
    while (processed < maxPerRun) {
      final int limit = Math.min(batchSize, maxPerRun - processed);
      final List<ScheduledNotification> claimed;
      try {
        claimed = notificationRepository.claimDue(limit, Instant.now(clock), claimToken);
      } catch (DataAccessException ex) {
        // claim は単一 SQL なので失敗時に PROCESSING へ移った行は無い。次の tick で再試行する
        logger.error("notification claim failed; ending run claimToken={}", claimToken, ex);
        break;
      }
      if (claimed.isEmpty()) {
        break;
      }
      batches++;
      for (NotificationStatus outcome : deliverBatch(claimed, claimToken)) {
        if (outcome == NotificationStatus.SENT) {
          sent++;
        } else {
          failed++;
        }
      }
      processed += claimed.size();
      if (claimed.size() < batchSize) {
        break;
      }
    }
    final boolean capped = processed >= maxPerRun;
    if (capped) {
      metrics.recordRunCapped();
      logger.warn(
          "notification run reached max-notifications-per-run={}; remaining due work waits for the"
              + " next tick",
          maxPerRun);
    }
    if (processed > 0) {
      logger.info(
          "notification run finished batches={} processed={} sent={} failed={}",
          batches,
          processed,
          sent,
          failed);
    }
    return new DeliveryRunSummary(batches, processed, sent, failed, capped);
  }

  private List<NotificationStatus> deliverBatch(
      List<ScheduledNotification> claimed, String claimToken) {
    final Map<String, String> mdc = MDC.getCopyOfContextMap();
    final List<CompletableFuture<NotificationStatus>> futures = new ArrayList<>(claimed.size());
    for (ScheduledNotification record : claimed) {
      futures.add(submit(record, claimToken, mdc));
    }
    CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();
    return futures.stream().map(CompletableFuture::join).toList();
  }

  private CompletableFuture<NotificationStatus> submit(
      ScheduledNotification record, String claimToken, Map<String, String> mdc) {
    try {
      return CompletableFuture.supplyAsync(
          () -> deliverWithMdc(record, claimToken, mdc), sendExecutor);
    } catch (RejectedExecutionException ex) {
      // 取得済みの行を PROCESSING のまま残さないよう呼び出しスレッドで送信する
      logger.warn("send executor rejected notification id={}; sending inline", record.notificationId());
      return CompletableFuture.completedFuture(deliver(record, claimToken));
    }
  }

  private NotificationStatus deliverWithMdc(
      ScheduledNotification record, String claimToken, Map<String, String> mdc) {
    if (mdc != null) {
      MDC.setContextMap(mdc);
    }
    try {
      return deliver(record, claimToken);
    } finally {
      MDC.clear();
    }
  }

  /** Sends one claimed record and records the outcome. Never throws. */
  @VisibleForTesting
  NotificationStatus deliver(ScheduledNotification record, String claimToken) {
    String error = null;
    try {
      transport.send(
          record.recipientEmail(),
          record.subject(),
          toHtml(record.messageBody()),
          record.messageBody());
    } catch (RuntimeException ex) {
      error = describe(ex);
      logger.warn(
          "notification delivery failed id={} to={}", record.notificationId(), record.recipientEmail(), ex);
    }
    final NotificationStatus outcome = error == null ? NotificationStatus.SENT : NotificationStatus.FAILED;
    final Instant now = Instant.now(clock);
    try {
      final int updated =
          outcome == NotificationStatus.SENT
              ? notificationRepository.markSent(record.notificationId(), now, claimToken)
              : notificationRepository.markFailed(
                  record.notificationId(), truncateError(error), now, claimToken);
      if (updated == 0) {
        logger.warn(
            "notification outcome not recorded because the claim was lost id={} outcome={}",
            record.notificationId(),
            outcome);
      }
    } catch (DataAccessException ex) {
      // 送信は取り消せないため CRITICAL として残す。行は PROCESSING のままになる
      logger.error(
          "CRITICAL notification outcome could not be persisted after send attempt id={} outcome={}"
              + " claimToken={}",
          record.notificationId(),
          outcome,
          claimToken,
          ex);
    }
    metrics.recordDeliveryResult(outcome == NotificationStatus.SENT ? "sent" : "failed");
    if (outcome == NotificationStatus.SENT) {
      metrics.recordDeliveryDelay(record.scheduledTimeUtc(), now);
    }
    return outcome;
  }

  @VisibleForTesting
  static String toHtml(String messageBody) {
    if (messageBody == null) {
      return "";
    }
    return HtmlUtils.htmlEscape(messageBody).replace("\r\n", "\n").replace("\n", "<br/>");
  }

  private String describe(RuntimeException ex) {
    final String message = ex.getMessage();
    return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
  }

  private String truncateError(String message) {
    final int maxLength = properties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }

  @VisibleForTesting
  String workerId() {
    return workerId;
  }

  @VisibleForTesting
  static String resolveWorkerId(String configured) {
    if (configured != null && !configured.isBlank()) {
      return configured;
    }
    final String env = System.getenv(HOSTNAME_ENV);
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }
}
