/*
 * どこで: Notification 配信ワーカー
 * 何を: cron で配信ランを起動し、送信トランスポートの open/close を管理する
 * なぜ: 停止時に実行中のランを待ってからトランスポートを閉じるため
 */
package com.example.timesheet.notification.service;

import com.example.timesheet.common.TraceIds;
import com.example.timesheet.notification.config.NotificationDeliveryProperties;
import com.example.timesheet.notification.transport.EmailTransport;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "notification.delivery.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class NotificationDeliveryWorker implements SmartLifecycle {

  private static final Logger logger = LoggerFactory.getLogger(NotificationDeliveryWorker.class);
  static final String MDC_RUN_ID = "delivery_run_id";

  private final NotificationDeliveryService deliveryService;
  private final EmailTransport transport;
  private final NotificationDeliveryProperties properties;
  private final ReentrantLock runLock = new ReentrantLock();

  private ThreadPoolTaskScheduler scheduler;
  private ScheduledFuture<?> scheduledTick;
  private volatile boolean running;

  @Override
  public synchronized void start() {
    if (running) {
      return;
    }
    transport.open();
    scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(1);
    scheduler.setThreadNamePrefix("notification-delivery-");
    scheduler.initialize();
    scheduledTick = scheduler.schedule(this::tick, new CronTrigger(properties.cron()));
    running = true;
    logger.info(
        "notification delivery worker started cron={} batchSize={} maxPerRun={}",
        properties.cron(),
        properties.batchSize(),
        properties.maxNotificationsPerRun());
  }

  @Override
  public synchronized void stop() {
    if (!running) {
      return;
    }
    running = false;
    if (scheduledTick != null) {
      scheduledTick.cancel(false);
    }
    awaitInFlightRun();
    scheduler.shutdown();
    try {
      transport.close();
    } catch (RuntimeException ex) {
      logger.warn("email transport close failed", ex);
    }
    logger.info("notification delivery worker stopped");
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  /** Runs one delivery pass now. A tick that overlaps a running pass is skipped. */
  public void tick() {
    if (!runLock.tryLock()) {
      logger.info("notification delivery run still in progress; skipping tick");
      return;
    }
    final String runId = TraceIds.newTraceId();
    MDC.put(MDC_RUN_ID, runId);
    try {
      deliveryService.runOnce(runId);
    } catch (RuntimeException ex) {
      logger.error("notification delivery run failed", ex);
    } finally {
      MDC.remove(MDC_RUN_ID);
      runLock.unlock();
    }
  }

  private void awaitInFlightRun() {
    final long timeoutMillis = properties.shutdownTimeout().toMillis();
    try {
      if (runLock.tryLock(timeoutMillis, TimeUnit.MILLISECONDS)) {
        runLock.unlock();
      } else {
        logger.warn(
            "notification delivery run did not finish within shutdownTimeout={}; claimed records"
                + " may stay PROCESSING",
            properties.shutdownTimeout());
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      logger.warn("interrupted while waiting for the notification delivery run", ex);
    }
  }
}
