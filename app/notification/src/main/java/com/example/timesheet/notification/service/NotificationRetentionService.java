/*
 * どこで: Notification サービス層
 * 何を: 古い終端状態の通知を削除し、取り残された claim を報告する
 * なぜ: テーブルの肥大化を防ぎ、結果を書けずに残った PROCESSING 行を手動で照合できるようにするため
 */
package com.example.timesheet.notification.service;

import com.example.timesheet.notification.config.NotificationRetentionProperties;
import com.example.timesheet.notification.repository.ScheduledNotificationRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationRetentionService.class);

  private final ScheduledNotificationRepository notificationRepository;
  private final NotificationRetentionProperties properties;
  private final NotificationMetrics metrics;
  private final Clock clock;

  public void cleanup() {
    final Instant now = Instant.now(clock);
    final Instant staleClaimThreshold = now.minus(properties.staleClaimThreshold());
    final int orphanedClaims = notificationRepository.countClaimedBefore(staleClaimThreshold);
    metrics.updateOrphanedClaims(orphanedClaims);
    if (orphanedClaims > 0) {
      logger.error(
          "notification retention found orphaned PROCESSING claims count={} claimedBefore={};"
              + " manual reconciliation required",
          orphanedClaims,
          staleClaimThreshold);
    }
    final Instant threshold = now.minus(Duration.ofDays(properties.retentionDays()));
    final int deleted = notificationRepository.deleteTerminalOlderThan(threshold);
    logger.info(
        "notification retention cleanup deleted notifications={} threshold={}", deleted, threshold);
  }
}
