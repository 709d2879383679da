/*
 * どこで: Notification クリーンアップワーカー
 * 何を: 保持期間の削除処理を定期実行する
 * なぜ: 削除と滞留 claim の報告を手作業なしで回すため
 */
package com.example.timesheet.notification.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "notification.retention.enabled", havingValue = "true")
public class NotificationRetentionWorker {

  private final NotificationRetentionService retentionService;

  @Scheduled(fixedDelayString = "${notification.retention.cleanup-interval}")
  public void run() {
    retentionService.cleanup();
  }
}
