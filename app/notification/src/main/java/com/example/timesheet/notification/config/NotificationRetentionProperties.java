/*
 * どこで: Notification アプリ設定のバインド
 * 何を: 保持期間の削除と滞留 claim 報告の設定を保持する
 * なぜ: 保持ポリシーと実行間隔を環境ごとに調整できるようにするため
 */
package com.example.timesheet.notification.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.retention")
public record NotificationRetentionProperties(
                boolean enabled,
                int retentionDays,
                Duration cleanupInterval,
                Duration staleClaimThreshold) {
}
