/*
 * どこで: Notification アプリ設定のバインド
 * 何を: 配信ワーカーのトリガー、バッチ上限、停止設定を保持する
 * なぜ: バッチサイズや 1 ラン上限、tick 間隔はコードではなく運用で調整するため
 */
package com.example.timesheet.notification.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.delivery")
@Validated
public record NotificationDeliveryProperties(
    boolean enabled,
    @NotBlank String cron,
    @Positive int batchSize,
    @Positive int maxNotificationsPerRun,
    @Positive int errorMessageMaxLength,
    @NotNull Duration shutdownTimeout,
    String workerId) {

  @AssertTrue(message = "notification.delivery.max-notifications-per-run must be >= batch-size")
  public boolean isRunCapAtLeastOneBatch() {
    return maxNotificationsPerRun >= batchSize;
  }

  @AssertTrue(message = "notification.delivery.shutdown-timeout must not be negative")
  public boolean isShutdownTimeoutValid() {
    // null は @NotNull で検出する
    return shutdownTimeout == null || !shutdownTimeout.isNegative();
  }
}
