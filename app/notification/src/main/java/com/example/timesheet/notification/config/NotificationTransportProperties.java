/*
 * どこで: Notification アプリ設定のバインド
 * 何を: メール送信方式と送信元アドレスを選ぶ
 * なぜ: ローカル開発では実 SMTP サーバの代わりにログへ出すため
 */
package com.example.timesheet.notification.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.transport")
@Validated
public record NotificationTransportProperties(
    @NotNull Mode mode,
    @NotBlank String from,
    boolean verifyOnOpen) {

  public enum Mode {
    LOG,
    SMTP
  }
}
