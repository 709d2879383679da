/*
 * どこで: Notification 送信層
 * 何を: 特定の宛先で失敗させる CI/テスト専用の送信実装
 * なぜ: 実送信経路に触れずに FAILED を一通り再現するため
 */
package com.example.timesheet.notification.transport;

import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Component
@Primary
@RequiredArgsConstructor
@Profile({"ci", "test"})
@ConditionalOnProperty(
    prefix = "notification.transport.failure-injection",
    name = "enabled",
    havingValue = "true")
public class FailureInjectingEmailTransport implements EmailTransport {

  private final LoggingEmailTransport delegate;

  @Value("${notification.transport.failure-injection.recipient-prefix:}")
  private String recipientPrefix;

  @Override
  public void send(String to, String subject, String html, String text) {
    if (shouldInjectFailure(to)) {
      throw new EmailTransportException("email delivery failure injection matched to=" + to);
    }
    delegate.send(to, subject, html, text);
  }

  private boolean shouldInjectFailure(String to) {
    if (recipientPrefix == null || recipientPrefix.isBlank()) {
      return false;
    }
    return to != null && to.startsWith(recipientPrefix);
  }
}
