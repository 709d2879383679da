/*
 * どこで: Notification 送信層
 * 何を: 送信内容をログに出すだけの送信実装
 * なぜ: SMTP サーバ無しで配信の状態遷移を確認するため
 */
package com.example.timesheet.notification.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "notification.transport.mode", havingValue = "log")
public class LoggingEmailTransport implements EmailTransport {

  private static final Logger logger = LoggerFactory.getLogger(LoggingEmailTransport.class);

  @Override
  public void send(String to, String subject, String html, String text) {
    // 実送信は行わず、ログに残すだけとする
    logger.info("email simulated send to={} subject={}", to, subject);
  }
}
