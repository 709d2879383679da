/*
 * どこで: Notification 送信層
 * 何を: Spring の JavaMailSender で multipart(テキスト + HTML) メールを送る
 * なぜ: 本番の送信経路。タイムアウトは spring.mail.properties で設定する
 */
package com.example.timesheet.notification.transport;

import com.example.timesheet.notification.config.NotificationTransportProperties;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import java.nio.charset.StandardCharsets;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "notification.transport.mode", havingValue = "smtp")
public class SmtpEmailTransport implements EmailTransport {

  private static final Logger logger = LoggerFactory.getLogger(SmtpEmailTransport.class);

  private final JavaMailSender mailSender;
  private final NotificationTransportProperties properties;

  @Override
  public void open() {
    if (!properties.verifyOnOpen()) {
      return;
    }
    if (!(mailSender instanceof JavaMailSenderImpl impl)) {
      return;
    }
    try {
      impl.testConnection();
      logger.info("smtp transport verified host={} port={}", impl.getHost(), impl.getPort());
    } catch (MessagingException ex) {
      // 起動は継続し、個々の送信失敗として記録させる
      logger.error("smtp transport verification failed host={}", impl.getHost(), ex);
    }
  }

  @Override
  public void send(String to, String subject, String html, String text) {
    try {
      final MimeMessage message = mailSender.createMimeMessage();
      final MimeMessageHelper helper =
          new MimeMessageHelper(message, true, StandardCharsets.UTF_8.name());
      helper.setFrom(properties.from());
      helper.setTo(to);
      helper.setSubject(subject);
      helper.setText(text, html);
      mailSender.send(message);
    } catch (MessagingException | MailException ex) {
      throw new EmailTransportException(describe(ex), ex);
    }
  }

  @Override
  public void close() {
    logger.info("smtp transport closed");
  }

  private String describe(Exception ex) {
    final String message = ex.getMessage();
    return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
  }
}
