/*
 * どこで: Notification 送信層
 * 何を: メール送信経路の抽象
 * なぜ: ワーカーが送信経路のライフサイクルを持ち、テストでは差し替えるため
 */
package com.example.timesheet.notification.transport;

/**
 * Outbound email channel.
 *
 * <p>{@link #send} either returns normally or throws {@link EmailTransportException}; a failed
 * delivery is never reported silently. {@link #open()} is called before the first send and
 * {@link #close()} after the last one.
 */
public interface EmailTransport extends AutoCloseable {

  default void open() {}

  void send(String to, String subject, String html, String text);

  @Override
  default void close() {}
}
