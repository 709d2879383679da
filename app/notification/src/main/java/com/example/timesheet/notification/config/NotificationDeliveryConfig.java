/*
 * どこで: Notification 配信設定
 * 何を: 1 バッチ分の送信を実行する上限付き Executor を定義する
 * なぜ: バッチ内の並行送信数が設定したバッチサイズを超えないようにするため
 */
package com.example.timesheet.notification.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class NotificationDeliveryConfig {

  public static final String SEND_EXECUTOR = "notificationSendExecutor";

  @Bean(name = SEND_EXECUTOR)
  public ThreadPoolTaskExecutor notificationSendExecutor(NotificationDeliveryProperties properties) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setThreadNamePrefix("notification-send-");
    executor.setCorePoolSize(properties.batchSize());
    executor.setMaxPoolSize(properties.batchSize());
    // 前バッチのスレッド返却が遅れても reject しないよう 1 バッチ分だけキューを持つ
    executor.setQueueCapacity(properties.batchSize());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationMillis(properties.shutdownTimeout().toMillis());
    return executor;
  }
}
