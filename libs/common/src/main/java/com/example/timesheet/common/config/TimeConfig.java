/*
 * どこで: 共通設定
 * 何を: システム時計 Clock を Bean として公開する
 * なぜ: 時刻に依存する処理が現在時刻を一か所から注入で受け取れるようにするため
 */
package com.example.timesheet.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
