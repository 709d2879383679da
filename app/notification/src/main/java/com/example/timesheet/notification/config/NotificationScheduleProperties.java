/*
 * どこで: Notification アプリ設定のバインド
 * 何を: スケジュール設定の無い雇用主に適用する既定値
 * なぜ: 新規の雇用主でも曜日別時刻を解釈するタイムゾーンが必要なため
 */
package com.example.timesheet.notification.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import java.time.DateTimeException;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.schedule")
@Validated
public record NotificationScheduleProperties(@NotBlank String defaultTimezone) {

  @AssertTrue(message = "notification.schedule.default-timezone must be a valid IANA zone id")
  public boolean isDefaultTimezoneValid() {
    if (defaultTimezone == null || defaultTimezone.isBlank()) {
      return true;
    }
    try {
      ZoneId.of(defaultTimezone);
      return true;
    } catch (DateTimeException ex) {
      return false;
    }
  }
}
