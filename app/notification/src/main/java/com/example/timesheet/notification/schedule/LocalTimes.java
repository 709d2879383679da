/*
 * どこで: Notification スケジュール計算
 * 何を: "HH:MM" 形式のローカル配信時刻を解釈する
 * なぜ: 設定、API 検証、計算処理で同じ形式を共有するため
 */
package com.example.timesheet.notification.schedule;

import java.time.LocalTime;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class LocalTimes {

  /** Exactly two hour digits and two minute digits, 00:00 through 23:59. */
  public static final String HH_MM_REGEX = "^(\\d{2}):(\\d{2})$";

  private static final Pattern HH_MM = Pattern.compile(HH_MM_REGEX);

  private LocalTimes() {}

  public static boolean isDisabled(String value) {
    return value == null || value.isBlank();
  }

  public static Optional<LocalTime> parse(String value) {
    if (value == null) {
      return Optional.empty();
    }
    final Matcher matcher = HH_MM.matcher(value.trim());
    if (!matcher.matches()) {
      return Optional.empty();
    }
    final int hours = Integer.parseInt(matcher.group(1));
    final int minutes = Integer.parseInt(matcher.group(2));
    if (hours > 23 || minutes > 59) {
      return Optional.empty();
    }
    return Optional.of(LocalTime.of(hours, minutes));
  }

  /** Empty/blank (disabled) or a parseable "HH:MM". */
  public static boolean isValidSetting(String value) {
    return isDisabled(value) || parse(value).isPresent();
  }
}
