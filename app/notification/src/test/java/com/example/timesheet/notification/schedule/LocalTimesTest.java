package com.example.timesheet.notification.schedule;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalTime;
import org.junit.jupiter.api.Test;

class LocalTimesTest {

  @Test
  void parsesValidTimes() {
    assertThat(LocalTimes.parse("00:00")).contains(LocalTime.MIDNIGHT);
    assertThat(LocalTimes.parse("07:05")).contains(LocalTime.of(7, 5));
    assertThat(LocalTimes.parse(" 23:59 ")).contains(LocalTime.of(23, 59));
  }

  @Test
  void rejectsOutOfRangeAndMalformedTimes() {
    assertThat(LocalTimes.parse("24:00")).isEmpty();
    assertThat(LocalTimes.parse("12:60")).isEmpty();
    assertThat(LocalTimes.parse("123:00")).isEmpty();
    assertThat(LocalTimes.parse("7:05")).isEmpty();
    assertThat(LocalTimes.parse("07:5")).isEmpty();
    assertThat(LocalTimes.parse("12-00")).isEmpty();
    assertThat(LocalTimes.parse(null)).isEmpty();
  }

  @Test
  void blankCountsAsDisabledAndValidSetting() {
    assertThat(LocalTimes.isDisabled("")).isTrue();
    assertThat(LocalTimes.isDisabled(null)).isTrue();
    assertThat(LocalTimes.isDisabled("09:00")).isFalse();
    assertThat(LocalTimes.isValidSetting("")).isTrue();
    assertThat(LocalTimes.isValidSetting("09:00")).isTrue();
    assertThat(LocalTimes.isValidSetting("9am")).isFalse();
  }
}
