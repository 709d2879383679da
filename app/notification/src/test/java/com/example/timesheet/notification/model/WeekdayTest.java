package com.example.timesheet.notification.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.DayOfWeek;
import org.junit.jupiter.api.Test;

class WeekdayTest {

  @Test
  void mapsBetweenKeysAndDayOfWeek() {
    for (DayOfWeek day : DayOfWeek.values()) {
      final Weekday weekday = Weekday.of(day);
      assertThat(weekday.dayOfWeek()).isEqualTo(day);
      assertThat(Weekday.fromKey(weekday.key())).contains(weekday);
    }
    assertThat(Weekday.WEDNESDAY.key()).isEqualTo("wednesday");
  }

  @Test
  void fromKeyIgnoresCaseAndRejectsUnknownNames() {
    assertThat(Weekday.fromKey(" Friday ")).contains(Weekday.FRIDAY);
    assertThat(Weekday.fromKey("fri")).isEmpty();
    assertThat(Weekday.fromKey(null)).isEmpty();
  }
}
