/*
 * どこで: Notification スケジュール計算
 * 何を: (曜日, ローカル時刻, タイムゾーン, 現在時刻) から次の UTC 時刻を求める
 * なぜ: 曜日は雇用主のローカル基準だが、保存する時刻は UTC のため
 */
package com.example.timesheet.notification.schedule;

import com.example.timesheet.notification.model.Weekday;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Stateless recurrence calculator.
 *
 * <p>The returned instant, viewed in the given zone, falls on the requested weekday at the
 * requested local time and is never before {@code now}. Local times inside a DST gap are moved
 * forward by the length of the gap; ambiguous local times use the earlier offset.
 *
 * <p>Malformed input is treated like a disabled day: the result is empty and the input is
 * logged, nothing is thrown.
 */
@Component
public class ScheduleCalculator {

  private static final Logger logger = LoggerFactory.getLogger(ScheduleCalculator.class);

  public Optional<Instant> nextOccurrenceUtc(
      String weekday, String localTimeOrEmpty, String timezone, Instant now) {
    if (LocalTimes.isDisabled(localTimeOrEmpty)) {
      return Optional.empty();
    }
    final Optional<Weekday> targetDay = Weekday.fromKey(weekday);
    if (targetDay.isEmpty()) {
      logger.warn("schedule calculation skipped: invalid weekday={}", weekday);
      return Optional.empty();
    }
    final Optional<LocalTime> time = LocalTimes.parse(localTimeOrEmpty);
    if (time.isEmpty()) {
      logger.warn(
          "schedule calculation skipped: invalid time={} weekday={}", localTimeOrEmpty, weekday);
      return Optional.empty();
    }
    final Optional<ZoneId> zone = resolveZone(timezone);
    if (zone.isEmpty()) {
      logger.warn("schedule calculation skipped: invalid timezone={}", timezone);
      return Optional.empty();
    }
    return Optional.of(nextOccurrenceUtc(targetDay.get(), time.get(), zone.get(), now));
  }

  public Instant nextOccurrenceUtc(Weekday weekday, LocalTime time, ZoneId zone, Instant now) {
    final LocalDate today = now.atZone(zone).toLocalDate();
    final LocalDate firstCandidateDate =
        today.with(TemporalAdjusters.nextOrSame(weekday.dayOfWeek()));
    final ZonedDateTime candidate = ZonedDateTime.of(firstCandidateDate, time, zone);
    if (!candidate.toInstant().isBefore(now)) {
      return candidate.toInstant();
    }
    // Today's slot already passed: the same weekday one week later.
    final LocalDate nextWeek = firstCandidateDate.with(TemporalAdjusters.next(weekday.dayOfWeek()));
    return ZonedDateTime.of(nextWeek, time, zone).toInstant();
  }

  private Optional<ZoneId> resolveZone(String timezone) {
    if (timezone == null || timezone.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(ZoneId.of(timezone.trim()));
    } catch (DateTimeException ex) {
      return Optional.empty();
    }
  }
}
