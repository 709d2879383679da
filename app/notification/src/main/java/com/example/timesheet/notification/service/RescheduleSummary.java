package com.example.timesheet.notification.service;

/**
 * Outcome counts of one rescheduling pass.
 *
 * @param rescheduled records moved to a new instant (attempts reset)
 * @param cancelled records moved to CANCELLED_BY_SETTING_CHANGE
 * @param unchanged records whose recomputed instant equals the stored one
 * @param untouched records whose effective weekday was not part of the change
 * @param skipped conditional updates that matched nothing because the record left PENDING
 * @param failed records whose update threw
 */
public record RescheduleSummary(
    int rescheduled, int cancelled, int unchanged, int untouched, int skipped, int failed) {

  public static RescheduleSummary empty() {
    return new RescheduleSummary(0, 0, 0, 0, 0, 0);
  }
}
