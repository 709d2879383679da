/*
 * どこで: Notification API
 * 何を: 無効化された曜日への登録時に返す 409
 * なぜ: 配信時刻の無い曜日に対して時刻をでっち上げないため
 */
package com.example.timesheet.notification.api;

public class ScheduleDisabledException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public ScheduleDisabledException(String message) {
    super(message);
  }
}
