/*
 * どこで: 共通ユーティリティ
 * 何を: Instant を JDBC へ Timestamp として明示的にバインドする
 * なぜ: PostgreSQL ドライバが Instant の SQL 型を推論できない場合があるため
 */
package com.example.timesheet.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instant is UTC, so Timestamp.from keeps the value in UTC regardless of the DB session zone.
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
