/*
 * どこで: Notification データアクセス
 * 何を: scheduled_notifications の登録、claim、結果記録、再スケジュールの SQL
 * なぜ: 状態変更をすべて 1 行に限定した条件付き UPDATE 1 文で行うため
 */
package com.example.timesheet.notification.repository;

import static com.example.timesheet.common.JdbcTimestampUtils.toInstant;
import static com.example.timesheet.common.JdbcTimestampUtils.toTimestamp;

import com.example.timesheet.notification.model.NotificationStatus;
import com.example.timesheet.notification.model.NotificationType;
import com.example.timesheet.notification.model.ScheduledNotification;
import com.example.timesheet.notification.model.Weekday;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ScheduledNotificationRepository {

  private static final String COLUMNS =
      """
      notification_id, employer_id, recipient_email, subject, message_body,
      notification_type, reference_day_of_week, scheduled_time_utc, status,
      attempts, last_attempt_error, locked_by, locked_at, sent_at, created_at, updated_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public UUID insert(ScheduledNotification record) {
    final String sql =
        """
        INSERT INTO scheduled_notifications (
          notification_id,
          employer_id,
          recipient_email,
          subject,
          message_body,
          notification_type,
          reference_day_of_week,
          scheduled_time_utc,
          status,
          attempts,
          last_attempt_error,
          locked_by,
          locked_at,
          sent_at,
          created_at,
          updated_at
        ) VALUES (
          :notificationId,
          :employerId,
          :recipientEmail,
          :subject,
          :messageBody,
          :notificationType,
          :referenceDayOfWeek,
          :scheduledTimeUtc,
          :status,
          :attempts,
          :lastAttemptError,
          :lockedBy,
          :lockedAt,
          :sentAt,
          :createdAt,
          :updatedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", record.notificationId())
            .addValue("employerId", record.employerId())
            .addValue("recipientEmail", record.recipientEmail())
            .addValue("subject", record.subject())
            .addValue("messageBody", record.messageBody())
            .addValue("notificationType", record.notificationType().name())
            .addValue(
                "referenceDayOfWeek",
                record.referenceDayOfWeek() == null ? null : record.referenceDayOfWeek().name())
            .addValue("scheduledTimeUtc", toTimestamp(record.scheduledTimeUtc()))
            .addValue("status", record.status().name())
            .addValue("attempts", record.attempts())
            .addValue("lastAttemptError", record.lastAttemptError())
            .addValue("lockedBy", record.lockedBy())
            .addValue("lockedAt", toTimestamp(record.lockedAt()))
            .addValue("sentAt", toTimestamp(record.sentAt()))
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("updatedAt", toTimestamp(record.updatedAt()));
    jdbcTemplate.update(sql, params);
    return record.notificationId();
  }

  public Optional<ScheduledNotification> findById(UUID notificationId) {
    final String sql =
        "SELECT " + COLUMNS + " FROM scheduled_notifications WHERE notification_id = :notificationId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("notificationId", notificationId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<ScheduledNotification> findByEmployerId(String employerId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM scheduled_notifications
            WHERE employer_id = :employerId
            ORDER BY scheduled_time_utc DESC
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("employerId", employerId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<ScheduledNotification> findPendingByEmployerId(String employerId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM scheduled_notifications
            WHERE employer_id = :employerId
              AND status = 'PENDING'
            ORDER BY scheduled_time_utc
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("employerId", employerId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /**
   * Moves up to {@code limit} due PENDING rows to PROCESSING in one statement and returns them.
   * Rows already locked by a concurrent claim are skipped, so no row is ever returned to two
   * callers.
   */
  public List<ScheduledNotification> claimDue(int limit, Instant now, String claimToken) {
    final String sql =
        """
        WITH due AS (
          SELECT notification_id
          FROM scheduled_notifications
          WHERE status = 'PENDING'
            AND scheduled_time_utc <= :now
          ORDER BY scheduled_time_utc
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE scheduled_notifications n
        SET status = 'PROCESSING',
            locked_by = :claimToken,
            locked_at = :now,
            updated_at = :now
        FROM due
        WHERE n.notification_id = due.notification_id
          AND n.status = 'PENDING'
        RETURNING n.notification_id, n.employer_id, n.recipient_email, n.subject, n.message_body,
                  n.notification_type, n.reference_day_of_week, n.scheduled_time_utc, n.status,
                  n.attempts, n.last_attempt_error, n.locked_by, n.locked_at, n.sent_at,
                  n.created_at, n.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("limit", limit)
            .addValue("claimToken", claimToken);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int markSent(UUID notificationId, Instant sentAt, String claimToken) {
    final String sql =
        """
        UPDATE scheduled_notifications
        SET status = 'SENT',
            attempts = attempts + 1,
            sent_at = :sentAt,
            updated_at = :sentAt
        WHERE notification_id = :notificationId
          AND status = 'PROCESSING'
          AND locked_by = :claimToken
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sentAt", toTimestamp(sentAt))
            .addValue("notificationId", notificationId)
            .addValue("claimToken", claimToken);
    return jdbcTemplate.update(sql, params);
  }

  public int markFailed(UUID notificationId, String error, Instant failedAt, String claimToken) {
    final String sql =
        """
        UPDATE scheduled_notifications
        SET status = 'FAILED',
            attempts = attempts + 1,
            last_attempt_error = :error,
            updated_at = :failedAt
        WHERE notification_id = :notificationId
          AND status = 'PROCESSING'
          AND locked_by = :claimToken
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("error", error)
            .addValue("failedAt", toTimestamp(failedAt))
            .addValue("notificationId", notificationId)
            .addValue("claimToken", claimToken);
    return jdbcTemplate.update(sql, params);
  }

  public int rescheduleIfPending(UUID notificationId, Instant scheduledTimeUtc, Instant now) {
    final String sql =
        """
        UPDATE scheduled_notifications
        SET scheduled_time_utc = :scheduledTimeUtc,
            attempts = 0,
            updated_at = :now
        WHERE notification_id = :notificationId
          AND status = 'PENDING'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("scheduledTimeUtc", toTimestamp(scheduledTimeUtc))
            .addValue("now", toTimestamp(now))
            .addValue("notificationId", notificationId);
    return jdbcTemplate.update(sql, params);
  }

  public int cancelIfPending(UUID notificationId, Instant now) {
    final String sql =
        """
        UPDATE scheduled_notifications
        SET status = 'CANCELLED_BY_SETTING_CHANGE',
            updated_at = :now
        WHERE notification_id = :notificationId
          AND status = 'PENDING'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("notificationId", notificationId);
    return jdbcTemplate.update(sql, params);
  }

  public int deleteTerminalOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM scheduled_notifications
        WHERE updated_at < :threshold
          AND status IN ('SENT', 'FAILED', 'CANCELLED_BY_SETTING_CHANGE')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  public int countClaimedBefore(Instant threshold) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM scheduled_notifications
        WHERE status = 'PROCESSING'
          AND locked_at < :threshold
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  private ScheduledNotification mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String referenceDay = rs.getString("reference_day_of_week");
    return new ScheduledNotification(
        UUID.fromString(rs.getString("notification_id")),
        rs.getString("employer_id"),
        rs.getString("recipient_email"),
        rs.getString("subject"),
        rs.getString("message_body"),
        NotificationType.valueOf(rs.getString("notification_type")),
        referenceDay == null ? null : Weekday.valueOf(referenceDay),
        rs.getTimestamp("scheduled_time_utc").toInstant(),
        NotificationStatus.valueOf(rs.getString("status")),
        rs.getInt("attempts"),
        rs.getString("last_attempt_error"),
        rs.getString("locked_by"),
        toInstant(rs.getTimestamp("locked_at")),
        toInstant(rs.getTimestamp("sent_at")),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
