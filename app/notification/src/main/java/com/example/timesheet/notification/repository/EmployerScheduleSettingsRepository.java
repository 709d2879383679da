/*
 * どこで: Notification データアクセス
 * 何を: employer_schedule_settings の読み出しと upsert
 * なぜ: 曜日別のローカル時刻を雇用主ごとに 1 つの jsonb として保存するため
 */
package com.example.timesheet.notification.repository;

import static com.example.timesheet.common.JdbcTimestampUtils.toInstant;
import static com.example.timesheet.common.JdbcTimestampUtils.toTimestamp;

import com.example.timesheet.notification.model.EmployerScheduleSettings;
import com.example.timesheet.notification.model.Weekday;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class EmployerScheduleSettingsRepository {

  private static final Logger logger =
      LoggerFactory.getLogger(EmployerScheduleSettingsRepository.class);
  private static final TypeReference<Map<String, String>> TIMES_TYPE = new TypeReference<>() {};

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public Optional<EmployerScheduleSettings> findByEmployerId(String employerId) {
    final String sql =
        """
        SELECT employer_id, timezone, weekly_local_times::text AS weekly_local_times_text,
               created_at, updated_at
        FROM employer_schedule_settings
        WHERE employer_id = :employerId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("employerId", employerId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** Same as {@link #findByEmployerId} but row-locks the settings until the transaction ends. */
  public Optional<EmployerScheduleSettings> findByEmployerIdForUpdate(String employerId) {
    final String sql =
        """
        SELECT employer_id, timezone, weekly_local_times::text AS weekly_local_times_text,
               created_at, updated_at
        FROM employer_schedule_settings
        WHERE employer_id = :employerId
        FOR UPDATE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("employerId", employerId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public void upsert(EmployerScheduleSettings settings) {
    final String sql =
        """
        INSERT INTO employer_schedule_settings (
          employer_id,
          timezone,
          weekly_local_times,
          created_at,
          updated_at
        ) VALUES (
          :employerId,
          :timezone,
          :weeklyLocalTimes::jsonb,
          :createdAt,
          :updatedAt
        )
        ON CONFLICT (employer_id) DO UPDATE
        SET timezone = EXCLUDED.timezone,
            weekly_local_times = EXCLUDED.weekly_local_times,
            updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("employerId", settings.employerId())
            .addValue("timezone", settings.timezone())
            .addValue("weeklyLocalTimes", serializeTimes(settings.weeklyLocalTimes()))
            .addValue("createdAt", toTimestamp(settings.createdAt()))
            .addValue("updatedAt", toTimestamp(settings.updatedAt()));
    jdbcTemplate.update(sql, params);
  }

  private String serializeTimes(Map<Weekday, String> weeklyLocalTimes) {
    final Map<String, String> byKey = new LinkedHashMap<>();
    weeklyLocalTimes.forEach((weekday, time) -> byKey.put(weekday.key(), time == null ? "" : time));
    try {
      return objectMapper.writeValueAsString(byKey);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("weekly local times serialization failure", ex);
    }
  }

  private Map<Weekday, String> deserializeTimes(String employerId, String json) {
    final Map<Weekday, String> times = new EnumMap<>(Weekday.class);
    if (json == null || json.isBlank()) {
      return times;
    }
    final Map<String, String> byKey;
    try {
      byKey = objectMapper.readValue(json, TIMES_TYPE);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException(
          "weekly local times parse failure employerId=" + employerId, ex);
    }
    byKey.forEach(
        (key, time) ->
            Weekday.fromKey(key)
                .ifPresentOrElse(
                    weekday -> times.put(weekday, time == null ? "" : time),
                    () ->
                        logger.warn(
                            "ignoring unknown weekday key in settings employerId={} key={}",
                            employerId,
                            key)));
    return times;
  }

  private EmployerScheduleSettings mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String employerId = rs.getString("employer_id");
    return new EmployerScheduleSettings(
        employerId,
        rs.getString("timezone"),
        deserializeTimes(employerId, rs.getString("weekly_local_times_text")),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
