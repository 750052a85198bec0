/*
 * どこで: Alerting データアクセス
 * 何を: alert_schedules の読み書きと実行 lease の取得/解放
 * なぜ: JVM をまたいでも同一スケジュールの実行が重ならないのは lease の claim によるため
 */
package com.example.alerting.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.alerting.model.AlertSchedule;
import com.example.alerting.model.AlertType;
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
public class AlertScheduleRepository {

  private static final String COLUMNS =
      """
      schedule_id, name, alert_type, trigger_window_days, frequency_days, template_id,
      station_filter, preferred_provider_id, is_active, last_run, next_run,
      locked_by, lease_until, created_at, updated_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public UUID insert(AlertSchedule schedule) {
    final String sql =
        """
        INSERT INTO alert_schedules (
          schedule_id,
          name,
          alert_type,
          trigger_window_days,
          frequency_days,
          template_id,
          station_filter,
          preferred_provider_id,
          is_active,
          last_run,
          next_run,
          created_at,
          updated_at
        ) VALUES (
          :scheduleId,
          :name,
          :alertType,
          :triggerWindowDays,
          :frequencyDays,
          :templateId,
          :stationFilter,
          :preferredProviderId,
          :active,
          :lastRun,
          :nextRun,
          :createdAt,
          :updatedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("scheduleId", schedule.scheduleId())
            .addValue("name", schedule.name())
            .addValue("alertType", schedule.alertType().name())
            .addValue("triggerWindowDays", schedule.triggerWindowDays())
            .addValue("frequencyDays", schedule.frequencyDays())
            .addValue("templateId", schedule.templateId())
            .addValue("stationFilter", schedule.stationFilter())
            .addValue("preferredProviderId", schedule.preferredProviderId())
            .addValue("active", schedule.active())
            .addValue("lastRun", toTimestamp(schedule.lastRun()))
            .addValue("nextRun", toTimestamp(schedule.nextRun()))
            .addValue("createdAt", toTimestamp(schedule.createdAt()))
            .addValue("updatedAt", toTimestamp(schedule.updatedAt()));
    jdbcTemplate.update(sql, params);
    return schedule.scheduleId();
  }

  public Optional<AlertSchedule> findById(UUID scheduleId) {
    final String sql = "SELECT " + COLUMNS + " FROM alert_schedules WHERE schedule_id = :scheduleId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("scheduleId", scheduleId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<AlertSchedule> findAll() {
    final String sql = "SELECT " + COLUMNS + " FROM alert_schedules ORDER BY created_at, name";
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  /** next_run を過ぎ、有効な lease を誰も保持していないアクティブなスケジュール。 */
  public List<UUID> findDueIds(Instant now, int limit) {
    final String sql =
        """
        SELECT schedule_id
        FROM alert_schedules
        WHERE is_active
          AND next_run <= :now
          AND (lease_until IS NULL OR lease_until <= :now)
        ORDER BY next_run
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now)).addValue("limit", limit);
    return jdbcTemplate.query(
        sql, params, (rs, rowNum) -> UUID.fromString(rs.getString("schedule_id")));
  }

  public int countDue(Instant now) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM alert_schedules
        WHERE is_active
          AND next_run <= :now
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("now", toTimestamp(now));
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  /**
   * 実行 lease が空いているか期限切れなら取得する。
   *
   * @return 取得した行。別の実行が有効な lease を保持していれば空
   */
  public Optional<AlertSchedule> claim(
      UUID scheduleId, Instant now, Instant leaseUntil, String lockedBy) {
    final String sql =
        """
        UPDATE alert_schedules
        SET locked_by = :lockedBy,
            lease_until = :leaseUntil
        WHERE schedule_id = :scheduleId
          AND (lease_until IS NULL OR lease_until <= :now)
        RETURNING
        """
            + COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("scheduleId", scheduleId)
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** lease の保持者に限り、実行時刻を進めて lease を解放する。 */
  public int completeRun(UUID scheduleId, Instant lastRun, Instant nextRun, String lockedBy) {
    final String sql =
        """
        UPDATE alert_schedules
        SET last_run = :lastRun,
            next_run = :nextRun,
            updated_at = :lastRun,
            locked_by = NULL,
            lease_until = NULL
        WHERE schedule_id = :scheduleId
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("scheduleId", scheduleId)
            .addValue("lastRun", toTimestamp(lastRun))
            .addValue("nextRun", toTimestamp(nextRun))
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int releaseLease(UUID scheduleId, String lockedBy) {
    final String sql =
        """
        UPDATE alert_schedules
        SET locked_by = NULL,
            lease_until = NULL
        WHERE schedule_id = :scheduleId
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("scheduleId", scheduleId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public int updateActive(UUID scheduleId, boolean active, Instant now) {
    final String sql =
        """
        UPDATE alert_schedules
        SET is_active = :active,
            updated_at = :now
        WHERE schedule_id = :scheduleId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("scheduleId", scheduleId)
            .addValue("active", active)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  private AlertSchedule mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String preferredProviderId = rs.getString("preferred_provider_id");
    return new AlertSchedule(
        UUID.fromString(rs.getString("schedule_id")),
        rs.getString("name"),
        AlertType.valueOf(rs.getString("alert_type")),
        rs.getInt("trigger_window_days"),
        rs.getInt("frequency_days"),
        UUID.fromString(rs.getString("template_id")),
        rs.getString("station_filter"),
        preferredProviderId == null ? null : UUID.fromString(preferredProviderId),
        rs.getBoolean("is_active"),
        toInstant(rs.getTimestamp("last_run")),
        toInstant(rs.getTimestamp("next_run")),
        rs.getString("locked_by"),
        toInstant(rs.getTimestamp("lease_until")),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
