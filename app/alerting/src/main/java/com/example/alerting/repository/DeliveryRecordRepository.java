/*
 * どこで: Alerting データアクセス
 * 何を: delivery_records への追記と、重複抑止/履歴向けの検索
 * なぜ: 行は更新も削除もせず、台帳をそのまま監査証跡にするため
 */
package com.example.alerting.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.alerting.model.DeliveryErrorKind;
import com.example.alerting.model.DeliveryRecord;
import com.example.alerting.model.DeliveryStatus;
import com.example.alerting.model.HistoryFilter;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DeliveryRecordRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public UUID insert(DeliveryRecord record) {
    final String sql =
        """
        INSERT INTO delivery_records (
          delivery_id,
          schedule_id,
          entity_id,
          recipient,
          rendered_body,
          provider_id,
          status,
          error_kind,
          error_message,
          provider_message_id,
          segment_count,
          cost,
          created_at
        ) VALUES (
          :deliveryId,
          :scheduleId,
          :entityId,
          :recipient,
          :renderedBody,
          :providerId,
          :status,
          :errorKind,
          :errorMessage,
          :providerMessageId,
          :segmentCount,
          :cost,
          :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("deliveryId", record.deliveryId())
            .addValue("scheduleId", record.scheduleId())
            .addValue("entityId", record.entityId())
            .addValue("recipient", record.recipient())
            .addValue("renderedBody", record.renderedBody())
            .addValue("providerId", record.providerId())
            .addValue("status", record.status().name())
            .addValue("errorKind", record.errorKind() == null ? null : record.errorKind().name())
            .addValue("errorMessage", record.errorMessage())
            .addValue("providerMessageId", record.providerMessageId())
            .addValue("segmentCount", record.segmentCount())
            .addValue("cost", record.cost())
            .addValue("createdAt", toTimestamp(record.createdAt()));
    jdbcTemplate.update(sql, params);
    return record.deliveryId();
  }

  public boolean existsSentSince(UUID scheduleId, String entityId, Instant since) {
    final String sql =
        """
        SELECT EXISTS (
          SELECT 1
          FROM delivery_records
          WHERE schedule_id = :scheduleId
            AND entity_id = :entityId
            AND status = 'SENT'
            AND created_at >= :since
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("scheduleId", scheduleId)
            .addValue("entityId", entityId)
            .addValue("since", toTimestamp(since));
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }

  public List<DeliveryRecord> find(HistoryFilter filter) {
    final StringBuilder sql =
        new StringBuilder(
            """
            SELECT delivery_id, schedule_id, entity_id, recipient, rendered_body, provider_id,
                   status, error_kind, error_message, provider_message_id, segment_count, cost,
                   created_at
            FROM delivery_records
            WHERE 1 = 1
            """);
    final MapSqlParameterSource params = new MapSqlParameterSource();
    if (filter.scheduleId() != null) {
      sql.append(" AND schedule_id = :scheduleId");
      params.addValue("scheduleId", filter.scheduleId());
    }
    if (filter.entityId() != null && !filter.entityId().isBlank()) {
      sql.append(" AND entity_id = :entityId");
      params.addValue("entityId", filter.entityId());
    }
    if (filter.status() != null) {
      sql.append(" AND status = :status");
      params.addValue("status", filter.status().name());
    }
    if (filter.from() != null) {
      sql.append(" AND created_at >= :from");
      params.addValue("from", toTimestamp(filter.from()));
    }
    if (filter.to() != null) {
      sql.append(" AND created_at < :to");
      params.addValue("to", toTimestamp(filter.to()));
    }
    sql.append(" ORDER BY created_at DESC, delivery_id LIMIT :limit");
    params.addValue("limit", filter.limit());
    return jdbcTemplate.query(sql.toString(), params, this::mapRow);
  }

  private DeliveryRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String scheduleId = rs.getString("schedule_id");
    final String providerId = rs.getString("provider_id");
    final String errorKind = rs.getString("error_kind");
    return new DeliveryRecord(
        UUID.fromString(rs.getString("delivery_id")),
        scheduleId == null ? null : UUID.fromString(scheduleId),
        rs.getString("entity_id"),
        rs.getString("recipient"),
        rs.getString("rendered_body"),
        providerId == null ? null : UUID.fromString(providerId),
        DeliveryStatus.valueOf(rs.getString("status")),
        errorKind == null ? null : DeliveryErrorKind.valueOf(errorKind),
        rs.getString("error_message"),
        rs.getString("provider_message_id"),
        rs.getInt("segment_count"),
        rs.getBigDecimal("cost"),
        toInstant(rs.getTimestamp("created_at")));
  }
}
