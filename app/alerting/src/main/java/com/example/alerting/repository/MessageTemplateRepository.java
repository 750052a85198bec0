/*
 * どこで: Alerting データアクセス
 * 何を: メッセージテンプレートを保存する
 * なぜ: 検証はサービス層で済ませ、ここに来る行は描画可能と分かっているため
 */
package com.example.alerting.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.alerting.model.MessageTemplate;
import com.example.alerting.model.TemplateCategory;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class MessageTemplateRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public UUID insert(MessageTemplate template) {
    final String sql =
        """
        INSERT INTO message_templates (
          template_id, name, category, body, is_active, created_at, updated_at
        ) VALUES (
          :templateId, :name, :category, :body, :active, :createdAt, :updatedAt
        )
        """;
    jdbcTemplate.update(sql, params(template));
    return template.templateId();
  }

  public int update(MessageTemplate template) {
    final String sql =
        """
        UPDATE message_templates
        SET name = :name,
            category = :category,
            body = :body,
            is_active = :active,
            updated_at = :updatedAt
        WHERE template_id = :templateId
        """;
    return jdbcTemplate.update(sql, params(template));
  }

  public Optional<MessageTemplate> findById(UUID templateId) {
    final String sql =
        """
        SELECT template_id, name, category, body, is_active, created_at, updated_at
        FROM message_templates
        WHERE template_id = :templateId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("templateId", templateId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<MessageTemplate> findAll() {
    final String sql =
        """
        SELECT template_id, name, category, body, is_active, created_at, updated_at
        FROM message_templates
        ORDER BY name
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  private MapSqlParameterSource params(MessageTemplate template) {
    return new MapSqlParameterSource()
        .addValue("templateId", template.templateId())
        .addValue("name", template.name())
        .addValue("category", template.category().name())
        .addValue("body", template.body())
        .addValue("active", template.active())
        .addValue("createdAt", toTimestamp(template.createdAt()))
        .addValue("updatedAt", toTimestamp(template.updatedAt()));
  }

  private MessageTemplate mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new MessageTemplate(
        UUID.fromString(rs.getString("template_id")),
        rs.getString("name"),
        TemplateCategory.valueOf(rs.getString("category")),
        rs.getString("body"),
        rs.getBoolean("is_active"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
