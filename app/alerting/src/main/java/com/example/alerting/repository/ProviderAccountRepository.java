/*
 * どこで: Alerting データアクセス
 * 何を: プロバイダアカウントの読み取り、クォータ予約、テスト宛先の管理
 * なぜ: クォータは Java 側の読み取り-更新ではなく条件付き UPDATE 1 本で予約するため
 */
package com.example.alerting.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.alerting.model.ProviderAccount;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ProviderAccountRepository {

  private static final String SELECT_WITH_RECIPIENTS =
      """
      SELECT p.provider_id, p.name, p.sender_id, p.credentials_ref, p.test_mode,
             p.daily_quota, p.used_today, p.quota_window_started_at, p.priority, p.is_active,
             COALESCE(
               array_agg(r.recipient ORDER BY r.recipient) FILTER (WHERE r.recipient IS NOT NULL),
               ARRAY[]::varchar[]
             ) AS test_recipients
      FROM provider_accounts p
      LEFT JOIN provider_test_recipients r ON r.provider_id = p.provider_id
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public UUID insert(ProviderAccount provider) {
    final String sql =
        """
        INSERT INTO provider_accounts (
          provider_id,
          name,
          sender_id,
          credentials_ref,
          test_mode,
          daily_quota,
          used_today,
          quota_window_started_at,
          priority,
          is_active
        ) VALUES (
          :providerId,
          :name,
          :senderId,
          :credentialsRef,
          :testMode,
          :dailyQuota,
          :usedToday,
          :quotaWindowStartedAt,
          :priority,
          :active
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("providerId", provider.providerId())
            .addValue("name", provider.name())
            .addValue("senderId", provider.senderId())
            .addValue("credentialsRef", provider.credentialsRef())
            .addValue("testMode", provider.testMode())
            .addValue("dailyQuota", provider.dailyQuota())
            .addValue("usedToday", provider.usedToday())
            .addValue("quotaWindowStartedAt", toTimestamp(provider.quotaWindowStartedAt()))
            .addValue("priority", provider.priority())
            .addValue("active", provider.active());
    jdbcTemplate.update(sql, params);
    replaceTestRecipients(provider.providerId(), provider.testRecipients());
    return provider.providerId();
  }

  public void replaceTestRecipients(UUID providerId, Set<String> recipients) {
    jdbcTemplate.update(
        "DELETE FROM provider_test_recipients WHERE provider_id = :providerId",
        new MapSqlParameterSource().addValue("providerId", providerId));
    if (recipients.isEmpty()) {
      return;
    }
    final SqlParameterSource[] batch =
        recipients.stream()
            .map(recipient -> recipientParams(providerId, recipient))
            .toArray(SqlParameterSource[]::new);
    jdbcTemplate.batchUpdate(
        "INSERT INTO provider_test_recipients (provider_id, recipient) VALUES (:providerId, :recipient)",
        batch);
  }

  /** 宛先がすでに許可リストにあれば false を返す。 */
  public boolean addTestRecipient(UUID providerId, String recipient) {
    final String sql =
        """
        INSERT INTO provider_test_recipients (provider_id, recipient)
        VALUES (:providerId, :recipient)
        ON CONFLICT DO NOTHING
        """;
    return jdbcTemplate.update(sql, recipientParams(providerId, recipient)) == 1;
  }

  public boolean removeTestRecipient(UUID providerId, String recipient) {
    final String sql =
        """
        DELETE FROM provider_test_recipients
        WHERE provider_id = :providerId
          AND recipient = :recipient
        """;
    return jdbcTemplate.update(sql, recipientParams(providerId, recipient)) == 1;
  }

  public Optional<ProviderAccount> findById(UUID providerId) {
    final String sql =
        SELECT_WITH_RECIPIENTS
            + """
            WHERE p.provider_id = :providerId
            GROUP BY p.provider_id
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("providerId", providerId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<ProviderAccount> findAll() {
    final String sql =
        SELECT_WITH_RECIPIENTS
            + """
            GROUP BY p.provider_id
            ORDER BY p.priority, p.name
            """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  public List<ProviderAccount> findActiveOrderedByPriority() {
    final String sql =
        SELECT_WITH_RECIPIENTS
            + """
            WHERE p.is_active
            GROUP BY p.provider_id
            ORDER BY p.priority, p.name
            """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  /**
   * プロバイダのローリングウィンドウに送信 1 件を計上する。
   *
   * <p>{@code windowStart} 以前に始まったウィンドウは期限切れとみなし、カウンタを 1 から、
   * ウィンドウを {@code now} から始め直す。
   *
   * @return クォータを 1 単位予約できたら true
   */
  public boolean tryReserveQuota(UUID providerId, Instant now, Instant windowStart) {
    final String sql =
        """
        UPDATE provider_accounts
        SET used_today = CASE
              WHEN quota_window_started_at IS NULL OR quota_window_started_at <= :windowStart
                THEN 1
              ELSE used_today + 1
            END,
            quota_window_started_at = CASE
              WHEN quota_window_started_at IS NULL OR quota_window_started_at <= :windowStart
                THEN :now
              ELSE quota_window_started_at
            END
        WHERE provider_id = :providerId
          AND is_active
          AND daily_quota > 0
          AND (
            quota_window_started_at IS NULL
            OR quota_window_started_at <= :windowStart
            OR used_today < daily_quota
          )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("providerId", providerId)
            .addValue("now", toTimestamp(now))
            .addValue("windowStart", toTimestamp(windowStart));
    return jdbcTemplate.update(sql, params) == 1;
  }

  public int updateActive(UUID providerId, boolean active) {
    final String sql =
        """
        UPDATE provider_accounts
        SET is_active = :active
        WHERE provider_id = :providerId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("providerId", providerId).addValue("active", active);
    return jdbcTemplate.update(sql, params);
  }

  private static MapSqlParameterSource recipientParams(UUID providerId, String recipient) {
    return new MapSqlParameterSource()
        .addValue("providerId", providerId)
        .addValue("recipient", recipient);
  }

  private ProviderAccount mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ProviderAccount(
        UUID.fromString(rs.getString("provider_id")),
        rs.getString("name"),
        rs.getString("sender_id"),
        rs.getString("credentials_ref"),
        rs.getBoolean("test_mode"),
        readRecipients(rs.getArray("test_recipients")),
        rs.getInt("daily_quota"),
        rs.getInt("used_today"),
        toInstant(rs.getTimestamp("quota_window_started_at")),
        rs.getInt("priority"),
        rs.getBoolean("is_active"));
  }

  private Set<String> readRecipients(Array array) throws SQLException {
    if (array == null) {
      return Set.of();
    }
    try {
      return Set.copyOf(Arrays.asList((String[]) array.getArray()));
    } finally {
      array.free();
    }
  }
}
