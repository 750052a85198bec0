/*
 * どこで: Alerting 入力境界
 * 何を: licenses/products/system_notices のミラーテーブルから候補を一括または ID で読む
 * なぜ: 連絡先をここでステーション単位に付与し、runner は電話番号だけを扱えばよいようにするため
 */
package com.example.alerting.repository;

import static com.example.common.JdbcTimestampUtils.toLocalDate;
import static com.example.common.JdbcTimestampUtils.toSqlDate;

import com.example.alerting.model.AlertSchedule;
import com.example.alerting.model.AlertType;
import com.example.alerting.model.CandidateEntity;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class JdbcCandidateEntitySource implements CandidateEntitySource {

  private static final String STATION_CLAUSE =
      " AND (:allStations OR UPPER(TRIM(station)) = UPPER(TRIM(:station)))";

  private static final Map<AlertType, String> ENTITY_PREFIXES =
      Map.of(
          AlertType.LICENSE_EXPIRY, "license-",
          AlertType.INVENTORY_LOW, "product-",
          AlertType.SYSTEM_NOTICE, "notice-");

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public List<CandidateEntity> findCandidates(
      AlertType alertType, String stationFilter, LocalDate horizon) {
    final boolean allStations =
        stationFilter == null
            || stationFilter.isBlank()
            || AlertSchedule.ALL_STATIONS.equalsIgnoreCase(stationFilter.trim());
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("allStations", allStations)
            .addValue("station", allStations ? "" : stationFilter.trim())
            .addValue("horizon", toSqlDate(horizon));
    final List<RawCandidate> raw =
        switch (alertType) {
          case LICENSE_EXPIRY ->
              findLicenses(
                  "status = 'Active' AND expiry_date <= :horizon" + STATION_CLAUSE,
                  "expiry_date, id",
                  params);
          case INVENTORY_LOW ->
              findProducts(
                  "current_stock <= minimum_stock"
                      + " AND (reorder_date IS NULL OR reorder_date <= :horizon)"
                      + STATION_CLAUSE,
                  params,
                  horizon);
          case SYSTEM_NOTICE ->
              findNotices(
                  "is_active AND effective_date <= :horizon" + STATION_CLAUSE, params);
        };
    return withContacts(alertType, raw);
  }

  @Override
  public Optional<CandidateEntity> findCandidate(
      AlertType alertType, String entityId, LocalDate asOf) {
    final String prefix = ENTITY_PREFIXES.get(alertType);
    if (entityId == null || !entityId.startsWith(prefix)) {
      return Optional.empty();
    }
    final long id;
    try {
      id = Long.parseLong(entityId.substring(prefix.length()));
    } catch (NumberFormatException ex) {
      return Optional.empty();
    }
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", id);
    final List<RawCandidate> raw =
        switch (alertType) {
          case LICENSE_EXPIRY -> findLicenses("id = :id", "id", params);
          case INVENTORY_LOW -> findProducts("id = :id", params, asOf);
          case SYSTEM_NOTICE -> findNotices("id = :id", params);
        };
    return withContacts(alertType, raw).stream().findFirst();
  }

  private List<CandidateEntity> withContacts(AlertType alertType, List<RawCandidate> raw) {
    if (raw.isEmpty()) {
      return List.of();
    }
    final List<Contact> contacts = findActiveContacts();
    final List<CandidateEntity> candidates = new ArrayList<>(raw.size());
    for (RawCandidate candidate : raw) {
      candidates.add(
          new CandidateEntity(
              candidate.entityId(),
              alertType,
              candidate.thresholdDate(),
              candidate.station(),
              numbersFor(candidate.station(), contacts),
              candidate.attributes()));
    }
    return candidates;
  }

  private List<RawCandidate> findLicenses(
      String condition, String ordering, MapSqlParameterSource params) {
    final String sql =
        """
        SELECT id, license_name, license_number, category, station, expiry_date
        FROM licenses
        WHERE
        """
            + condition
            + " ORDER BY "
            + ordering;
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) -> {
          final Map<String, String> attributes = new HashMap<>();
          putIfPresent(attributes, "license_name", rs.getString("license_name"));
          putIfPresent(attributes, "license_number", rs.getString("license_number"));
          putIfPresent(attributes, "category", rs.getString("category"));
          return new RawCandidate(
              ENTITY_PREFIXES.get(AlertType.LICENSE_EXPIRY) + rs.getLong("id"),
              toLocalDate(rs.getDate("expiry_date")),
              rs.getString("station"),
              attributes);
        });
  }

  // 発注日のない商品は指定日当日に due とみなす
  private List<RawCandidate> findProducts(
      String condition, MapSqlParameterSource params, LocalDate horizon) {
    final String sql =
        """
        SELECT id, product_name, station, current_stock, minimum_stock, reorder_date
        FROM products
        WHERE
        """
            + condition
            + " ORDER BY id";
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) -> {
          final LocalDate reorderDate = toLocalDate(rs.getDate("reorder_date"));
          final Map<String, String> attributes = new HashMap<>();
          putIfPresent(attributes, "product_name", rs.getString("product_name"));
          attributes.put("current_stock", String.valueOf(rs.getInt("current_stock")));
          attributes.put("minimum_stock", String.valueOf(rs.getInt("minimum_stock")));
          return new RawCandidate(
              ENTITY_PREFIXES.get(AlertType.INVENTORY_LOW) + rs.getLong("id"),
              reorderDate == null ? horizon : reorderDate,
              rs.getString("station"),
              attributes);
        });
  }

  private List<RawCandidate> findNotices(String condition, MapSqlParameterSource params) {
    final String sql =
        """
        SELECT id, title, station, effective_date, message_details, action_required
        FROM system_notices
        WHERE
        """
            + condition
            + " ORDER BY effective_date, id";
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) -> {
          final Map<String, String> attributes = new HashMap<>();
          putIfPresent(attributes, "alert_type", rs.getString("title"));
          putIfPresent(attributes, "message_details", rs.getString("message_details"));
          putIfPresent(attributes, "action_required", rs.getString("action_required"));
          return new RawCandidate(
              ENTITY_PREFIXES.get(AlertType.SYSTEM_NOTICE) + rs.getLong("id"),
              toLocalDate(rs.getDate("effective_date")),
              rs.getString("station"),
              attributes);
        });
  }

  private List<Contact> findActiveContacts() {
    final String sql =
        """
        SELECT mobile_number, station
        FROM sms_contacts
        WHERE is_active
        ORDER BY id
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapContact);
  }

  private Contact mapContact(ResultSet rs, int rowNum) throws SQLException {
    return new Contact(rs.getString("mobile_number"), normalizeStation(rs.getString("station")));
  }

  private List<String> numbersFor(String station, List<Contact> contacts) {
    final String normalized = normalizeStation(station);
    final Set<String> numbers = new LinkedHashSet<>();
    for (Contact contact : contacts) {
      if (AlertSchedule.ALL_STATIONS.equals(contact.station())
          || contact.station().equals(normalized)) {
        numbers.add(contact.mobileNumber().trim());
      }
    }
    return List.copyOf(numbers);
  }

  private static String normalizeStation(String station) {
    return station == null ? "" : station.trim().toUpperCase(Locale.ROOT);
  }

  private static void putIfPresent(Map<String, String> attributes, String key, String value) {
    if (value != null) {
      attributes.put(key, value);
    }
  }

  private record RawCandidate(
      String entityId, LocalDate thresholdDate, String station, Map<String, String> attributes) {}

  private record Contact(String mobileNumber, String station) {}
}
