/*
 * どこで: Alerting ドメインモデル
 * 何を: alert_schedules 行のスナップショット
 * なぜ: runner/evaluator/API で共有するため
 */
package com.example.alerting.model;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

public record AlertSchedule(
    UUID scheduleId,
    String name,
    AlertType alertType,
    int triggerWindowDays,
    int frequencyDays,
    UUID templateId,
    String stationFilter,
    UUID preferredProviderId,
    boolean active,
    Instant lastRun,
    Instant nextRun,
    String lockedBy,
    Instant leaseUntil,
    Instant createdAt,
    Instant updatedAt) {

  public static final String ALL_STATIONS = "ALL";

  public boolean matchesStation(String station) {
    if (stationFilter == null || ALL_STATIONS.equalsIgnoreCase(stationFilter.trim())) {
      return true;
    }
    return station != null && stationFilter.trim().equalsIgnoreCase(station.trim());
  }

  public Duration frequency() {
    return Duration.ofDays(frequencyDays);
  }

  public boolean isDue(Instant now) {
    return active && nextRun != null && !nextRun.isAfter(now);
  }
}
