/*
 * どこで: Alerting API レスポンス DTO
 * 何を: 導出状態付きのスケジュール 1 件
 */
package com.example.alerting.api.response;

import com.example.alerting.model.AlertSchedule;
import com.example.alerting.model.ScheduleStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ScheduleResponse(
    String scheduleId,
    String name,
    String alertType,
    int triggerWindowDays,
    int frequencyDays,
    String templateId,
    String stationFilter,
    String preferredProviderId,
    boolean active,
    String status,
    String lastRun,
    String nextRun) {

  public static ScheduleResponse from(AlertSchedule schedule, ScheduleStatus status) {
    return new ScheduleResponse(
        schedule.scheduleId().toString(),
        schedule.name(),
        schedule.alertType().name(),
        schedule.triggerWindowDays(),
        schedule.frequencyDays(),
        schedule.templateId().toString(),
        schedule.stationFilter(),
        schedule.preferredProviderId() == null ? null : schedule.preferredProviderId().toString(),
        schedule.active(),
        status.name(),
        format(schedule.lastRun()),
        format(schedule.nextRun()));
  }

  static String format(Instant instant) {
    return instant == null ? null : instant.toString();
  }
}
