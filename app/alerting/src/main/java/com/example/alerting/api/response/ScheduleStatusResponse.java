package com.example.alerting.api.response;

import com.example.alerting.model.AlertSchedule;
import com.example.alerting.model.ScheduleStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ScheduleStatusResponse(
    String scheduleId, String status, String lastRun, String nextRun) {

  public static ScheduleStatusResponse from(AlertSchedule schedule, ScheduleStatus status) {
    return new ScheduleStatusResponse(
        schedule.scheduleId().toString(),
        status.name(),
        ScheduleResponse.format(schedule.lastRun()),
        ScheduleResponse.format(schedule.nextRun()));
  }
}
