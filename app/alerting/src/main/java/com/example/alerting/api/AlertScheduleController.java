/*
 * どこで: Alerting API
 * 何を: スケジュールの作成/一覧/停止・再開/即時実行/エンティティ単位の即時通知/状態取得を提供する
 * なぜ: 手動実行も定期ワーカーと同じ runner と lease を通すため
 */
package com.example.alerting.api;

import com.example.alerting.api.request.CreateScheduleRequest;
import com.example.alerting.api.request.SetScheduleActiveRequest;
import com.example.alerting.api.response.RunSummaryResponse;
import com.example.alerting.api.response.ScheduleListResponse;
import com.example.alerting.api.response.ScheduleResponse;
import com.example.alerting.api.response.ScheduleStatusResponse;
import com.example.alerting.model.AlertSchedule;
import com.example.alerting.model.AlertScheduleDraft;
import com.example.alerting.service.AlertScheduleService;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/alerts/schedules")
@RequiredArgsConstructor
public class AlertScheduleController {

  private final AlertScheduleService scheduleService;

  @PostMapping
  public ResponseEntity<ScheduleResponse> createSchedule(
      @Valid @RequestBody CreateScheduleRequest request) {
    final AlertSchedule created =
        scheduleService.createSchedule(
            new AlertScheduleDraft(
                request.name(),
                request.alertType(),
                request.triggerWindowDays(),
                request.frequencyDays(),
                request.templateId(),
                request.stationFilter(),
                request.preferredProviderId(),
                request.active()));
    return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(created));
  }

  @GetMapping
  public ResponseEntity<ScheduleListResponse> listSchedules() {
    return ResponseEntity.ok(
        new ScheduleListResponse(
            scheduleService.listSchedules().stream().map(this::toResponse).toList()));
  }

  @PatchMapping("/{scheduleId}/active")
  public ResponseEntity<ScheduleResponse> setActive(
      @PathVariable("scheduleId") UUID scheduleId,
      @Valid @RequestBody SetScheduleActiveRequest request) {
    return ResponseEntity.ok(toResponse(scheduleService.setActive(scheduleId, request.active())));
  }

  @PostMapping("/{scheduleId}/run")
  public ResponseEntity<RunSummaryResponse> runSchedule(
      @PathVariable("scheduleId") UUID scheduleId) {
    return ResponseEntity.ok(RunSummaryResponse.from(scheduleService.runSchedule(scheduleId)));
  }

  @PostMapping("/{scheduleId}/entities/{entityId}/alert-now")
  public ResponseEntity<RunSummaryResponse> alertNow(
      @PathVariable("scheduleId") UUID scheduleId, @PathVariable("entityId") String entityId) {
    return ResponseEntity.ok(
        RunSummaryResponse.from(scheduleService.sendNow(scheduleId, entityId)));
  }

  @GetMapping("/{scheduleId}/status")
  public ResponseEntity<ScheduleStatusResponse> getStatus(
      @PathVariable("scheduleId") UUID scheduleId) {
    final AlertSchedule schedule = scheduleService.get(scheduleId);
    return ResponseEntity.ok(
        ScheduleStatusResponse.from(schedule, scheduleService.statusOf(schedule)));
  }

  private ScheduleResponse toResponse(AlertSchedule schedule) {
    return ScheduleResponse.from(schedule, scheduleService.statusOf(schedule));
  }
}
