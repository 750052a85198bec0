package com.example.alerting.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.alerting.TestFixtures;
import com.example.alerting.model.AlertSchedule;
import com.example.alerting.model.AlertType;
import com.example.alerting.model.DeliveryErrorKind;
import com.example.alerting.model.RunOutcome;
import com.example.alerting.model.RunSummary;
import com.example.alerting.model.ScheduleStatus;
import com.example.alerting.service.AlertScheduleNotFoundException;
import com.example.alerting.service.AlertScheduleService;
import com.example.alerting.service.CandidateEntityNotFoundException;
import com.example.alerting.service.InvalidAlertRequestException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(AlertScheduleController.class)
@Import(ApiExceptionHandler.class)
class AlertScheduleControllerTest {

  private static final Instant NOW = Instant.parse("2026-03-02T15:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private AlertScheduleService scheduleService;

  @Test
  void createScheduleReturns201() throws Exception {
    final UUID templateId = UUID.randomUUID();
    final AlertSchedule created = TestFixtures.schedule(templateId, "MOBIL", NOW);
    when(scheduleService.createSchedule(any())).thenReturn(created);
    when(scheduleService.statusOf(created)).thenReturn(ScheduleStatus.ACTIVE);

    mockMvc
        .perform(
            post("/v1/alerts/schedules")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name":"licenses MOBIL","alert_type":"LICENSE_EXPIRY",
                     "template_id":"%s","station_filter":"MOBIL"}
                    """
                        .formatted(templateId)))
        .andExpect(status().isCreated())
        .andExpect(header().exists("X-Request-Id"))
        .andExpect(jsonPath("$.schedule_id").value(created.scheduleId().toString()))
        .andExpect(jsonPath("$.frequency_days").value(7))
        .andExpect(jsonPath("$.status").value("ACTIVE"))
        .andExpect(jsonPath("$.next_run").value("2026-03-02T15:00:00Z"));
  }

  @Test
  void createScheduleRejectsMissingTemplate() throws Exception {
    mockMvc
        .perform(
            post("/v1/alerts/schedules")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name":"x","alert_type":"LICENSE_EXPIRY","frequency_days":0}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("ALERT_VALIDATION_ERROR"));
    verify(scheduleService, never()).createSchedule(any());
  }

  @Test
  void createScheduleRejectsUnknownAlertType() throws Exception {
    mockMvc
        .perform(
            post("/v1/alerts/schedules")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name":"x","alert_type":"WEATHER","template_id":"%s"}
                    """
                        .formatted(UUID.randomUUID())))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("ALERT_BAD_REQUEST"));
  }

  @Test
  void createScheduleMapsServiceRejectionTo400() throws Exception {
    when(scheduleService.createSchedule(any()))
        .thenThrow(new InvalidAlertRequestException("template does not exist: t-1"));

    mockMvc
        .perform(
            post("/v1/alerts/schedules")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name":"x","alert_type":"LICENSE_EXPIRY","template_id":"%s"}
                    """
                        .formatted(UUID.randomUUID())))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("template does not exist: t-1"));
  }

  @Test
  void listSchedulesReturnsEveryScheduleWithStatus() throws Exception {
    final AlertSchedule schedule = TestFixtures.schedule(UUID.randomUUID(), "ALL", NOW);
    when(scheduleService.listSchedules()).thenReturn(List.of(schedule));
    when(scheduleService.statusOf(schedule)).thenReturn(ScheduleStatus.DUE);

    mockMvc
        .perform(get("/v1/alerts/schedules"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.schedules[0].status").value("DUE"))
        .andExpect(jsonPath("$.schedules[0].station_filter").value("ALL"));
  }

  @Test
  void pauseScheduleReturnsUpdatedSchedule() throws Exception {
    final AlertSchedule schedule = TestFixtures.schedule(UUID.randomUUID(), "ALL", NOW);
    when(scheduleService.setActive(eq(schedule.scheduleId()), eq(false))).thenReturn(schedule);
    when(scheduleService.statusOf(schedule)).thenReturn(ScheduleStatus.PAUSED);

    mockMvc
        .perform(
            patch("/v1/alerts/schedules/{id}/active", schedule.scheduleId())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"active\":false}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("PAUSED"));
  }

  @Test
  void runScheduleReturnsSummary() throws Exception {
    final UUID scheduleId = UUID.randomUUID();
    when(scheduleService.runSchedule(scheduleId))
        .thenReturn(
            new RunSummary(
                scheduleId,
                "run-1",
                RunOutcome.ABORTED,
                3,
                1,
                1,
                1,
                DeliveryErrorKind.NO_ELIGIBLE_PROVIDER,
                NOW,
                NOW.plusSeconds(604800)));

    mockMvc
        .perform(post("/v1/alerts/schedules/{id}/run", scheduleId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.outcome").value("ABORTED"))
        .andExpect(jsonPath("$.due_count").value(3))
        .andExpect(jsonPath("$.abort_reason").value("NO_ELIGIBLE_PROVIDER"))
        .andExpect(jsonPath("$.next_run").value("2026-03-09T15:00:00Z"));
  }

  @Test
  void runUnknownScheduleReturns404() throws Exception {
    final UUID scheduleId = UUID.randomUUID();
    when(scheduleService.runSchedule(scheduleId))
        .thenThrow(new AlertScheduleNotFoundException(scheduleId));

    mockMvc
        .perform(post("/v1/alerts/schedules/{id}/run", scheduleId))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("ALERT_SCHEDULE_NOT_FOUND"));
  }

  @Test
  void alertNowReturnsSummaryForOneEntity() throws Exception {
    final UUID scheduleId = UUID.randomUUID();
    when(scheduleService.sendNow(scheduleId, "license-7"))
        .thenReturn(
            new RunSummary(
                scheduleId, "run-2", RunOutcome.COMPLETED, 1, 2, 0, 0, null, NOW, NOW));

    mockMvc
        .perform(
            post("/v1/alerts/schedules/{id}/entities/{entityId}/alert-now", scheduleId, "license-7"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.outcome").value("COMPLETED"))
        .andExpect(jsonPath("$.sent").value(2));
  }

  @Test
  void alertNowForUnknownEntityReturns404() throws Exception {
    final UUID scheduleId = UUID.randomUUID();
    when(scheduleService.sendNow(scheduleId, "license-404"))
        .thenThrow(new CandidateEntityNotFoundException(AlertType.LICENSE_EXPIRY, "license-404"));

    mockMvc
        .perform(
            post("/v1/alerts/schedules/{id}/entities/{entityId}/alert-now", scheduleId, "license-404"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("ALERT_ENTITY_NOT_FOUND"));
  }

  @Test
  void statusReturnsDerivedStatus() throws Exception {
    final AlertSchedule schedule = TestFixtures.schedule(UUID.randomUUID(), "ALL", NOW);
    when(scheduleService.get(schedule.scheduleId())).thenReturn(schedule);
    when(scheduleService.statusOf(schedule)).thenReturn(ScheduleStatus.DUE);

    mockMvc
        .perform(get("/v1/alerts/schedules/{id}/status", schedule.scheduleId()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("DUE"))
        .andExpect(jsonPath("$.next_run").value("2026-03-02T15:00:00Z"));
  }

  @Test
  void malformedScheduleIdReturns400() throws Exception {
    mockMvc
        .perform(get("/v1/alerts/schedules/not-a-uuid/status"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("ALERT_BAD_REQUEST"));
  }
}
