/*
 * どこで: Alerting サービス層
 * 何を: スケジュールの作成/一覧/停止/再開と導出状態の取得
 * なぜ: 実行は AlertScheduleRunner に委ね、このクラスは lease 列に触れないため
 */
package com.example.alerting.service;

import com.example.alerting.config.AlertDefaultsProperties;
import com.example.alerting.model.AlertSchedule;
import com.example.alerting.model.AlertScheduleDraft;
import com.example.alerting.model.RunSummary;
import com.example.alerting.model.ScheduleStatus;
import com.example.alerting.repository.AlertScheduleRepository;
import com.example.alerting.repository.MessageTemplateRepository;
import com.example.alerting.repository.ProviderAccountRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AlertScheduleService {

  private static final Logger logger = LoggerFactory.getLogger(AlertScheduleService.class);

  private final AlertScheduleRepository scheduleRepository;
  private final MessageTemplateRepository templateRepository;
  private final ProviderAccountRepository providerAccountRepository;
  private final AlertScheduleRunner runner;
  private final AlertDefaultsProperties defaults;
  private final Clock clock;

  /**
   * 初回実行が現在から 1 周期後のスケジュールを作成する。
   *
   * @throws InvalidAlertRequestException 数値項目が範囲外か、参照先のテンプレートまたは
   *     プロバイダが存在しないとき
   */
  public AlertSchedule createSchedule(AlertScheduleDraft draft) {
    final int window =
        draft.triggerWindowDays() == null ? defaults.triggerWindowDays() : draft.triggerWindowDays();
    final int frequency =
        draft.frequencyDays() == null ? defaults.frequencyDays() : draft.frequencyDays();
    if (window < 0) {
      throw new InvalidAlertRequestException("trigger_window_days must be >= 0");
    }
    if (frequency < 1) {
      throw new InvalidAlertRequestException("frequency_days must be >= 1");
    }
    if (templateRepository.findById(draft.templateId()).isEmpty()) {
      throw new InvalidAlertRequestException("template does not exist: " + draft.templateId());
    }
    if (draft.preferredProviderId() != null
        && providerAccountRepository.findById(draft.preferredProviderId()).isEmpty()) {
      throw new InvalidAlertRequestException(
          "provider does not exist: " + draft.preferredProviderId());
    }
    final String stationFilter =
        draft.stationFilter() == null || draft.stationFilter().isBlank()
            ? defaults.stationFilter()
            : draft.stationFilter().trim();
    final Instant now = Instant.now(clock);
    final AlertSchedule schedule =
        new AlertSchedule(
            UUID.randomUUID(),
            draft.name(),
            draft.alertType(),
            window,
            frequency,
            draft.templateId(),
            stationFilter,
            draft.preferredProviderId(),
            draft.active() == null || draft.active(),
            null,
            now.plus(Duration.ofDays(frequency)),
            null,
            null,
            now,
            now);
    scheduleRepository.insert(schedule);
    logger.info(
        "alert schedule created scheduleId={} type={} station={} nextRun={}",
        schedule.scheduleId(),
        schedule.alertType(),
        schedule.stationFilter(),
        schedule.nextRun());
    return schedule;
  }

  public List<AlertSchedule> listSchedules() {
    return scheduleRepository.findAll();
  }

  public AlertSchedule get(UUID scheduleId) {
    return scheduleRepository
        .findById(scheduleId)
        .orElseThrow(() -> new AlertScheduleNotFoundException(scheduleId));
  }

  public AlertSchedule setActive(UUID scheduleId, boolean active) {
    final int updated = scheduleRepository.updateActive(scheduleId, active, Instant.now(clock));
    if (updated == 0) {
      throw new AlertScheduleNotFoundException(scheduleId);
    }
    logger.info("alert schedule {} scheduleId={}", active ? "resumed" : "paused", scheduleId);
    return get(scheduleId);
  }

  public ScheduleStatus getScheduleStatus(UUID scheduleId) {
    return statusOf(get(scheduleId));
  }

  public ScheduleStatus statusOf(AlertSchedule schedule) {
    return ScheduleStatus.of(schedule, Instant.now(clock));
  }

  public RunSummary runSchedule(UUID scheduleId) {
    return runner.runSchedule(scheduleId);
  }

  public RunSummary sendNow(UUID scheduleId, String entityId) {
    return runner.sendNow(scheduleId, entityId);
  }
}
