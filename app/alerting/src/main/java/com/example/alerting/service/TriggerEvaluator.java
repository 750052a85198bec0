/*
 * どこで: Alerting サービス層
 * 何を: ある時点でスケジュールにとって due な候補を判定する
 * なぜ: 期限切れのエンティティも due のまま残し、警告だけでなく対応を促すため
 */
package com.example.alerting.service;

import com.example.alerting.config.AlertRunnerProperties;
import com.example.alerting.model.AlertSchedule;
import com.example.alerting.model.CandidateEntity;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class TriggerEvaluator {

  private final DeliveryLedger ledger;
  private final AlertRunnerProperties runnerProperties;

  public List<CandidateEntity> evaluate(
      AlertSchedule schedule, List<CandidateEntity> candidates, Instant now) {
    final LocalDate today = today(now);
    final Instant since = dedupSince(schedule, now);
    final List<CandidateEntity> due = new ArrayList<>();
    for (CandidateEntity candidate : candidates) {
      if (candidate.alertType() != schedule.alertType()
          || !schedule.matchesStation(candidate.station())
          || candidate.thresholdDate() == null
          || daysUntil(today, candidate.thresholdDate()) > schedule.triggerWindowDays()) {
        continue;
      }
      if (ledger.alreadyAlerted(schedule.scheduleId(), candidate.entityId(), since)) {
        continue;
      }
      due.add(candidate);
    }
    return due;
  }

  /**
   * スケジュールの重複抑止ウィンドウに残っている最も古い暦日の開始時刻。
   *
   * <p>D 日の送信は D から D + frequencyDays - 1 までを抑止する。
   */
  public Instant dedupSince(AlertSchedule schedule, Instant now) {
    return today(now)
        .minusDays(schedule.frequencyDays() - 1L)
        .atStartOfDay(runnerProperties.zoneId())
        .toInstant();
  }

  /** スケジュールのトリガウィンドウに収まる最後の閾値日。 */
  public LocalDate horizon(AlertSchedule schedule, Instant now) {
    return today(now).plusDays(schedule.triggerWindowDays());
  }

  static long daysUntil(LocalDate today, LocalDate thresholdDate) {
    return ChronoUnit.DAYS.between(today, thresholdDate);
  }

  LocalDate today(Instant now) {
    return LocalDate.ofInstant(now, runnerProperties.zoneId());
  }
}
