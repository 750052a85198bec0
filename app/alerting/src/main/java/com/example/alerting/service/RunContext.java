/*
 * どこで: Alerting サービス層
 * 何を: スケジュール実行 1 回分の可変状態 (件数、除外プロバイダ、中断理由)
 * なぜ: runner のスレッド内に閉じ、実行終了とともに破棄するため
 */
package com.example.alerting.service;

import com.example.alerting.model.AlertSchedule;
import com.example.alerting.model.DeliveryErrorKind;
import com.example.alerting.model.DeliveryStatus;
import com.example.alerting.model.RunOutcome;
import com.example.alerting.model.RunSummary;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

final class RunContext {

  private final AlertSchedule schedule;
  private final String runId;
  private final Instant startedAt;
  private final Set<UUID> excludedProviders = new HashSet<>();
  private int dueCount;
  private int sent;
  private int failed;
  private int skipped;
  private DeliveryErrorKind abortReason;

  RunContext(AlertSchedule schedule, String runId, Instant startedAt) {
    this.schedule = schedule;
    this.runId = runId;
    this.startedAt = startedAt;
  }

  AlertSchedule schedule() {
    return schedule;
  }

  String runId() {
    return runId;
  }

  Instant startedAt() {
    return startedAt;
  }

  Set<UUID> excludedProviders() {
    return Set.copyOf(excludedProviders);
  }

  void excludeProvider(UUID providerId) {
    excludedProviders.add(providerId);
  }

  void setDueCount(int dueCount) {
    this.dueCount = dueCount;
  }

  // 最初の理由を採用する。後続の失敗は最初の失敗の結果にすぎない
  void abort(DeliveryErrorKind reason) {
    if (abortReason == null) {
      abortReason = reason;
    }
  }

  boolean aborted() {
    return abortReason != null;
  }

  DeliveryErrorKind abortReason() {
    return abortReason;
  }

  void count(DeliveryStatus status) {
    switch (status) {
      case SENT -> sent++;
      case FAILED -> failed++;
      case SKIPPED -> skipped++;
    }
  }

  RunSummary toSummary(Instant nextRun) {
    return new RunSummary(
        schedule.scheduleId(),
        runId,
        aborted() ? RunOutcome.ABORTED : RunOutcome.COMPLETED,
        dueCount,
        sent,
        failed,
        skipped,
        abortReason,
        startedAt,
        nextRun);
  }
}
