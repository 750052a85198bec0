/*
 * どこで: Alerting ドメインモデル
 * 何を: スケジュール実行 1 回分の結果
 * なぜ: 手動呼び出しに返し、定期ワーカーはログに出すため
 */
package com.example.alerting.model;

import java.time.Instant;
import java.util.UUID;

public record RunSummary(
    UUID scheduleId,
    String runId,
    RunOutcome outcome,
    int dueCount,
    int sent,
    int failed,
    int skipped,
    DeliveryErrorKind abortReason,
    Instant startedAt,
    Instant nextRun) {

  public static RunSummary paused(UUID scheduleId, String runId, Instant startedAt, Instant nextRun) {
    return new RunSummary(scheduleId, runId, RunOutcome.PAUSED, 0, 0, 0, 0, null, startedAt, nextRun);
  }

  public static RunSummary coalesced(
      UUID scheduleId, String runId, Instant startedAt, Instant nextRun) {
    return new RunSummary(
        scheduleId, runId, RunOutcome.COALESCED, 0, 0, 0, 0, null, startedAt, nextRun);
  }
}
