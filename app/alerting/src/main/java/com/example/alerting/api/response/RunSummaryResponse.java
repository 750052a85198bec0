/*
 * どこで: Alerting API レスポンス DTO
 * 何を: 手動実行の件数と結果
 * なぜ: COALESCED/PAUSED は件数 0 で返るため、呼び出し側はまず outcome を見る
 */
package com.example.alerting.api.response;

import com.example.alerting.model.RunSummary;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RunSummaryResponse(
    String scheduleId,
    String runId,
    String outcome,
    int dueCount,
    int sent,
    int failed,
    int skipped,
    String abortReason,
    String startedAt,
    String nextRun) {

  public static RunSummaryResponse from(RunSummary summary) {
    return new RunSummaryResponse(
        summary.scheduleId().toString(),
        summary.runId(),
        summary.outcome().name(),
        summary.dueCount(),
        summary.sent(),
        summary.failed(),
        summary.skipped(),
        summary.abortReason() == null ? null : summary.abortReason().name(),
        ScheduleResponse.format(summary.startedAt()),
        ScheduleResponse.format(summary.nextRun()));
  }
}
