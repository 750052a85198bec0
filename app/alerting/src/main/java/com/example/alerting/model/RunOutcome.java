/*
 * どこで: Alerting ドメインモデル
 * 何を: スケジュール実行の終わり方
 * なぜ: COALESCED は他の実行が lease を保持していたため捨てたトリガを表す
 */
package com.example.alerting.model;

public enum RunOutcome {
  COMPLETED,
  ABORTED,
  COALESCED,
  PAUSED
}
