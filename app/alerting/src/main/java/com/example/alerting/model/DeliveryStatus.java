/*
 * どこで: Alerting ドメインモデル
 * 何を: 台帳に保存する配信試行の結果
 * なぜ: 重複抑止のクエリは SENT 行だけを見るため
 */
package com.example.alerting.model;

public enum DeliveryStatus {
  SENT,
  FAILED,
  SKIPPED
}
