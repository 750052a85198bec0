/*
 * どこで: Alerting ドメインモデル
 * 何を: アラートスケジュールが監視するレコードの種別
 * なぜ: 候補ソースと文脈ファクトリがこれで分岐するため
 */
package com.example.alerting.model;

public enum AlertType {
  LICENSE_EXPIRY,
  INVENTORY_LOW,
  SYSTEM_NOTICE
}
