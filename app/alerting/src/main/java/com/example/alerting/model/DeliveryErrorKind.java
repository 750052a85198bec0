/*
 * どこで: Alerting ドメインモデル
 * 何を: FAILED/SKIPPED の配信記録に保存する分類済み理由
 * なぜ: 実行中のすべての判断を監査証跡で説明できるようにするため
 */
package com.example.alerting.model;

public enum DeliveryErrorKind {
  TEMPLATE_RENDER,
  TEMPLATE_UNAVAILABLE,
  NO_ELIGIBLE_PROVIDER,
  AUTHENTICATION,
  INVALID_RECIPIENT,
  COUNTRY_NOT_ENABLED,
  TEST_MODE_RESTRICTION,
  QUOTA_EXCEEDED,
  PROVIDER_UNAVAILABLE,
  NO_RECIPIENT,
  ALREADY_ALERTED,
  CANDIDATE_SOURCE_UNAVAILABLE,
  RUN_ABORTED
}
