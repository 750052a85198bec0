/*
 * どこで: Alerting ドメインモデル
 * 何を: 受理されたメッセージに対するプロバイダの応答
 * なぜ: SENT 記録ごとにプロバイダのメッセージ ID と費用を台帳へ残すため
 */
package com.example.alerting.model;

import java.math.BigDecimal;

public record DeliveryResult(String providerMessageId, BigDecimal cost, String providerStatus) {

  public DeliveryResult {
    cost = cost == null ? BigDecimal.ZERO : cost;
  }
}
