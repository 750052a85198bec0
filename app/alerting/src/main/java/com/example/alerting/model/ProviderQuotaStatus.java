/*
 * どこで: Alerting ドメインモデル
 * 何を: 現在のローリングウィンドウにおける 1 プロバイダのクォータ使用量
 * なぜ: 各送信元が日次上限にどれだけ近いかを運用者が確認できるようにするため
 */
package com.example.alerting.model;

import java.time.Instant;
import java.util.UUID;

public record ProviderQuotaStatus(
    UUID providerId,
    String name,
    boolean active,
    boolean testMode,
    int used,
    int dailyQuota,
    Instant windowStartedAt) {

  public int remaining() {
    return Math.max(dailyQuota - used, 0);
  }
}
