/*
 * どこで: Alerting ドメインモデル
 * 何を: 送信元 SMS アカウントとクォータカウンタのスナップショット
 * なぜ: 選択時に読むだけで、クォータの更新はこのコピーではなく条件付き UPDATE で行うため
 */
package com.example.alerting.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;

public record ProviderAccount(
    UUID providerId,
    String name,
    String senderId,
    String credentialsRef,
    boolean testMode,
    Set<String> testRecipients,
    int dailyQuota,
    int usedToday,
    Instant quotaWindowStartedAt,
    int priority,
    boolean active) {

  public static final Duration QUOTA_WINDOW = Duration.ofHours(24);

  public ProviderAccount {
    testRecipients = testRecipients == null ? Set.of() : Set.copyOf(testRecipients);
  }

  /** 現在のローリングウィンドウ内の送信数。期限切れのウィンドウは 0 とみなす。 */
  public int usedInWindow(Instant now) {
    if (quotaWindowStartedAt == null || !now.isBefore(quotaWindowStartedAt.plus(QUOTA_WINDOW))) {
      return 0;
    }
    return usedToday;
  }

  public boolean hasQuota(Instant now) {
    return usedInWindow(now) < dailyQuota;
  }
}
