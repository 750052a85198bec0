/*
 * どこで: Alerting ドメインモデル
 * 何を: 配信履歴クエリの任意フィルタ
 * なぜ: limit 以外はすべて null を許容するため
 */
package com.example.alerting.model;

import java.time.Instant;
import java.util.UUID;

public record HistoryFilter(
    UUID scheduleId, String entityId, DeliveryStatus status, Instant from, Instant to, int limit) {

  public static final int DEFAULT_LIMIT = 100;
  public static final int MAX_LIMIT = 1000;

  public HistoryFilter {
    if (limit <= 0) {
      limit = DEFAULT_LIMIT;
    }
    limit = Math.min(limit, MAX_LIMIT);
  }
}
