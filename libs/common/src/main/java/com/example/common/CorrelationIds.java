/*
 * どこで: 共通ユーティリティ
 * 何を: 1 つの処理単位をログ行と記録の間で突き合わせる識別子を発行する
 * なぜ: スケジュール実行にはスケジュール単位ではなく実行単位で一意な ID が必要なため
 */
package com.example.common;

import java.util.UUID;

public final class CorrelationIds {
  private CorrelationIds() {}

  public static String newRunId() {
    return "run-" + UUID.randomUUID();
  }
}
