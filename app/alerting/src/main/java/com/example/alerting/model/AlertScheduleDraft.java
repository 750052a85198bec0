/*
 * どこで: Alerting ドメインモデル
 * 何を: 新規スケジュールの入力値。null の数値/フィルタ項目は設定の既定値で補う
 */
package com.example.alerting.model;

import java.util.UUID;

public record AlertScheduleDraft(
    String name,
    AlertType alertType,
    Integer triggerWindowDays,
    Integer frequencyDays,
    UUID templateId,
    String stationFilter,
    UUID preferredProviderId,
    Boolean active) {}
