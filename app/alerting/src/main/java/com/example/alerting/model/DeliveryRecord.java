/*
 * どこで: Alerting ドメインモデル
 * 何を: 追記専用の配信台帳 1 行
 * なぜ: 履歴表示と重複抑止の両方がこの行を読むため
 */
package com.example.alerting.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record DeliveryRecord(
    UUID deliveryId,
    UUID scheduleId,
    String entityId,
    String recipient,
    String renderedBody,
    UUID providerId,
    DeliveryStatus status,
    DeliveryErrorKind errorKind,
    String errorMessage,
    String providerMessageId,
    int segmentCount,
    BigDecimal cost,
    Instant createdAt) {}
