/*
 * どこで: Alerting ドメインモデル
 * 何を: message_templates 行のスナップショット
 * なぜ: runner が描画し、API が管理するため
 */
package com.example.alerting.model;

import java.time.Instant;
import java.util.UUID;

public record MessageTemplate(
    UUID templateId,
    String name,
    TemplateCategory category,
    String body,
    boolean active,
    Instant createdAt,
    Instant updatedAt) {}
