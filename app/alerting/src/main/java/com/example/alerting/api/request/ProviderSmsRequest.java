package com.example.alerting.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

/** テスト送信と任意メッセージのボディ。テスト送信では {@code body} を無視する。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProviderSmsRequest(@NotBlank String recipient, String body) {}
