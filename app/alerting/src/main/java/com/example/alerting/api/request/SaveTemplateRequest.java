/*
 * どこで: Alerting API リクエスト DTO
 * 何を: テンプレート作成/置換リクエストのボディ
 */
package com.example.alerting.api.request;

import com.example.alerting.model.TemplateCategory;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SaveTemplateRequest(
    @NotBlank @Size(max = 128) String name,
    @NotNull TemplateCategory category,
    @NotBlank String body,
    Boolean active) {}
