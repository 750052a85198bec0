/*
 * どこで: Alerting API リクエスト DTO
 * 何を: スケジュール作成リクエストのボディ
 * なぜ: 省略された window/frequency/station は alerting.defaults で補うため
 */
package com.example.alerting.api.request;

import com.example.alerting.model.AlertType;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateScheduleRequest(
    @NotBlank @Size(max = 128) String name,
    @NotNull AlertType alertType,
    @Min(0) Integer triggerWindowDays,
    @Min(1) Integer frequencyDays,
    @NotNull UUID templateId,
    @Size(max = 64) String stationFilter,
    UUID preferredProviderId,
    Boolean active) {}
