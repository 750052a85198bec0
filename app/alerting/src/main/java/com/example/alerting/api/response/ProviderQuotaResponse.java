package com.example.alerting.api.response;

import com.example.alerting.model.ProviderQuotaStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProviderQuotaResponse(
    String providerId,
    String name,
    boolean active,
    boolean testMode,
    int used,
    int dailyQuota,
    int remaining,
    String windowStartedAt) {

  public static ProviderQuotaResponse from(ProviderQuotaStatus status) {
    return new ProviderQuotaResponse(
        status.providerId().toString(),
        status.name(),
        status.active(),
        status.testMode(),
        status.used(),
        status.dailyQuota(),
        status.remaining(),
        ScheduleResponse.format(status.windowStartedAt()));
  }
}
