package com.example.alerting.api.response;

import com.example.alerting.model.DeliveryRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.math.BigDecimal;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeliveryRecordResponse(
    String deliveryId,
    String scheduleId,
    String entityId,
    String recipient,
    String renderedBody,
    String providerId,
    String status,
    String errorKind,
    String errorMessage,
    String providerMessageId,
    int segmentCount,
    BigDecimal cost,
    String createdAt) {

  public static DeliveryRecordResponse from(DeliveryRecord record) {
    return new DeliveryRecordResponse(
        record.deliveryId().toString(),
        record.scheduleId() == null ? null : record.scheduleId().toString(),
        record.entityId(),
        record.recipient(),
        record.renderedBody(),
        record.providerId() == null ? null : record.providerId().toString(),
        record.status().name(),
        record.errorKind() == null ? null : record.errorKind().name(),
        record.errorMessage(),
        record.providerMessageId(),
        record.segmentCount(),
        record.cost(),
        ScheduleResponse.format(record.createdAt()));
  }
}
