/*
 * どこで: Alerting サービス層
 * 何を: 重複抑止と、配信判断の追記専用履歴
 * なぜ: SENT/FAILED/SKIPPED をすべて書き、各実行の経緯を履歴で説明できるようにするため
 */
package com.example.alerting.service;

import com.example.alerting.config.AlertRunnerProperties;
import com.example.alerting.model.DeliveryRecord;
import com.example.alerting.model.HistoryFilter;
import com.example.alerting.repository.DeliveryRecordRepository;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DeliveryLedger {

  private final DeliveryRecordRepository deliveryRecordRepository;
  private final AlertRunnerProperties runnerProperties;
  private final AlertMetrics metrics;

  /** {@code since} 以降にこの組の SENT 記録があるときだけ true。 */
  public boolean alreadyAlerted(UUID scheduleId, String entityId, Instant since) {
    return deliveryRecordRepository.existsSentSince(scheduleId, entityId, since);
  }

  public DeliveryRecord record(DeliveryRecord record) {
    final DeliveryRecord stored =
        new DeliveryRecord(
            record.deliveryId(),
            record.scheduleId(),
            record.entityId(),
            record.recipient(),
            record.renderedBody(),
            record.providerId(),
            record.status(),
            record.errorKind(),
            truncateError(record.errorMessage()),
            record.providerMessageId(),
            record.segmentCount(),
            record.cost(),
            record.createdAt());
    deliveryRecordRepository.insert(stored);
    metrics.recordDelivery(stored.status());
    return stored;
  }

  public List<DeliveryRecord> listHistory(HistoryFilter filter) {
    return deliveryRecordRepository.find(filter);
  }

  private String truncateError(String message) {
    if (message == null) {
      return null;
    }
    final int maxLength = runnerProperties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }
}
