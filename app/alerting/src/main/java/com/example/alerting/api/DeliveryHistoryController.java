package com.example.alerting.api;

import com.example.alerting.api.response.DeliveryHistoryResponse;
import com.example.alerting.api.response.DeliveryRecordResponse;
import com.example.alerting.model.DeliveryStatus;
import com.example.alerting.model.HistoryFilter;
import com.example.alerting.service.DeliveryLedger;
import com.example.alerting.service.InvalidAlertRequestException;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/alerts/history")
@RequiredArgsConstructor
public class DeliveryHistoryController {

  private final DeliveryLedger ledger;

  /** 新しい順。{@code from} は含み、{@code to} は含まない。 */
  @GetMapping
  public ResponseEntity<DeliveryHistoryResponse> listHistory(
      @RequestParam(name = "schedule_id", required = false) UUID scheduleId,
      @RequestParam(name = "entity_id", required = false) String entityId,
      @RequestParam(name = "status", required = false) DeliveryStatus status,
      @RequestParam(name = "from", required = false) Instant from,
      @RequestParam(name = "to", required = false) Instant to,
      @RequestParam(name = "limit", defaultValue = "100") int limit) {
    if (from != null && to != null && !from.isBefore(to)) {
      throw new InvalidAlertRequestException("from must be before to");
    }
    final HistoryFilter filter = new HistoryFilter(scheduleId, entityId, status, from, to, limit);
    return ResponseEntity.ok(
        new DeliveryHistoryResponse(
            ledger.listHistory(filter).stream().map(DeliveryRecordResponse::from).toList()));
  }
}
