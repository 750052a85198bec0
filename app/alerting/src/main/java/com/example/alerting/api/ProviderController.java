/*
 * どこで: Alerting API
 * 何を: プロバイダのクォータ表示、テスト送信と任意メッセージ送信、テストモード許可リストを扱う
 * なぜ: 定期実行を待たずにプロバイダを端から端まで確認できるようにするため
 */
package com.example.alerting.api;

import com.example.alerting.api.request.ProviderSmsRequest;
import com.example.alerting.api.request.TestRecipientRequest;
import com.example.alerting.api.response.DeliveryRecordResponse;
import com.example.alerting.api.response.ProviderQuotaListResponse;
import com.example.alerting.api.response.ProviderQuotaResponse;
import com.example.alerting.api.response.TestRecipientsResponse;
import com.example.alerting.delivery.ProviderRegistry;
import com.example.alerting.service.ProviderOperationsService;
import jakarta.validation.Valid;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/alerts/providers")
@RequiredArgsConstructor
public class ProviderController {

  private final ProviderRegistry providerRegistry;
  private final ProviderOperationsService providerOperations;
  private final Clock clock;

  @GetMapping("/quota")
  public ResponseEntity<ProviderQuotaListResponse> listQuota() {
    return ResponseEntity.ok(
        new ProviderQuotaListResponse(
            providerRegistry.quotaStatus(Instant.now(clock)).stream()
                .map(ProviderQuotaResponse::from)
                .toList()));
  }

  @PostMapping("/{providerId}/test-sms")
  public ResponseEntity<DeliveryRecordResponse> sendTest(
      @PathVariable("providerId") UUID providerId,
      @Valid @RequestBody ProviderSmsRequest request) {
    return ResponseEntity.ok(
        DeliveryRecordResponse.from(providerOperations.sendTest(providerId, request.recipient())));
  }

  @PostMapping("/{providerId}/messages")
  public ResponseEntity<DeliveryRecordResponse> sendMessage(
      @PathVariable("providerId") UUID providerId,
      @Valid @RequestBody ProviderSmsRequest request) {
    return ResponseEntity.ok(
        DeliveryRecordResponse.from(
            providerOperations.sendMessage(providerId, request.recipient(), request.body())));
  }

  @GetMapping("/{providerId}/test-recipients")
  public ResponseEntity<TestRecipientsResponse> listTestRecipients(
      @PathVariable("providerId") UUID providerId) {
    return ResponseEntity.ok(
        TestRecipientsResponse.of(providerId, providerOperations.testRecipients(providerId)));
  }

  @PostMapping("/{providerId}/test-recipients")
  public ResponseEntity<TestRecipientsResponse> addTestRecipient(
      @PathVariable("providerId") UUID providerId,
      @Valid @RequestBody TestRecipientRequest request) {
    return ResponseEntity.ok(
        TestRecipientsResponse.of(
            providerId, providerOperations.addTestRecipient(providerId, request.recipient())));
  }

  @DeleteMapping("/{providerId}/test-recipients")
  public ResponseEntity<TestRecipientsResponse> removeTestRecipient(
      @PathVariable("providerId") UUID providerId,
      @RequestParam("recipient") String recipient) {
    return ResponseEntity.ok(
        TestRecipientsResponse.of(
            providerId, providerOperations.removeTestRecipient(providerId, recipient)));
  }
}
