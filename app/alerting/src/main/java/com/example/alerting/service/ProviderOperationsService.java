/*
 * どこで: Alerting サービス層
 * 何を: プロバイダ単位の運用操作 (テスト送信、任意メッセージ、テストモード許可リスト)
 * なぜ: 運用者の送信も定期アラートと同じ検証/クォータ/台帳を通すため
 */
package com.example.alerting.service;

import com.example.alerting.config.AlertRunnerProperties;
import com.example.alerting.delivery.PhoneNumberPolicy;
import com.example.alerting.delivery.SmsDeliveryClient;
import com.example.alerting.delivery.SmsDeliveryException;
import com.example.alerting.model.DeliveryRecord;
import com.example.alerting.model.DeliveryResult;
import com.example.alerting.model.DeliveryStatus;
import com.example.alerting.model.ProviderAccount;
import com.example.alerting.model.RenderedMessage;
import com.example.alerting.repository.ProviderAccountRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ProviderOperationsService {

  private static final Logger logger = LoggerFactory.getLogger(ProviderOperationsService.class);
  static final String TEST_ENTITY_ID = "operator-test";
  static final String MESSAGE_ENTITY_ID = "operator-message";
  static final int MAX_MESSAGE_LENGTH = 10 * RenderedMessage.SEGMENT_LENGTH;
  private static final DateTimeFormatter SENT_AT_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

  private final ProviderAccountRepository providerAccountRepository;
  private final SmsDeliveryClient deliveryClient;
  private final PhoneNumberPolicy phoneNumberPolicy;
  private final DeliveryLedger ledger;
  private final AlertRunnerProperties runnerProperties;
  private final Clock clock;

  /**
   * {@code providerId} 経由で定型のテストメッセージを送る。拒否された送信は FAILED として台帳に
   * 残し、例外ではなく戻り値で返す。
   *
   * @throws ProviderNotFoundException プロバイダが存在しないとき
   */
  public DeliveryRecord sendTest(UUID providerId, String recipient) {
    final ProviderAccount provider = get(providerId);
    final String sentAt =
        SENT_AT_FORMAT.format(Instant.now(clock).atZone(runnerProperties.zoneId()));
    final String body =
        "SMS test from the alert engine at "
            + sentAt
            + ". If you received this, provider "
            + provider.name()
            + " can reach this number.";
    return deliver(provider, TEST_ENTITY_ID, recipient, body);
  }

  /**
   * 運用者が書いたメッセージを {@code providerId} 経由で送る。
   *
   * @throws InvalidAlertRequestException 本文が空か 10 セグメントを超えるとき
   * @throws ProviderNotFoundException プロバイダが存在しないとき
   */
  public DeliveryRecord sendMessage(UUID providerId, String recipient, String body) {
    if (body == null || body.isBlank()) {
      throw new InvalidAlertRequestException("message body must not be blank");
    }
    if (body.length() > MAX_MESSAGE_LENGTH) {
      throw new InvalidAlertRequestException(
          "message body must be at most " + MAX_MESSAGE_LENGTH + " characters");
    }
    return deliver(get(providerId), MESSAGE_ENTITY_ID, recipient, body);
  }

  public Set<String> testRecipients(UUID providerId) {
    return get(providerId).testRecipients();
  }

  /**
   * プロバイダのテストモード許可リストに E.164 形式で番号を追加する。
   *
   * @throws InvalidAlertRequestException 番号を正規化できないとき
   */
  public Set<String> addTestRecipient(UUID providerId, String recipient) {
    get(providerId);
    final String normalized = normalize(recipient);
    if (providerAccountRepository.addTestRecipient(providerId, normalized)) {
      logger.info("test recipient added providerId={} recipient={}", providerId, normalized);
    }
    return testRecipients(providerId);
  }

  /** 許可リストから番号を外す。存在しない番号を外してもエラーにしない。 */
  public Set<String> removeTestRecipient(UUID providerId, String recipient) {
    get(providerId);
    final String normalized = normalize(recipient);
    if (providerAccountRepository.removeTestRecipient(providerId, normalized)) {
      logger.info("test recipient removed providerId={} recipient={}", providerId, normalized);
    }
    return testRecipients(providerId);
  }

  private DeliveryRecord deliver(
      ProviderAccount provider, String entityId, String recipient, String body) {
    final RenderedMessage message = RenderedMessage.of(body);
    try {
      final DeliveryResult result = deliveryClient.send(provider, recipient, body);
      logger.info(
          "operator sms sent provider={} entityId={} providerMessageId={}",
          provider.name(),
          entityId,
          result.providerMessageId());
      return ledger.record(
          record(provider, entityId, recipient, message, DeliveryStatus.SENT, null, result));
    } catch (SmsDeliveryException ex) {
      logger.warn(
          "operator sms failed provider={} entityId={} reason={}",
          provider.name(),
          entityId,
          ex.reason(),
          ex);
      return ledger.record(
          record(provider, entityId, recipient, message, DeliveryStatus.FAILED, ex, null));
    }
  }

  private DeliveryRecord record(
      ProviderAccount provider,
      String entityId,
      String recipient,
      RenderedMessage message,
      DeliveryStatus status,
      SmsDeliveryException failure,
      DeliveryResult result) {
    return new DeliveryRecord(
        UUID.randomUUID(),
        null,
        entityId,
        recipient,
        message.body(),
        provider.providerId(),
        status,
        failure == null ? null : failure.reason().errorKind(),
        failure == null ? null : failure.getMessage(),
        result == null ? null : result.providerMessageId(),
        message.segmentCount(),
        result == null ? BigDecimal.ZERO : result.cost(),
        Instant.now(clock));
  }

  private String normalize(String recipient) {
    return phoneNumberPolicy
        .tryNormalize(recipient)
        .orElseThrow(
            () ->
                new InvalidAlertRequestException(
                    "recipient is not a valid phone number: " + recipient));
  }

  private ProviderAccount get(UUID providerId) {
    return providerAccountRepository
        .findById(providerId)
        .orElseThrow(() -> new ProviderNotFoundException(providerId));
  }
}
