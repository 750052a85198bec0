/*
 * どこで: Alerting 配信層
 * 何を: 宛先を検証し、クォータを予約してトランスポートへ渡す
 * なぜ: 検証失敗ではクォータを消費せず、一時的なプロバイダ障害は 1 回だけ再試行するため
 */
package com.example.alerting.delivery;

import com.example.alerting.config.SmsDeliveryProperties;
import com.example.alerting.model.DeliveryResult;
import com.example.alerting.model.ProviderAccount;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SmsDeliveryClient {

  private static final Logger logger = LoggerFactory.getLogger(SmsDeliveryClient.class);

  private final SmsTransport transport;
  private final ProviderRegistry providerRegistry;
  private final PhoneNumberPolicy phoneNumberPolicy;
  private final SmsDeliveryProperties properties;
  private final Clock clock;

  /**
   * {@code provider} 経由でメッセージを 1 件送る。
   *
   * <p>クォータはローカル検証の後、ネットワーク呼び出しの前に予約する。プロバイダが拒否しても
   * 返却しない。
   *
   * @throws SmsDeliveryException 最終的な失敗の分類済み理由付き
   */
  public DeliveryResult send(ProviderAccount provider, String recipient, String body) {
    final String normalized = phoneNumberPolicy.normalize(recipient);
    phoneNumberPolicy.requireEnabledCountry(normalized);
    if (!allowedInTestMode(provider, normalized)) {
      throw new SmsDeliveryException(
          SmsDeliveryException.Reason.TEST_MODE_RESTRICTION,
          "provider " + provider.name() + " is in test mode and " + normalized
              + " is not on its allow-list");
    }
    if (!providerRegistry.reserveQuota(provider, Instant.now(clock))) {
      throw new SmsDeliveryException(
          SmsDeliveryException.Reason.QUOTA_EXCEEDED,
          "daily quota reached for provider " + provider.name());
    }
    return transmitWithRetry(provider, normalized, body);
  }

  // 許可リストは区切り文字や 00 始まりのまま保存されている場合がある
  private boolean allowedInTestMode(ProviderAccount provider, String normalized) {
    if (!provider.testMode()) {
      return true;
    }
    return provider.testRecipients().stream()
        .map(phoneNumberPolicy::tryNormalize)
        .flatMap(Optional::stream)
        .anyMatch(normalized::equals);
  }

  private DeliveryResult transmitWithRetry(ProviderAccount provider, String recipient, String body) {
    try {
      return transport.send(provider, recipient, body);
    } catch (SmsDeliveryException ex) {
      if (ex.reason() != SmsDeliveryException.Reason.PROVIDER_UNAVAILABLE) {
        throw ex;
      }
      final Duration backoff = computeBackoffDuration();
      logger.warn(
          "sms provider unavailable, retrying once provider={} backoffMs={}",
          provider.name(),
          backoff.toMillis(),
          ex);
      pause(backoff);
      return transport.send(provider, recipient, body);
    }
  }

  @VisibleForTesting
  Duration computeBackoffDuration() {
    final double baseMillis = properties.retryBackoff().toMillis();
    final double jitterMin = properties.retryJitterMin();
    final double jitterMax = properties.retryJitterMax();
    final double jitter = jitterMin + ThreadLocalRandom.current().nextDouble() * (jitterMax - jitterMin);
    return Duration.ofMillis((long) Math.ceil(baseMillis * jitter));
  }

  @VisibleForTesting
  void pause(Duration backoff) {
    if (backoff.isZero() || backoff.isNegative()) {
      return;
    }
    try {
      Thread.sleep(backoff.toMillis());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new SmsDeliveryException(
          SmsDeliveryException.Reason.PROVIDER_UNAVAILABLE, "interrupted while waiting to retry", ex);
    }
  }
}
