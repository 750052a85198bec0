/*
 * どこで: Alerting アプリの設定バインド
 * 何を: SMS トランスポート/リトライ/有効国/認証情報の設定を保持する
 * なぜ: 認証情報は DB に置かず、プロバイダ行は参照キーだけを持つため
 */
package com.example.alerting.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "alerting.sms")
@Validated
public record SmsDeliveryProperties(
    Transport transport,
    String baseUrl,
    String sendPath,
    @NotNull Duration connectTimeout,
    @NotNull Duration readTimeout,
    @NotNull Duration retryBackoff,
    double retryJitterMin,
    double retryJitterMax,
    @Valid List<Country> countries,
    Map<String, Credential> credentials) {

  public enum Transport {
    LOCAL,
    CLICKSEND
  }

  public SmsDeliveryProperties {
    transport = transport == null ? Transport.LOCAL : transport;
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://rest.clicksend.com/v3" : baseUrl;
    sendPath = sendPath == null || sendPath.isBlank() ? "/sms/send" : sendPath;
    countries = countries == null ? List.of() : List.copyOf(countries);
    credentials = credentials == null ? Map.of() : Map.copyOf(credentials);
  }

  @AssertTrue(message = "alerting.sms.retry-jitter-min must not exceed retry-jitter-max")
  public boolean isJitterRangeValid() {
    return retryJitterMin >= 0 && retryJitterMin <= retryJitterMax;
  }

  @AssertTrue(message = "alerting.sms.read-timeout must be positive")
  public boolean isReadTimeoutPositive() {
    return readTimeout != null && !readTimeout.isZero() && !readTimeout.isNegative();
  }

  public record Country(@NotBlank String callingCode, String name, boolean enabled) {}

  public record Credential(String username, String apiKey) {}
}
