/*
 * どこで: Alerting アプリの設定バインド
 * 何を: スケジュール runner のループ/lease/監査設定を保持する
 * なぜ: ポーリング間隔と lease 長を環境ごとに調整できるようにするため
 */
package com.example.alerting.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "alerting.runner")
@Validated
public record AlertRunnerProperties(
    boolean enabled,
    @NotNull Duration pollInterval,
    @Positive int batchSize,
    @NotNull Duration lease,
    @NotBlank String zone,
    @Positive int errorMessageMaxLength) {

  @AssertTrue(message = "alerting.runner.lease must be positive")
  public boolean isLeasePositive() {
    return lease != null && !lease.isZero() && !lease.isNegative();
  }

  @AssertTrue(message = "alerting.runner.zone must be a valid zone id")
  public boolean isZoneValid() {
    if (zone == null || zone.isBlank()) {
      return false;
    }
    try {
      ZoneId.of(zone);
      return true;
    } catch (DateTimeException ex) {
      return false;
    }
  }

  public ZoneId zoneId() {
    return ZoneId.of(zone);
  }
}
