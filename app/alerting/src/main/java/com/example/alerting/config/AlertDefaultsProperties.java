/*
 * どこで: Alerting アプリの設定バインド
 * 何を: 新規スケジュールとテンプレート文脈に適用する既定値を保持する
 * なぜ: ほとんどのスケジュールは同じ window と frequency で作られるため
 */
package com.example.alerting.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "alerting.defaults")
@Validated
public record AlertDefaultsProperties(
    @Min(0) int triggerWindowDays,
    @Min(1) int frequencyDays,
    String stationFilter,
    String datePattern,
    String renewalUrl) {

  public AlertDefaultsProperties {
    stationFilter = stationFilter == null || stationFilter.isBlank() ? "ALL" : stationFilter;
    datePattern = datePattern == null || datePattern.isBlank() ? "MM/dd/yyyy" : datePattern;
    renewalUrl = renewalUrl == null ? "" : renewalUrl;
  }
}
