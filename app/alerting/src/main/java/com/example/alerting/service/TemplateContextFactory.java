/*
 * どこで: Alerting サービス層
 * 何を: 候補 1 件分のプレースホルダ値を実行時に組み立てる
 * なぜ: 日付と残日数はデータ読み込み時ではなく実行時の時計とタイムゾーンで決まるため
 */
package com.example.alerting.service;

import com.example.alerting.config.AlertDefaultsProperties;
import com.example.alerting.config.AlertRunnerProperties;
import com.example.alerting.model.CandidateEntity;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class TemplateContextFactory {

  private static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

  private final AlertRunnerProperties runnerProperties;
  private final AlertDefaultsProperties defaults;
  private final DateTimeFormatter dateFormat;

  public TemplateContextFactory(
      AlertRunnerProperties runnerProperties, AlertDefaultsProperties defaults) {
    this.runnerProperties = runnerProperties;
    this.defaults = defaults;
    this.dateFormat = DateTimeFormatter.ofPattern(defaults.datePattern());
  }

  /** エンティティ属性を先に入れ、キーが衝突したら導出値を優先する。 */
  public Map<String, String> build(CandidateEntity entity, Instant now) {
    final LocalDate today = LocalDate.ofInstant(now, runnerProperties.zoneId());
    final Map<String, String> context = new HashMap<>(entity.attributes());
    if (entity.station() != null) {
      context.put("station", entity.station());
    }
    context.put("date", dateFormat.format(today));
    context.put("timestamp", TIMESTAMP_FORMAT.format(now.atZone(runnerProperties.zoneId())));
    if (!defaults.renewalUrl().isBlank()) {
      context.putIfAbsent("renewal_url", defaults.renewalUrl());
    }
    if (entity.thresholdDate() != null) {
      final String threshold = dateFormat.format(entity.thresholdDate());
      context.put(
          "days_remaining", String.valueOf(ChronoUnit.DAYS.between(today, entity.thresholdDate())));
      switch (entity.alertType()) {
        case LICENSE_EXPIRY -> context.put("expiry_date", threshold);
        case INVENTORY_LOW -> context.put("reorder_date", threshold);
        case SYSTEM_NOTICE -> context.put("due_date", threshold);
      }
    }
    return context;
  }
}
