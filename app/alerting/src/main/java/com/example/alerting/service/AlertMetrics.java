/*
 * どこで: Alerting サービス層
 * 何を: 配信/実行/プロバイダクォータのメトリクスを記録する
 * なぜ: 通知漏れが報告される前に due の滞留とクォータ枯渇を可視化するため
 */
package com.example.alerting.service;

import com.example.alerting.model.DeliveryStatus;
import com.example.alerting.model.RunOutcome;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring bean and cannot be copied")
public class AlertMetrics {

  static final String METRIC_DELIVERY_TOTAL = "alert.delivery.total";
  static final String METRIC_RUN_TOTAL = "alert.run.total";
  static final String METRIC_DUE_CURRENT = "alert.due.current";
  static final String METRIC_QUOTA_EXHAUSTED_TOTAL = "alert.provider.quota.exhausted.total";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger dueCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> deliveryCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> runCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> quotaCounters = new ConcurrentHashMap<>();

  public AlertMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_DUE_CURRENT, dueCurrent, AtomicInteger::get)
        .description("Active schedules whose next run has passed")
        .register(meterRegistry);
  }

  public void recordDelivery(DeliveryStatus status) {
    counter(
            deliveryCounters,
            METRIC_DELIVERY_TOTAL,
            "Delivery ledger records by status",
            "result",
            status.name().toLowerCase(Locale.ROOT))
        .increment();
  }

  public void recordRun(RunOutcome outcome) {
    counter(
            runCounters,
            METRIC_RUN_TOTAL,
            "Schedule runs by outcome",
            "outcome",
            outcome.name().toLowerCase(Locale.ROOT))
        .increment();
  }

  public void recordQuotaExhausted(String providerName) {
    counter(
            quotaCounters,
            METRIC_QUOTA_EXHAUSTED_TOTAL,
            "Sends refused by provider quota",
            "provider",
            providerName)
        .increment();
  }

  public void updateDueCurrent(int dueCount) {
    dueCurrent.set(Math.max(dueCount, 0));
  }

  private Counter counter(
      ConcurrentMap<String, Counter> cache,
      String name,
      String description,
      String tagKey,
      String tagValue) {
    return cache.computeIfAbsent(
        tagValue,
        ignored ->
            Counter.builder(name)
                .description(description)
                .tags(Tags.of(tagKey, tagValue))
                .register(meterRegistry));
  }
}
