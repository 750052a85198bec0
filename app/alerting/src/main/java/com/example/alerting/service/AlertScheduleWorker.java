/*
 * どこで: Alerting スケジュールワーカー
 * 何を: 固定遅延で due なスケジュールをポーリングする
 * なぜ: 固定遅延で JVM 内のポーリング重複を防ぎ、他 JVM との重複は lease で防ぐため
 */
package com.example.alerting.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "alerting.runner.enabled", havingValue = "true", matchIfMissing = true)
public class AlertScheduleWorker {

  private final AlertScheduleRunner runner;

  @Scheduled(fixedDelayString = "${alerting.runner.poll-interval}")
  public void run() {
    runner.runDueSchedules();
  }
}
