/*
 * どこで: Alerting ドメインモデル
 * 何を: 外部から見えるスケジュールの状態
 * なぜ: DUE は読み取り時に next_run から導出し、保存しないため
 */
package com.example.alerting.model;

import java.time.Instant;

public enum ScheduleStatus {
  ACTIVE,
  PAUSED,
  DUE;

  public static ScheduleStatus of(AlertSchedule schedule, Instant now) {
    if (!schedule.active()) {
      return PAUSED;
    }
    return schedule.isDue(now) ? DUE : ACTIVE;
  }
}
