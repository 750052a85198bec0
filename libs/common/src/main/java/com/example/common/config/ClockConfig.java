/*
 * どこで: 共通設定
 * 何を: 時刻に依存する全 Bean が受け取る UTC のシステム時計
 * なぜ: 実行時刻/lease 期限/クォータウィンドウは UTC で比較し、ローカル日付は設定したタイムゾーンから求めるため
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClockConfig {

  @Bean
  public Clock systemClock() {
    return Clock.systemUTC();
  }
}
