/*
 * どこで: Alerting 設定バインドのテスト
 * 何を: alerting.runner の欠落値や不正値を起動時に弾くことを検証する
 */
package com.example.alerting.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.assertj.core.util.Throwables;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.boot.test.context.assertj.AssertableApplicationContext;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.test.context.runner.ContextConsumer;
import org.springframework.context.annotation.Configuration;

class AlertRunnerPropertiesValidationTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withUserConfiguration(TestConfiguration.class)
          .withPropertyValues(
              "alerting.runner.enabled=true",
              "alerting.runner.poll-interval=60s",
              "alerting.runner.batch-size=20",
              "alerting.runner.lease=10m",
              "alerting.runner.zone=America/Chicago",
              "alerting.runner.error-message-max-length=1000");

  @Test
  void contextStartsWithCompleteSettings() {
    contextRunner.run(
        context -> {
          assertThat(context).hasNotFailed();
          final AlertRunnerProperties properties = context.getBean(AlertRunnerProperties.class);
          assertThat(properties.pollInterval()).isEqualTo(Duration.ofSeconds(60));
          assertThat(properties.lease()).isEqualTo(Duration.ofMinutes(10));
          assertThat(properties.zoneId().getId()).isEqualTo("America/Chicago");
        });
  }

  @Test
  void contextFailsWhenZoneIsUnknown() {
    contextRunner
        .withPropertyValues("alerting.runner.zone=Mars/Olympus")
        .run(assertValidationFailure("valid zone id"));
  }

  @Test
  void contextFailsWhenLeaseIsZero() {
    contextRunner
        .withPropertyValues("alerting.runner.lease=0s")
        .run(assertValidationFailure("lease must be positive"));
  }

  @Test
  void contextFailsWhenBatchSizeIsZero() {
    contextRunner
        .withPropertyValues("alerting.runner.batch-size=0")
        .run(assertValidationFailure("batchSize"));
  }

  private ContextConsumer<AssertableApplicationContext> assertValidationFailure(
      String expectedText) {
    return context -> {
      assertThat(context).hasFailed();
      final Throwable root = Throwables.getRootCause(context.getStartupFailure());
      assertThat(root).isInstanceOf(BindValidationException.class);
      assertThat(root.getMessage()).contains(expectedText);
    };
  }

  @Configuration
  @EnableConfigurationProperties(AlertRunnerProperties.class)
  static class TestConfiguration {}
}
