package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.Date;
import java.time.Instant;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class JdbcTimestampUtilsTest {

  @Test
  void instantsKeepTheirPointOnTheTimeline() {
    final Instant instant = Instant.parse("2026-03-02T15:00:00.123456Z");

    assertThat(JdbcTimestampUtils.toInstant(JdbcTimestampUtils.toTimestamp(instant)))
        .isEqualTo(instant);
  }

  @Test
  void localDatesMapToSqlDates() {
    final LocalDate date = LocalDate.of(2026, 3, 17);

    assertThat(JdbcTimestampUtils.toSqlDate(date)).isEqualTo(Date.valueOf("2026-03-17"));
    assertThat(JdbcTimestampUtils.toLocalDate(Date.valueOf("2026-03-17"))).isEqualTo(date);
  }

  @Test
  void nullsPassThrough() {
    assertThat(JdbcTimestampUtils.toTimestamp(null)).isNull();
    assertThat(JdbcTimestampUtils.toInstant(null)).isNull();
    assertThat(JdbcTimestampUtils.toSqlDate(null)).isNull();
    assertThat(JdbcTimestampUtils.toLocalDate(null)).isNull();
  }
}
