/*
 * どこで: 共通 JDBC ユーティリティ
 * 何を: Instant と LocalDate を明示的な JDBC 型でバインドする
 * なぜ: Map パラメータ経由の java.time 値は PostgreSQL ドライバが SQL 型を推論できないため
 */
package com.example.common;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instant は常に UTC。Timestamp.from は同じ時点を保つ
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }

  public static Date toSqlDate(LocalDate date) {
    return date == null ? null : Date.valueOf(date);
  }

  public static LocalDate toLocalDate(Date date) {
    return date == null ? null : date.toLocalDate();
  }
}
