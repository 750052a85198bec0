/*
 * どこで: Alerting ドメインモデル
 * 何を: プレースホルダ置換後のメッセージ本文
 * なぜ: セグメント数は費用表示用で、長文の分割はプロバイダが行うため
 */
package com.example.alerting.model;

public record RenderedMessage(String body, int segmentCount) {

  public static final int SEGMENT_LENGTH = 160;

  public static RenderedMessage of(String body) {
    return new RenderedMessage(body, segmentsFor(body));
  }

  public static int segmentsFor(String body) {
    if (body == null || body.isEmpty()) {
      return 0;
    }
    return (body.length() + SEGMENT_LENGTH - 1) / SEGMENT_LENGTH;
  }
}
