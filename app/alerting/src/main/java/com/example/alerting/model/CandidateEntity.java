/*
 * どこで: Alerting ドメインモデル
 * 何を: アラート対象になり得るレコード (ライセンス/商品/お知らせ) の読み取り専用スナップショット
 * なぜ: エンジンは書き込まず、外部のレコードストアが所有するため
 */
package com.example.alerting.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public record CandidateEntity(
    String entityId,
    AlertType alertType,
    LocalDate thresholdDate,
    String station,
    List<String> contactNumbers,
    Map<String, String> attributes) {

  public CandidateEntity {
    contactNumbers = contactNumbers == null ? List.of() : List.copyOf(contactNumbers);
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
  }
}
