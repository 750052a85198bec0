/*
 * どこで: Alerting 入力境界
 * 何を: アラート対象になり得るレコードの読み取り専用スナップショットを供給する
 * なぜ: ライセンス/在庫/お知らせのデータはエンジンの所有物ではないため
 */
package com.example.alerting.repository;

import com.example.alerting.model.AlertType;
import com.example.alerting.model.CandidateEntity;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface CandidateEntitySource {

  /**
   * 閾値日が {@code horizon} 以前の {@code alertType} のエンティティを返す。期限切れのものも含む。
   *
   * @param stationFilter ステーション名または {@code ALL}
   */
  List<CandidateEntity> findCandidates(AlertType alertType, String stationFilter, LocalDate horizon);

  /**
   * 候補が持つ ID でエンティティを 1 件引く。horizon/ステーション/状態は見ない。
   *
   * @param asOf 自身の閾値日を持たないエンティティに使う閾値日
   */
  Optional<CandidateEntity> findCandidate(AlertType alertType, String entityId, LocalDate asOf);
}
