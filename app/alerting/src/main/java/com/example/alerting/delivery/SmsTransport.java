/*
 * どこで: Alerting 配信層
 * 何を: 送信のうちネットワーク側の半分
 * なぜ: 実プロバイダ API とログスタブで検証・クォータの経路を共有するため
 */
package com.example.alerting.delivery;

import com.example.alerting.model.DeliveryResult;
import com.example.alerting.model.ProviderAccount;

public interface SmsTransport {

  /**
   * メッセージ 1 件をプロバイダへ渡す。
   *
   * @throws SmsDeliveryException {@link SmsDeliveryException.Reason} で分類済み。タイムアウトと
   *     接続失敗は {@code PROVIDER_UNAVAILABLE} として報告する
   */
  DeliveryResult send(ProviderAccount provider, String recipient, String body);
}
