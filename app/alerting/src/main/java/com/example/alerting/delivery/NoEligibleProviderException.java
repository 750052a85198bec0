/*
 * どこで: Alerting 配信層
 * 何を: 有効でクォータが残っているプロバイダが 1 つもない
 * なぜ: 残りのエンティティを 1 件ずつ失敗させず、実行そのものを止めるため
 */
package com.example.alerting.delivery;

public class NoEligibleProviderException extends RuntimeException {

  public NoEligibleProviderException(String message) {
    super(message);
  }
}
