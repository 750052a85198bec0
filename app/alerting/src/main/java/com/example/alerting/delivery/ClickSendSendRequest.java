/*
 * どこで: Alerting 配信層 (ClickSend ワイヤモデル)
 * 何を: POST /sms/send のボディ
 * なぜ: ClickSend はバッチを受け付けるが、エンジンは 1 呼び出し 1 メッセージで送るため
 */
package com.example.alerting.delivery;

import java.util.List;

public record ClickSendSendRequest(List<Message> messages) {

  public static ClickSendSendRequest single(String source, String to, String body) {
    return new ClickSendSendRequest(List.of(new Message(source, to, body)));
  }

  public record Message(String source, String to, String body) {}
}
