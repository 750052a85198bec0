/*
 * どこで: Alerting 配信層 (ClickSend ワイヤモデル)
 * 何を: POST /sms/send のレスポンス
 * なぜ: メッセージ単位のステータスで受理と宛先拒否を区別するため
 */
package com.example.alerting.delivery;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ClickSendSendResponse(
    Integer httpCode, String responseCode, String responseMsg, Data data) {

  public MessageResult firstMessage() {
    if (data == null || data.messages() == null || data.messages().isEmpty()) {
      return null;
    }
    return data.messages().get(0);
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Data(List<MessageResult> messages) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record MessageResult(String status, String messageId, String messagePrice, String customString) {}
}
