/*
 * どこで: Alerting 配信層
 * 何を: クライアントまたはプロバイダが拒否した送信と、その分類済み理由
 * なぜ: 理由ごとに継続/プロバイダ除外/実行中断を runner が判断するため
 */
package com.example.alerting.delivery;

import com.example.alerting.model.DeliveryErrorKind;

public class SmsDeliveryException extends RuntimeException {

  public enum Reason {
    AUTHENTICATION(DeliveryErrorKind.AUTHENTICATION),
    INVALID_RECIPIENT(DeliveryErrorKind.INVALID_RECIPIENT),
    COUNTRY_NOT_ENABLED(DeliveryErrorKind.COUNTRY_NOT_ENABLED),
    TEST_MODE_RESTRICTION(DeliveryErrorKind.TEST_MODE_RESTRICTION),
    QUOTA_EXCEEDED(DeliveryErrorKind.QUOTA_EXCEEDED),
    PROVIDER_UNAVAILABLE(DeliveryErrorKind.PROVIDER_UNAVAILABLE);

    private final DeliveryErrorKind errorKind;

    Reason(DeliveryErrorKind errorKind) {
      this.errorKind = errorKind;
    }

    public DeliveryErrorKind errorKind() {
      return errorKind;
    }
  }

  private final Reason reason;

  public SmsDeliveryException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public SmsDeliveryException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
