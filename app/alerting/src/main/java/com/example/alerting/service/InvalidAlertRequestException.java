/*
 * どこで: Alerting サービス層
 * 何を: Bean Validation は通ったが使えないデータを参照するリクエスト
 * なぜ: 外部キー違反を 500 で返さず、API で 400 に対応付けるため
 */
package com.example.alerting.service;

public class InvalidAlertRequestException extends RuntimeException {

  public InvalidAlertRequestException(String message) {
    super(message);
  }
}
