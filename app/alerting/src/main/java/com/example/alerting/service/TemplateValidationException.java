/*
 * どこで: Alerting サービス層
 * 何を: 保存時に拒否されたテンプレート
 */
package com.example.alerting.service;

public class TemplateValidationException extends RuntimeException {

  public TemplateValidationException(String message) {
    super(message);
  }
}
