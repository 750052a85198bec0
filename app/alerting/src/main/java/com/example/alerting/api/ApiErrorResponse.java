/*
 * どこで: Alerting API
 * 何を: 全エンドポイント共通のエラーボディ
 */
package com.example.alerting.api;

public record ApiErrorResponse(String code, String message) {}
