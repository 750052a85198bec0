/*
 * どこで: Alerting サービス層
 * 何を: テンプレートを完全なメッセージに描画できなかった
 * なぜ: 部分的に描画されたメッセージは送らないため
 */
package com.example.alerting.service;

import java.util.List;

public class TemplateRenderException extends RuntimeException {

  private final List<String> missingPlaceholders;
  private final List<String> malformedTokens;

  public TemplateRenderException(List<String> missingPlaceholders) {
    this(missingPlaceholders, List.of());
  }

  private TemplateRenderException(List<String> missingPlaceholders, List<String> malformedTokens) {
    super(describe(missingPlaceholders, malformedTokens));
    this.missingPlaceholders = List.copyOf(missingPlaceholders);
    this.malformedTokens = List.copyOf(malformedTokens);
  }

  /** 本文または描画結果にある、{@code {name}} 形式のプレースホルダにならない波括弧。 */
  public static TemplateRenderException malformed(List<String> malformedTokens) {
    return new TemplateRenderException(List.of(), malformedTokens);
  }

  public List<String> missingPlaceholders() {
    return missingPlaceholders;
  }

  public List<String> malformedTokens() {
    return malformedTokens;
  }

  private static String describe(List<String> missing, List<String> malformed) {
    if (malformed.isEmpty()) {
      return "missing template placeholders: " + String.join(", ", missing);
    }
    return "malformed template tokens: " + String.join(", ", malformed);
  }
}
