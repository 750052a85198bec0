/*
 * どこで: Alerting サービス層
 * 何を: テンプレート本文の {placeholder} を置換する
 * なぜ: 全置換か失敗かの二択にし、"{token}" が端末に届かないようにするため
 */
package com.example.alerting.service;

import com.example.alerting.model.RenderedMessage;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

@Component
public class MessageTemplateRenderer {

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z0-9_]+)\\}");
  // 中に波括弧を含まない波括弧の組、または単独の波括弧
  private static final Pattern BRACE_SPAN = Pattern.compile("\\{[^{}]*\\}|[{}]");

  /**
   * {@code context} の値で {@code body} を描画する。
   *
   * @throws TemplateRenderException context に無いプレースホルダをソートして、または正しい形式で
   *     ない波括弧をすべて列挙する
   */
  public RenderedMessage render(String body, Map<String, String> context) {
    final List<String> malformed = malformedTokens(body);
    if (!malformed.isEmpty()) {
      throw TemplateRenderException.malformed(malformed);
    }
    final Set<String> missing = new TreeSet<>();
    for (String placeholder : placeholders(body)) {
      if (context.get(placeholder) == null) {
        missing.add(placeholder);
      }
    }
    if (!missing.isEmpty()) {
      throw new TemplateRenderException(new ArrayList<>(missing));
    }
    final Matcher matcher = PLACEHOLDER.matcher(body);
    final StringBuilder rendered = new StringBuilder(body.length());
    while (matcher.find()) {
      matcher.appendReplacement(rendered, Matcher.quoteReplacement(context.get(matcher.group(1))));
    }
    matcher.appendTail(rendered);
    final List<String> leftover = braceSpans(rendered.toString());
    if (!leftover.isEmpty()) {
      throw TemplateRenderException.malformed(leftover);
    }
    return RenderedMessage.of(rendered.toString());
  }

  /** 初出順のプレースホルダ名。 */
  public List<String> placeholders(String body) {
    if (body == null) {
      return List.of();
    }
    final Set<String> names = new LinkedHashSet<>();
    final Matcher matcher = PLACEHOLDER.matcher(body);
    while (matcher.find()) {
      names.add(matcher.group(1));
    }
    return List.copyOf(names);
  }

  /** {@code {name}} 形式でない波括弧を初出順に返す。 */
  public List<String> malformedTokens(String body) {
    if (body == null) {
      return List.of();
    }
    return braceSpans(PLACEHOLDER.matcher(body).replaceAll(" "));
  }

  private static List<String> braceSpans(String text) {
    final Set<String> spans = new LinkedHashSet<>();
    final Matcher matcher = BRACE_SPAN.matcher(text);
    while (matcher.find()) {
      spans.add(matcher.group());
    }
    return List.copyOf(spans);
  }
}
