/*
 * どこで: Alerting サービス層
 * 何を: メッセージテンプレートの保存/一覧/プレビュー
 * なぜ: 不正形式や未対応のプレースホルダを保存時に弾き、実行まで持ち込まないため
 */
package com.example.alerting.service;

import com.example.alerting.model.MessageTemplate;
import com.example.alerting.model.RenderedMessage;
import com.example.alerting.model.TemplateCategory;
import com.example.alerting.repository.MessageTemplateRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class MessageTemplateService {

  private static final Logger logger = LoggerFactory.getLogger(MessageTemplateService.class);

  private final MessageTemplateRepository templateRepository;
  private final MessageTemplateRenderer renderer;
  private final Clock clock;

  /**
   * {@code templateId} が null なら追加し、そうでなければ既存のテンプレートを置き換える。
   *
   * @throws TemplateValidationException 本文が空か、{@code {name}} 形式でない波括弧を含むか、
   *     カテゴリが認識しないプレースホルダを使うとき
   * @throws MessageTemplateNotFoundException 存在しない ID を更新しようとしたとき
   */
  public MessageTemplate save(
      UUID templateId, String name, TemplateCategory category, String body, boolean active) {
    validate(category, body);
    final Instant now = Instant.now(clock);
    if (templateId == null) {
      final MessageTemplate created =
          new MessageTemplate(UUID.randomUUID(), name, category, body, active, now, now);
      templateRepository.insert(created);
      logger.info(
          "message template created templateId={} category={}", created.templateId(), category);
      return created;
    }
    final MessageTemplate existing = get(templateId);
    final MessageTemplate updated =
        new MessageTemplate(templateId, name, category, body, active, existing.createdAt(), now);
    templateRepository.update(updated);
    logger.info("message template updated templateId={} active={}", templateId, active);
    return updated;
  }

  public MessageTemplate get(UUID templateId) {
    return templateRepository
        .findById(templateId)
        .orElseThrow(() -> new MessageTemplateNotFoundException(templateId));
  }

  public List<MessageTemplate> list() {
    return templateRepository.findAll();
  }

  /** 保存済みテンプレートを呼び出し側の値で描画する。送信はしない。 */
  public RenderedMessage preview(UUID templateId, Map<String, String> context) {
    return renderer.render(get(templateId).body(), context);
  }

  private void validate(TemplateCategory category, String body) {
    if (body == null || body.isBlank()) {
      throw new TemplateValidationException("template body must not be blank");
    }
    final List<String> malformed = renderer.malformedTokens(body);
    if (!malformed.isEmpty()) {
      throw new TemplateValidationException(
          "malformed placeholders, use {name} with letters, digits or underscores: "
              + String.join(", ", malformed));
    }
    final Set<String> unknown = category.unknownPlaceholders(renderer.placeholders(body));
    if (!unknown.isEmpty()) {
      throw new TemplateValidationException(
          "placeholders not recognized for category "
              + category
              + ": "
              + String.join(", ", unknown));
    }
  }
}
