/*
 * どこで: Alerting API
 * 何を: テンプレートの作成/置換/一覧/プレビューを提供する
 * なぜ: スケジュールで使う前に実際の文面とセグメント数を確認できるようにするため
 */
package com.example.alerting.api;

import com.example.alerting.api.request.PreviewTemplateRequest;
import com.example.alerting.api.request.SaveTemplateRequest;
import com.example.alerting.api.response.TemplateListResponse;
import com.example.alerting.api.response.TemplatePreviewResponse;
import com.example.alerting.api.response.TemplateResponse;
import com.example.alerting.model.MessageTemplate;
import com.example.alerting.model.RenderedMessage;
import com.example.alerting.service.MessageTemplateService;
import jakarta.validation.Valid;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/alerts/templates")
@RequiredArgsConstructor
public class MessageTemplateController {

  private final MessageTemplateService templateService;

  @PostMapping
  public ResponseEntity<TemplateResponse> createTemplate(
      @Valid @RequestBody SaveTemplateRequest request) {
    final MessageTemplate saved = save(null, request);
    return ResponseEntity.status(HttpStatus.CREATED).body(TemplateResponse.from(saved));
  }

  @PutMapping("/{templateId}")
  public ResponseEntity<TemplateResponse> replaceTemplate(
      @PathVariable("templateId") UUID templateId,
      @Valid @RequestBody SaveTemplateRequest request) {
    return ResponseEntity.ok(TemplateResponse.from(save(templateId, request)));
  }

  @GetMapping
  public ResponseEntity<TemplateListResponse> listTemplates() {
    return ResponseEntity.ok(
        new TemplateListResponse(
            templateService.list().stream().map(TemplateResponse::from).toList()));
  }

  @PostMapping("/{templateId}/preview")
  public ResponseEntity<TemplatePreviewResponse> previewTemplate(
      @PathVariable("templateId") UUID templateId,
      @RequestBody(required = false) PreviewTemplateRequest request) {
    final Map<String, String> context =
        request == null || request.context() == null ? Map.of() : request.context();
    final RenderedMessage rendered = templateService.preview(templateId, context);
    return ResponseEntity.ok(
        new TemplatePreviewResponse(
            rendered.body(), rendered.segmentCount(), rendered.body().length()));
  }

  private MessageTemplate save(UUID templateId, SaveTemplateRequest request) {
    return templateService.save(
        templateId,
        request.name(),
        request.category(),
        request.body(),
        request.active() == null || request.active());
  }
}
