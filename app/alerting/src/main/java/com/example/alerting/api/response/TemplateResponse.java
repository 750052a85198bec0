package com.example.alerting.api.response;

import com.example.alerting.model.MessageTemplate;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "response-only DTO record")
public record TemplateResponse(
    String templateId,
    String name,
    String category,
    String body,
    boolean active,
    List<String> allowedPlaceholders,
    String updatedAt) {

  public static TemplateResponse from(MessageTemplate template) {
    return new TemplateResponse(
        template.templateId().toString(),
        template.name(),
        template.category().name(),
        template.body(),
        template.active(),
        template.category().placeholders().stream().sorted().toList(),
        ScheduleResponse.format(template.updatedAt()));
  }
}
