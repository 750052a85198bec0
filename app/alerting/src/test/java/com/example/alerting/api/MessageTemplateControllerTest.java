package com.example.alerting.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.alerting.TestFixtures;
import com.example.alerting.model.MessageTemplate;
import com.example.alerting.model.RenderedMessage;
import com.example.alerting.model.TemplateCategory;
import com.example.alerting.service.MessageTemplateNotFoundException;
import com.example.alerting.service.MessageTemplateService;
import com.example.alerting.service.TemplateRenderException;
import com.example.alerting.service.TemplateValidationException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(MessageTemplateController.class)
@Import(ApiExceptionHandler.class)
class MessageTemplateControllerTest {

  private static final Instant NOW = Instant.parse("2026-03-02T15:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private MessageTemplateService templateService;

  @Test
  void createTemplateReturns201WithAllowedPlaceholders() throws Exception {
    final MessageTemplate template = TestFixtures.licenseTemplate(NOW);
    when(templateService.save(
            isNull(), eq("expiry"), eq(TemplateCategory.LICENSE_EXPIRY), any(), eq(true)))
        .thenReturn(template);

    mockMvc
        .perform(
            post("/v1/alerts/templates")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name":"expiry","category":"LICENSE_EXPIRY","body":"{license_name}"}
                    """))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.template_id").value(template.templateId().toString()))
        .andExpect(jsonPath("$.allowed_placeholders[0]").value("days_remaining"))
        .andExpect(jsonPath("$.active").value(true));
  }

  @Test
  void invalidPlaceholdersReturn422() throws Exception {
    when(templateService.save(any(), any(), any(), any(), anyBoolean()))
        .thenThrow(new TemplateValidationException("placeholders not recognized: bogus"));

    mockMvc
        .perform(
            post("/v1/alerts/templates")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name":"x","category":"INVENTORY_ALERT","body":"{bogus}"}
                    """))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value("ALERT_TEMPLATE_INVALID"));
  }

  @Test
  void blankBodyIsRejectedBeforeReachingTheService() throws Exception {
    mockMvc
        .perform(
            post("/v1/alerts/templates")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name":"x","category":"INVENTORY_ALERT","body":" "}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("ALERT_VALIDATION_ERROR"));
  }

  @Test
  void replaceUnknownTemplateReturns404() throws Exception {
    final UUID templateId = UUID.randomUUID();
    when(templateService.save(eq(templateId), any(), any(), any(), anyBoolean()))
        .thenThrow(new MessageTemplateNotFoundException(templateId));

    mockMvc
        .perform(
            put("/v1/alerts/templates/{id}", templateId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name":"x","category":"LICENSE_EXPIRY","body":"{license_name}","active":false}
                    """))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("ALERT_TEMPLATE_NOT_FOUND"));
  }

  @Test
  void listTemplatesReturnsEveryTemplate() throws Exception {
    when(templateService.list()).thenReturn(List.of(TestFixtures.licenseTemplate(NOW)));

    mockMvc
        .perform(get("/v1/alerts/templates"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.templates[0].category").value("LICENSE_EXPIRY"));
  }

  @Test
  void previewReturnsRenderedText() throws Exception {
    final UUID templateId = UUID.randomUUID();
    when(templateService.preview(templateId, Map.of("license_name", "Lottery")))
        .thenReturn(RenderedMessage.of("Lottery expires soon"));

    mockMvc
        .perform(
            post("/v1/alerts/templates/{id}/preview", templateId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"context\":{\"license_name\":\"Lottery\"}}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.body").value("Lottery expires soon"))
        .andExpect(jsonPath("$.segment_count").value(1))
        .andExpect(jsonPath("$.length").value(20));
  }

  @Test
  void previewWithMissingValuesReturns422() throws Exception {
    final UUID templateId = UUID.randomUUID();
    when(templateService.preview(templateId, Map.of()))
        .thenThrow(new TemplateRenderException(List.of("license_name")));

    mockMvc
        .perform(post("/v1/alerts/templates/{id}/preview", templateId))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value("ALERT_TEMPLATE_RENDER_FAILED"))
        .andExpect(jsonPath("$.message").value("missing template placeholders: license_name"));
  }
}
