package com.example.alerting.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.alerting.delivery.ProviderRegistry;
import com.example.alerting.model.DeliveryErrorKind;
import com.example.alerting.model.DeliveryRecord;
import com.example.alerting.model.DeliveryStatus;
import com.example.alerting.model.ProviderQuotaStatus;
import com.example.alerting.service.InvalidAlertRequestException;
import com.example.alerting.service.ProviderNotFoundException;
import com.example.alerting.service.ProviderOperationsService;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(ProviderController.class)
@Import(ApiExceptionHandler.class)
class ProviderControllerTest {

  private static final Instant NOW = Instant.parse("2026-03-02T15:00:00Z");
  private static final UUID PROVIDER_ID = UUID.randomUUID();

  @Autowired private MockMvc mockMvc;

  @MockitoBean private ProviderRegistry providerRegistry;
  @MockitoBean private ProviderOperationsService providerOperations;

  @Test
  void quotaListsUsageAndRemaining() throws Exception {
    when(providerRegistry.quotaStatus(any()))
        .thenReturn(
            List.of(
                new ProviderQuotaStatus(
                    UUID.randomUUID(),
                    "primary",
                    true,
                    false,
                    95,
                    100,
                    Instant.parse("2026-03-02T08:00:00Z"))));

    mockMvc
        .perform(get("/v1/alerts/providers/quota"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.providers[0].name").value("primary"))
        .andExpect(jsonPath("$.providers[0].remaining").value(5))
        .andExpect(jsonPath("$.providers[0].window_started_at").value("2026-03-02T08:00:00Z"));
  }

  @Test
  void unexpectedFailureReturns500WithoutDetails() throws Exception {
    when(providerRegistry.quotaStatus(any())).thenThrow(new IllegalStateException("db down"));

    mockMvc
        .perform(get("/v1/alerts/providers/quota"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("ALERT_INTERNAL_ERROR"))
        .andExpect(jsonPath("$.message").value("internal error"));
  }

  @Test
  void testSmsReturnsLedgerRecordWithoutSchedule() throws Exception {
    when(providerOperations.sendTest(PROVIDER_ID, "+15550100001"))
        .thenReturn(record(DeliveryStatus.SENT, null));

    mockMvc
        .perform(
            post("/v1/alerts/providers/{id}/test-sms", PROVIDER_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"recipient\":\"+15550100001\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("SENT"))
        .andExpect(jsonPath("$.schedule_id").doesNotExist())
        .andExpect(jsonPath("$.entity_id").value("operator-test"));
  }

  @Test
  void refusedMessageIsReportedAsFailedRecord() throws Exception {
    when(providerOperations.sendMessage(PROVIDER_ID, "+15550100001", "truck at 4pm"))
        .thenReturn(record(DeliveryStatus.FAILED, DeliveryErrorKind.TEST_MODE_RESTRICTION));

    mockMvc
        .perform(
            post("/v1/alerts/providers/{id}/messages", PROVIDER_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"recipient\":\"+15550100001\",\"body\":\"truck at 4pm\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("FAILED"))
        .andExpect(jsonPath("$.error_kind").value("TEST_MODE_RESTRICTION"));
  }

  @Test
  void missingRecipientIsRejected() throws Exception {
    mockMvc
        .perform(
            post("/v1/alerts/providers/{id}/test-sms", PROVIDER_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"recipient\":\" \"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("ALERT_VALIDATION_ERROR"));
    verifyNoInteractions(providerOperations);
  }

  @Test
  void unknownProviderReturns404() throws Exception {
    when(providerOperations.testRecipients(PROVIDER_ID))
        .thenThrow(new ProviderNotFoundException(PROVIDER_ID));

    mockMvc
        .perform(get("/v1/alerts/providers/{id}/test-recipients", PROVIDER_ID))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("ALERT_PROVIDER_NOT_FOUND"));
  }

  @Test
  void testRecipientsAreAddedAndRemoved() throws Exception {
    when(providerOperations.addTestRecipient(PROVIDER_ID, "+1 (555) 010-0002"))
        .thenReturn(Set.of("+15550100002", "+15550100001"));
    when(providerOperations.removeTestRecipient(PROVIDER_ID, "+15550100001"))
        .thenReturn(Set.of("+15550100002"));

    mockMvc
        .perform(
            post("/v1/alerts/providers/{id}/test-recipients", PROVIDER_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"recipient\":\"+1 (555) 010-0002\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.provider_id").value(PROVIDER_ID.toString()))
        .andExpect(jsonPath("$.recipients[0]").value("+15550100001"))
        .andExpect(jsonPath("$.recipients[1]").value("+15550100002"));

    mockMvc
        .perform(
            delete("/v1/alerts/providers/{id}/test-recipients", PROVIDER_ID)
                .param("recipient", "+15550100001"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.recipients.length()").value(1));
  }

  @Test
  void invalidTestRecipientReturns400() throws Exception {
    when(providerOperations.addTestRecipient(PROVIDER_ID, "call me"))
        .thenThrow(new InvalidAlertRequestException("recipient is not a valid phone number"));

    mockMvc
        .perform(
            post("/v1/alerts/providers/{id}/test-recipients", PROVIDER_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"recipient\":\"call me\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("ALERT_BAD_REQUEST"));
  }

  private static DeliveryRecord record(DeliveryStatus status, DeliveryErrorKind errorKind) {
    return new DeliveryRecord(
        UUID.randomUUID(),
        null,
        "operator-test",
        "+15550100001",
        "hello",
        PROVIDER_ID,
        status,
        errorKind,
        errorKind == null ? null : "refused",
        null,
        1,
        BigDecimal.ZERO,
        NOW);
  }
}
