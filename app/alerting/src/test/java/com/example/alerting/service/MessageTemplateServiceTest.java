package com.example.alerting.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.alerting.TestFixtures;
import com.example.alerting.model.MessageTemplate;
import com.example.alerting.model.TemplateCategory;
import com.example.alerting.repository.MessageTemplateRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MessageTemplateServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-01T15:00:00Z");

  @Mock private MessageTemplateRepository templateRepository;

  private MessageTemplateService service;

  @BeforeEach
  void setUp() {
    service =
        new MessageTemplateService(
            templateRepository, new MessageTemplateRenderer(), Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void newTemplateIsInserted() {
    final MessageTemplate created =
        service.save(
            null, "expiry", TemplateCategory.LICENSE_EXPIRY, TestFixtures.LICENSE_BODY, true);

    assertThat(created.templateId()).isNotNull();
    assertThat(created.createdAt()).isEqualTo(NOW);
    verify(templateRepository).insert(created);
  }

  @Test
  void placeholdersOutsideTheCategoryAreRejected() {
    assertThatThrownBy(
            () ->
                service.save(
                    null,
                    "stock",
                    TemplateCategory.INVENTORY_ALERT,
                    "{product_name} low, expires {expiry_date} {bogus}",
                    true))
        .isInstanceOf(TemplateValidationException.class)
        .hasMessageContaining("bogus, expiry_date");
    verifyNoInteractions(templateRepository);
  }

  @Test
  void malformedPlaceholdersAreRejected() {
    assertThatThrownBy(
            () ->
                service.save(
                    null,
                    "expiry",
                    TemplateCategory.LICENSE_EXPIRY,
                    "Renew {license-name} at {station} ({expiry date})",
                    true))
        .isInstanceOf(TemplateValidationException.class)
        .hasMessageContaining("{license-name}, {expiry date}");
    verifyNoInteractions(templateRepository);
  }

  @Test
  void blankBodyIsRejected() {
    assertThatThrownBy(
            () -> service.save(null, "empty", TemplateCategory.GENERAL_NOTIFICATION, "  ", true))
        .isInstanceOf(TemplateValidationException.class);
  }

  @Test
  void updateKeepsCreationTime() {
    final MessageTemplate existing = TestFixtures.licenseTemplate(NOW.minusSeconds(3600));
    when(templateRepository.findById(existing.templateId())).thenReturn(Optional.of(existing));

    final MessageTemplate updated =
        service.save(
            existing.templateId(),
            "renamed",
            TemplateCategory.LICENSE_EXPIRY,
            "{license_name} expires {expiry_date}",
            false);

    assertThat(updated.createdAt()).isEqualTo(existing.createdAt());
    assertThat(updated.updatedAt()).isEqualTo(NOW);
    assertThat(updated.active()).isFalse();
    verify(templateRepository).update(updated);
  }

  @Test
  void updatingUnknownTemplateFails() {
    final UUID missing = UUID.randomUUID();
    when(templateRepository.findById(missing)).thenReturn(Optional.empty());

    assertThatThrownBy(
            () ->
                service.save(
                    missing, "x", TemplateCategory.LICENSE_EXPIRY, "{license_name}", true))
        .isInstanceOf(MessageTemplateNotFoundException.class);
  }

  @Test
  void previewRendersWithoutPersisting() {
    final MessageTemplate template = TestFixtures.licenseTemplate(NOW);
    when(templateRepository.findById(any())).thenReturn(Optional.of(template));

    assertThat(
            service
                .preview(
                    template.templateId(),
                    Map.of(
                        "license_name", "Lottery",
                        "station", "MOBIL",
                        "expiry_date", "03/16/2026",
                        "days_remaining", "15"))
                .body())
        .isEqualTo("Lottery at MOBIL expires 03/16/2026 (15 days)");
  }
}
