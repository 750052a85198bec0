package com.example.alerting.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.alerting.TestFixtures;
import com.example.alerting.config.AlertRunnerProperties;
import com.example.alerting.model.AlertSchedule;
import com.example.alerting.model.AlertType;
import com.example.alerting.model.CandidateEntity;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TriggerEvaluatorTest {

  private static final Instant NOW = Instant.parse("2026-03-01T15:00:00Z");
  private static final LocalDate TODAY = LocalDate.of(2026, 3, 1);

  @Mock private DeliveryLedger ledger;

  private TriggerEvaluator evaluator;
  private AlertSchedule schedule;

  @BeforeEach
  void setUp() {
    evaluator =
        new TriggerEvaluator(
            ledger,
            new AlertRunnerProperties(
                true, Duration.ofSeconds(60), 20, Duration.ofMinutes(10), "America/Chicago", 200));
    schedule = TestFixtures.schedule(UUID.randomUUID(), "MOBIL", NOW);
  }

  @Test
  void entitiesInsideWindowAndOverdueEntitiesAreDue() {
    final CandidateEntity inWindow = TestFixtures.license("license-1", TODAY.plusDays(30), "MOBIL");
    final CandidateEntity overdue = TestFixtures.license("license-2", TODAY.minusDays(5), "MOBIL");
    final CandidateEntity tooFar = TestFixtures.license("license-3", TODAY.plusDays(31), "MOBIL");

    assertThat(evaluator.evaluate(schedule, List.of(inWindow, overdue, tooFar), NOW))
        .containsExactly(inWindow, overdue);
  }

  @Test
  void otherStationsTypesAndMissingDatesAreIgnored() {
    final CandidateEntity otherStation =
        TestFixtures.license("license-1", TODAY.plusDays(3), "SHELL");
    final CandidateEntity lowerCase = TestFixtures.license("license-2", TODAY.plusDays(3), " mobil ");
    final CandidateEntity product =
        new CandidateEntity(
            "product-1", AlertType.INVENTORY_LOW, TODAY, "MOBIL", List.of(), Map.of());
    final CandidateEntity noDate = TestFixtures.license("license-3", null, "MOBIL");

    assertThat(
            evaluator.evaluate(schedule, List.of(otherStation, lowerCase, product, noDate), NOW))
        .containsExactly(lowerCase);
  }

  @Test
  void recentlyAlertedEntitiesAreExcluded() {
    final CandidateEntity alerted = TestFixtures.license("license-1", TODAY.plusDays(3), "MOBIL");
    final CandidateEntity fresh = TestFixtures.license("license-2", TODAY.plusDays(3), "MOBIL");
    when(ledger.alreadyAlerted(eq(schedule.scheduleId()), any(), any()))
        .thenAnswer(invocation -> "license-1".equals(invocation.getArgument(1)));

    assertThat(evaluator.evaluate(schedule, List.of(alerted, fresh), NOW)).containsExactly(fresh);
    verify(ledger)
        .alreadyAlerted(schedule.scheduleId(), "license-2", evaluator.dedupSince(schedule, NOW));
  }

  @Test
  void dedupWindowStartsAtMidnightOfTheOldestBlockedDay() {
    // シカゴ時間 3/1 09:00。週次スケジュールは 2/23 から 3/1 までを抑止する
    assertThat(evaluator.dedupSince(schedule, NOW))
        .isEqualTo(Instant.parse("2026-02-23T06:00:00Z"));
  }

  @Test
  void horizonUsesTheConfiguredZone() {
    final Instant lateEvening = Instant.parse("2026-03-02T03:00:00Z");

    assertThat(evaluator.horizon(schedule, lateEvening)).isEqualTo(TODAY.plusDays(30));
  }

  @Test
  void daysUntilIsNegativeForOverdueDates() {
    assertThat(TriggerEvaluator.daysUntil(TODAY, TODAY.minusDays(2))).isEqualTo(-2);
    assertThat(TriggerEvaluator.daysUntil(TODAY, TODAY)).isZero();
  }
}
