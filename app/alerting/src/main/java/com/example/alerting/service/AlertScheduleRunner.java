/*
 * どこで: Alerting サービス層
 * 何を: スケジュール 1 回分の実行 (claim、評価、配信、記録、次回時刻の更新) を行う
 * なぜ: 定期ワーカーと手動実行 API で同じ規則を共有するため
 */
package com.example.alerting.service;

import com.example.alerting.config.AlertRunnerProperties;
import com.example.alerting.delivery.NoEligibleProviderException;
import com.example.alerting.delivery.ProviderRegistry;
import com.example.alerting.delivery.SmsDeliveryClient;
import com.example.alerting.delivery.SmsDeliveryException;
import com.example.alerting.model.AlertSchedule;
import com.example.alerting.model.CandidateEntity;
import com.example.alerting.model.DeliveryErrorKind;
import com.example.alerting.model.DeliveryRecord;
import com.example.alerting.model.DeliveryResult;
import com.example.alerting.model.DeliveryStatus;
import com.example.alerting.model.MessageTemplate;
import com.example.alerting.model.ProviderAccount;
import com.example.alerting.model.RenderedMessage;
import com.example.alerting.model.RunSummary;
import com.example.alerting.repository.AlertScheduleRepository;
import com.example.alerting.repository.CandidateEntitySource;
import com.example.alerting.repository.MessageTemplateRepository;
import com.example.common.CorrelationIds;
import com.google.common.annotations.VisibleForTesting;
import java.math.BigDecimal;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
public class AlertScheduleRunner {

  private static final Logger logger = LoggerFactory.getLogger(AlertScheduleRunner.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";
  static final String MDC_SCHEDULE_ID = "schedule_id";
  static final String MDC_RUN_ID = "run_id";

  private final AlertScheduleRepository scheduleRepository;
  private final MessageTemplateRepository templateRepository;
  private final CandidateEntitySource candidateSource;
  private final TriggerEvaluator evaluator;
  private final TemplateContextFactory contextFactory;
  private final MessageTemplateRenderer renderer;
  private final DeliveryLedger ledger;
  private final ProviderRegistry providerRegistry;
  private final SmsDeliveryClient deliveryClient;
  private final AlertMetrics metrics;
  private final AlertRunnerProperties properties;
  private final Clock clock;
  private final String workerId;

  public AlertScheduleRunner(
      AlertScheduleRepository scheduleRepository,
      MessageTemplateRepository templateRepository,
      CandidateEntitySource candidateSource,
      TriggerEvaluator evaluator,
      TemplateContextFactory contextFactory,
      MessageTemplateRenderer renderer,
      DeliveryLedger ledger,
      ProviderRegistry providerRegistry,
      SmsDeliveryClient deliveryClient,
      AlertMetrics metrics,
      AlertRunnerProperties properties,
      Clock clock) {
    this.scheduleRepository = scheduleRepository;
    this.templateRepository = templateRepository;
    this.candidateSource = candidateSource;
    this.evaluator = evaluator;
    this.contextFactory = contextFactory;
    this.renderer = renderer;
    this.ledger = ledger;
    this.providerRegistry = providerRegistry;
    this.deliveryClient = deliveryClient;
    this.metrics = metrics;
    this.properties = properties;
    this.clock = clock;
    this.workerId = resolveWorkerId();
  }

  /**
   * next_run に関係なく {@code scheduleId} を今すぐ実行する。
   *
   * <p>停止中のスケジュールには触れない。別の実行が lease を保持していればその実行に束ねる。
   * それ以外の実行は、何も送らなかった場合や中断した場合でも next_run を 1 周期進める。
   *
   * @throws AlertScheduleNotFoundException スケジュールが存在しないとき
   */
  public RunSummary runSchedule(UUID scheduleId) {
    final Instant startedAt = Instant.now(clock);
    final String runId = CorrelationIds.newRunId();
    final AlertSchedule current =
        scheduleRepository
            .findById(scheduleId)
            .orElseThrow(() -> new AlertScheduleNotFoundException(scheduleId));
    if (!current.active()) {
      logger.info("schedule paused, run skipped scheduleId={} runId={}", scheduleId, runId);
      return finish(RunSummary.paused(scheduleId, runId, startedAt, current.nextRun()));
    }
    final String lockedBy = workerId + "/" + runId;
    final Optional<AlertSchedule> claimed =
        scheduleRepository.claim(
            scheduleId, startedAt, startedAt.plus(properties.lease()), lockedBy);
    if (claimed.isEmpty()) {
      logger.info(
          "schedule already running, trigger coalesced scheduleId={} runId={}", scheduleId, runId);
      return finish(RunSummary.coalesced(scheduleId, runId, startedAt, current.nextRun()));
    }
    final AlertSchedule schedule = claimed.get();
    if (!schedule.active()) {
      scheduleRepository.releaseLease(scheduleId, lockedBy);
      logger.info("schedule paused while claiming scheduleId={} runId={}", scheduleId, runId);
      return finish(RunSummary.paused(scheduleId, runId, startedAt, schedule.nextRun()));
    }
    MDC.put(MDC_SCHEDULE_ID, scheduleId.toString());
    MDC.put(MDC_RUN_ID, runId);
    try {
      return finish(execute(new RunContext(schedule, runId, startedAt), lockedBy));
    } finally {
      MDC.remove(MDC_SCHEDULE_ID);
      MDC.remove(MDC_RUN_ID);
    }
  }

  /**
   * スケジュールのテンプレートと優先プロバイダで、エンティティ 1 件の連絡先へ今すぐ通知する。
   *
   * <p>トリガウィンドウ/重複抑止/lease は見ず、next_run も変えない。配信記録は通常の実行と
   * 同じくスケジュールに紐付けて台帳に残す。
   *
   * @throws AlertScheduleNotFoundException スケジュールが存在しないとき
   * @throws CandidateEntityNotFoundException エンティティがスケジュールのアラート種別でないか、
   *     存在しないとき
   */
  public RunSummary sendNow(UUID scheduleId, String entityId) {
    final Instant startedAt = Instant.now(clock);
    final AlertSchedule schedule =
        scheduleRepository
            .findById(scheduleId)
            .orElseThrow(() -> new AlertScheduleNotFoundException(scheduleId));
    final CandidateEntity entity =
        candidateSource
            .findCandidate(schedule.alertType(), entityId, evaluator.today(startedAt))
            .orElseThrow(
                () -> new CandidateEntityNotFoundException(schedule.alertType(), entityId));
    final RunContext context = new RunContext(schedule, CorrelationIds.newRunId(), startedAt);
    context.setDueCount(1);
    MDC.put(MDC_SCHEDULE_ID, scheduleId.toString());
    MDC.put(MDC_RUN_ID, context.runId());
    try {
      final Optional<MessageTemplate> template =
          templateRepository.findById(schedule.templateId()).filter(MessageTemplate::active);
      if (template.isEmpty()) {
        logger.error("template missing or inactive, immediate alert aborted");
        context.abort(DeliveryErrorKind.TEMPLATE_UNAVAILABLE);
        skipEntity(context, entity, DeliveryErrorKind.RUN_ABORTED, abortMessage(context));
      } else {
        alertEntity(context, entity, template.get(), startedAt);
      }
      final RunSummary summary = context.toSummary(schedule.nextRun());
      logger.info(
          "immediate alert finished entityId={} outcome={} sent={} failed={} skipped={}",
          entityId,
          summary.outcome(),
          summary.sent(),
          summary.failed(),
          summary.skipped());
      return summary;
    } finally {
      MDC.remove(MDC_SCHEDULE_ID);
      MDC.remove(MDC_RUN_ID);
    }
  }

  /** due なスケジュールをそれぞれ 1 回実行し、試行したスケジュール数を返す。 */
  public int runDueSchedules() {
    final Instant now = Instant.now(clock);
    metrics.updateDueCurrent(scheduleRepository.countDue(now));
    final List<UUID> dueIds = scheduleRepository.findDueIds(now, properties.batchSize());
    for (UUID scheduleId : dueIds) {
      try {
        runSchedule(scheduleId);
      } catch (AlertScheduleNotFoundException ex) {
        logger.warn("due schedule disappeared before it ran scheduleId={}", scheduleId);
      } catch (RuntimeException ex) {
        logger.error("schedule run failed scheduleId={}", scheduleId, ex);
      }
    }
    metrics.updateDueCurrent(scheduleRepository.countDue(Instant.now(clock)));
    return dueIds.size();
  }

  private RunSummary execute(RunContext context, String lockedBy) {
    final AlertSchedule schedule = context.schedule();
    final Instant startedAt = context.startedAt();
    final Instant nextRun = startedAt.plus(schedule.frequency());
    try {
      process(context);
    } finally {
      final int updated =
          scheduleRepository.completeRun(schedule.scheduleId(), startedAt, nextRun, lockedBy);
      if (updated == 0) {
        logger.warn("schedule run finished but lease was lost lockedBy={}", lockedBy);
      }
    }
    final RunSummary summary = context.toSummary(nextRun);
    logger.info(
        "schedule run finished outcome={} due={} sent={} failed={} skipped={} abortReason={} nextRun={}",
        summary.outcome(),
        summary.dueCount(),
        summary.sent(),
        summary.failed(),
        summary.skipped(),
        summary.abortReason(),
        nextRun);
    return summary;
  }

  private void process(RunContext context) {
    final AlertSchedule schedule = context.schedule();
    final Instant now = context.startedAt();
    final List<CandidateEntity> candidates;
    try {
      candidates =
          candidateSource.findCandidates(
              schedule.alertType(), schedule.stationFilter(), evaluator.horizon(schedule, now));
    } catch (DataAccessException ex) {
      logger.error("candidate source unavailable, run aborted", ex);
      context.abort(DeliveryErrorKind.CANDIDATE_SOURCE_UNAVAILABLE);
      return;
    }
    final List<CandidateEntity> due = evaluator.evaluate(schedule, candidates, now);
    context.setDueCount(due.size());
    if (due.isEmpty()) {
      return;
    }
    final Optional<MessageTemplate> template =
        templateRepository.findById(schedule.templateId()).filter(MessageTemplate::active);
    if (template.isEmpty()) {
      logger.error(
          "template missing or inactive, run aborted templateId={}", schedule.templateId());
      context.abort(DeliveryErrorKind.TEMPLATE_UNAVAILABLE);
    }
    final Instant dedupSince = evaluator.dedupSince(schedule, now);
    for (CandidateEntity entity : due) {
      if (context.aborted()) {
        skipEntity(context, entity, DeliveryErrorKind.RUN_ABORTED, abortMessage(context));
        continue;
      }
      // 評価後に別の実行が送信している可能性があるため、ここで再確認する
      if (ledger.alreadyAlerted(schedule.scheduleId(), entity.entityId(), dedupSince)) {
        recordSkipped(
            context, entity, null, DeliveryErrorKind.ALREADY_ALERTED, "already alerted");
        continue;
      }
      alertEntity(context, entity, template.get(), now);
    }
  }

  private void alertEntity(
      RunContext context, CandidateEntity entity, MessageTemplate template, Instant now) {
    if (entity.contactNumbers().isEmpty()) {
      recordSkipped(
          context,
          entity,
          null,
          DeliveryErrorKind.NO_RECIPIENT,
          "no active contact for station " + entity.station());
      return;
    }
    final RenderedMessage message;
    try {
      message = renderer.render(template.body(), contextFactory.build(entity, now));
    } catch (TemplateRenderException ex) {
      logger.warn(
          "template render failed entityId={} missing={} malformed={}",
          entity.entityId(),
          ex.missingPlaceholders(),
          ex.malformedTokens());
      for (String recipient : entity.contactNumbers()) {
        recordFailed(
            context, entity, recipient, null, null, DeliveryErrorKind.TEMPLATE_RENDER, ex);
      }
      return;
    }
    for (String recipient : entity.contactNumbers()) {
      if (context.aborted()) {
        recordSkipped(
            context, entity, recipient, DeliveryErrorKind.RUN_ABORTED, abortMessage(context));
        continue;
      }
      deliver(context, entity, recipient, message);
    }
  }

  private void deliver(
      RunContext context, CandidateEntity entity, String recipient, RenderedMessage message) {
    final ProviderAccount provider;
    try {
      provider =
          providerRegistry.selectProvider(
              context.schedule().preferredProviderId(),
              context.excludedProviders(),
              Instant.now(clock));
    } catch (NoEligibleProviderException ex) {
      logger.error("no eligible sms provider, run aborted entityId={}", entity.entityId(), ex);
      context.abort(DeliveryErrorKind.NO_ELIGIBLE_PROVIDER);
      recordFailed(
          context, entity, recipient, message, null, DeliveryErrorKind.NO_ELIGIBLE_PROVIDER, ex);
      return;
    }
    try {
      final DeliveryResult result = deliveryClient.send(provider, recipient, message.body());
      write(
          context,
          entity,
          recipient,
          message,
          provider.providerId(),
          DeliveryStatus.SENT,
          null,
          null,
          result);
    } catch (SmsDeliveryException ex) {
      switch (ex.reason()) {
        case AUTHENTICATION -> {
          context.excludeProvider(provider.providerId());
          context.abort(DeliveryErrorKind.AUTHENTICATION);
          logger.error(
              "sms provider rejected credentials, run aborted provider={}", provider.name(), ex);
        }
        case QUOTA_EXCEEDED -> {
          context.excludeProvider(provider.providerId());
          metrics.recordQuotaExhausted(provider.name());
          logger.warn("sms provider quota exhausted provider={}", provider.name());
        }
        default ->
            logger.warn(
                "sms delivery failed entityId={} reason={} provider={}",
                entity.entityId(),
                ex.reason(),
                provider.name(),
                ex);
      }
      recordFailed(
          context, entity, recipient, message, provider.providerId(), ex.reason().errorKind(), ex);
    }
  }

  private void skipEntity(
      RunContext context, CandidateEntity entity, DeliveryErrorKind kind, String reason) {
    if (entity.contactNumbers().isEmpty()) {
      recordSkipped(context, entity, null, kind, reason);
      return;
    }
    for (String recipient : entity.contactNumbers()) {
      recordSkipped(context, entity, recipient, kind, reason);
    }
  }

  private void recordSkipped(
      RunContext context,
      CandidateEntity entity,
      String recipient,
      DeliveryErrorKind kind,
      String reason) {
    write(context, entity, recipient, null, null, DeliveryStatus.SKIPPED, kind, reason, null);
  }

  private void recordFailed(
      RunContext context,
      CandidateEntity entity,
      String recipient,
      RenderedMessage message,
      UUID providerId,
      DeliveryErrorKind kind,
      RuntimeException cause) {
    write(
        context,
        entity,
        recipient,
        message,
        providerId,
        DeliveryStatus.FAILED,
        kind,
        cause.getMessage(),
        null);
  }

  private void write(
      RunContext context,
      CandidateEntity entity,
      String recipient,
      RenderedMessage message,
      UUID providerId,
      DeliveryStatus status,
      DeliveryErrorKind errorKind,
      String errorMessage,
      DeliveryResult result) {
    ledger.record(
        new DeliveryRecord(
            UUID.randomUUID(),
            context.schedule().scheduleId(),
            entity.entityId(),
            recipient,
            message == null ? null : message.body(),
            providerId,
            status,
            errorKind,
            errorMessage,
            result == null ? null : result.providerMessageId(),
            message == null ? 0 : message.segmentCount(),
            result == null ? BigDecimal.ZERO : result.cost(),
            Instant.now(clock)));
    context.count(status);
  }

  private static String abortMessage(RunContext context) {
    return "run aborted: " + context.abortReason();
  }

  private RunSummary finish(RunSummary summary) {
    metrics.recordRun(summary.outcome());
    return summary;
  }

  @VisibleForTesting
  String workerId() {
    return workerId;
  }

  private static String resolveWorkerId() {
    final String env = System.getenv(HOSTNAME_ENV);
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }
}
