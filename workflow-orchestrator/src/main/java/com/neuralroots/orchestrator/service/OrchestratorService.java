package com.neuralroots.orchestrator.service;

import com.neuralroots.analysis.stage.FreshnessScorer;
import com.neuralroots.analysis.stage.LogisticsSelector;
import com.neuralroots.analysis.stage.MarketPricer;
import com.neuralroots.analysis.stage.WeatherRiskAssessor;
import com.neuralroots.analysis.synthesis.SynthesisEngine;
import com.neuralroots.analysis.validation.ShipmentRequestValidator;
import com.neuralroots.analysis.validation.ValidationReport;
import com.neuralroots.common.exception.AssessmentException;
import com.neuralroots.common.exception.FreshnessComputationException;
import com.neuralroots.common.model.FreshnessResult;
import com.neuralroots.common.model.LogisticsResult;
import com.neuralroots.common.model.MarketResult;
import com.neuralroots.common.model.ShipmentRequest;
import com.neuralroots.common.model.StageResult;
import com.neuralroots.common.model.SynthesisResult;
import com.neuralroots.common.model.WeatherResult;
import com.neuralroots.common.model.WorkflowRecord;
import com.neuralroots.common.model.WorkflowStatus;
import com.neuralroots.common.stage.DegradableStage;
import com.neuralroots.common.stage.StageInput;
import com.neuralroots.common.trace.TraceContextUtil;
import com.neuralroots.orchestrator.dto.HealthReport;
import com.neuralroots.orchestrator.dto.QuickAssessment;
import com.neuralroots.orchestrator.history.HistoryStore;
import com.neuralroots.orchestrator.logger.WorkflowFlowLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs one assessment end to end.
 *
 * <pre>
 *   validate + defaults
 *     → FreshnessScorer            (fatal on failure)
 *     → MarketPricer ┐
 *       LogisticsSelector ├ concurrent, each bounded by the request deadline
 *       WeatherRiskAssessor ┘
 *     → SynthesisEngine
 *     → HistoryStore.append
 * </pre>
 *
 * <p>A fan-out stage that throws or misses the deadline is replaced by its own
 * {@link DegradableStage#fallback}, so once freshness succeeds the workflow always completes.
 * The deadline is one shared budget: all three stages are subscribed together and each gets
 * {@code .timeout(deadline)}, and a timeout cancels the in-flight call.
 */
@Service
public class OrchestratorService {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorService.class);

    private final FreshnessScorer freshnessScorer;
    private final MarketPricer marketPricer;
    private final LogisticsSelector logisticsSelector;
    private final WeatherRiskAssessor weatherRiskAssessor;
    private final SynthesisEngine synthesisEngine;
    private final HistoryStore historyStore;
    private final WorkflowIdGenerator idGenerator;
    private final WorkflowFlowLogger flowLogger;
    private final Clock clock;
    private final Duration deadline;

    private final AtomicLong workflowsExecuted = new AtomicLong();

    public OrchestratorService(
            FreshnessScorer freshnessScorer,
            MarketPricer marketPricer,
            LogisticsSelector logisticsSelector,
            WeatherRiskAssessor weatherRiskAssessor,
            SynthesisEngine synthesisEngine,
            HistoryStore historyStore,
            WorkflowIdGenerator idGenerator,
            WorkflowFlowLogger flowLogger,
            Clock clock,
            Duration stageDeadline) {
        this.freshnessScorer     = freshnessScorer;
        this.marketPricer        = marketPricer;
        this.logisticsSelector   = logisticsSelector;
        this.weatherRiskAssessor = weatherRiskAssessor;
        this.synthesisEngine     = synthesisEngine;
        this.historyStore        = historyStore;
        this.idGenerator         = idGenerator;
        this.flowLogger          = flowLogger;
        this.clock               = clock;
        this.deadline            = stageDeadline;
    }

    public Mono<WorkflowRecord> assess(ShipmentRequest request) {
        return Mono.defer(() -> {
            final long startTime = System.currentTimeMillis();
            final String workflowId = idGenerator.next();
            TraceContextUtil.withMdc(workflowId, () ->
                log.info("Assessment started. workflowId={} crop={}",
                    workflowId, request != null ? request.cropName() : null));

            Mono<WorkflowRecord> pipeline = Mono.fromCallable(() -> {
                    ShipmentRequestValidator.requireValid(request);
                    return request.withDefaults();
                })
                .doOnEach(flowLogger.stage(WorkflowFlowLogger.REQUEST_RECEIVED))
                .map(normalized -> new StageInput(normalized, scoreFreshness(normalized)))
                .doOnEach(flowLogger.stage(WorkflowFlowLogger.FRESHNESS_SCORED))
                .flatMap(input -> Mono.zip(
                        runStage(marketPricer, input, workflowId),
                        runStage(logisticsSelector, input, workflowId),
                        runStage(weatherRiskAssessor, input, workflowId))
                    .doOnEach(flowLogger.stage(WorkflowFlowLogger.STAGES_COMPLETED))
                    .map(stages -> buildRecord(workflowId, input,
                        stages.getT1(), stages.getT2(), stages.getT3())))
                .doOnEach(flowLogger.stage(WorkflowFlowLogger.SYNTHESIS_COMPLETED))
                .doOnNext(record -> {
                    historyStore.append(record);
                    workflowsExecuted.incrementAndGet();
                    flowLogger.logRecord(record, System.currentTimeMillis() - startTime);
                })
                .doOnEach(flowLogger.stage(WorkflowFlowLogger.HISTORY_APPENDED))
                .doOnError(e -> TraceContextUtil.withMdc(workflowId, () ->
                    log.warn("Assessment aborted. workflowId={} reason={}", workflowId, e.getMessage())));

            return TraceContextUtil.withWorkflow(pipeline, workflowId, startTime);
        });
    }

    public Mono<QuickAssessment> quickAssess(ShipmentRequest request) {
        return assess(request).map(QuickAssessment::from);
    }

    /**
     * Checks a request without running any stage.
     */
    public ValidationReport validate(ShipmentRequest request) {
        return ShipmentRequestValidator.validate(request);
    }

    public List<WorkflowRecord> getHistory(int limit) {
        return historyStore.recent(limit);
    }

    public WorkflowRecord getWorkflow(String workflowId) {
        return historyStore.find(workflowId)
            .orElseThrow(() -> new WorkflowNotFoundException(workflowId));
    }

    public HealthReport getHealth() {
        List<String> stages = List.of(
            freshnessScorer.stageName(),
            marketPricer.stageName(),
            logisticsSelector.stageName(),
            weatherRiskAssessor.stageName());
        return new HealthReport("UP", stages.size(), stages,
            workflowsExecuted.get(), historyStore.size());
    }

    // ── internals ──────────────────────────────────────────────────────────

    private FreshnessResult scoreFreshness(ShipmentRequest request) {
        try {
            return freshnessScorer.evaluate(request);
        } catch (AssessmentException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new FreshnessComputationException("Could not score request: " + e.getMessage(), e);
        }
    }

    private <R extends StageResult> Mono<R> runStage(DegradableStage<R> stage, StageInput input,
                                                     String workflowId) {
        return Mono.fromCallable(() -> stage.evaluate(input))
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(deadline)
            .onErrorResume(e -> {
                String reason = e instanceof TimeoutException
                    ? "timed out after " + deadline.toMillis() + "ms"
                    : "stage failed: " + e.getMessage();
                return Mono.fromCallable(() -> stage.fallback(input, reason));
            })
            .doOnNext(result -> {
                if (result.degraded()) {
                    flowLogger.logStageDegraded(workflowId, stage.stageName(), result.degradedReason());
                }
            });
    }

    private WorkflowRecord buildRecord(String workflowId, StageInput input, MarketResult market,
                                       LogisticsResult logistics, WeatherResult weather) {
        SynthesisResult synthesis = synthesisEngine.synthesize(input.freshness(), market, logistics, weather);
        boolean degraded = market.degraded() || logistics.degraded() || weather.degraded();
        return new WorkflowRecord(
            workflowId,
            input.request(),
            input.freshness(),
            market,
            logistics,
            weather,
            synthesis,
            degraded ? WorkflowStatus.COMPLETED_DEGRADED : WorkflowStatus.COMPLETED,
            clock.instant());
    }
}
