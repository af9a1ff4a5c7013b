package com.neuralroots.orchestrator.logger;

import com.neuralroots.common.model.WorkflowRecord;
import com.neuralroots.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Signal;
import reactor.util.context.ContextView;

import java.util.function.Consumer;

/**
 * Logs each lifecycle stage of an assessment inside the reactive pipeline. Pure side effects;
 * never changes pipeline behaviour.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>{@link #REQUEST_RECEIVED}: request validated and defaults applied</li>
 *   <li>{@link #FRESHNESS_SCORED}: required freshness stage finished</li>
 *   <li>{@link #STAGES_COMPLETED}: market, logistics and weather resolved (real or fallback)</li>
 *   <li>{@link #SYNTHESIS_COMPLETED}: final score and action items built</li>
 *   <li>{@link #HISTORY_APPENDED}: record stored in the history log</li>
 * </ol>
 *
 * <pre>
 *     .doOnEach(flowLogger.stage(WorkflowFlowLogger.FRESHNESS_SCORED))
 * </pre>
 */
public class WorkflowFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(WorkflowFlowLogger.class);

    public static final String REQUEST_RECEIVED    = "REQUEST_RECEIVED";
    public static final String FRESHNESS_SCORED    = "FRESHNESS_SCORED";
    public static final String STAGES_COMPLETED    = "STAGES_COMPLETED";
    public static final String SYNTHESIS_COMPLETED = "SYNTHESIS_COMPLETED";
    public static final String HISTORY_APPENDED    = "HISTORY_APPENDED";

    /**
     * Returns a {@code doOnEach} consumer that logs {@code stageName} with the time spent since the
     * workflow started, on {@code onNext} signals only. Id and start time come from the signal's
     * Reactor Context.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            ContextView ctx = signal.getContextView();
            long elapsedMs = TraceContextUtil.elapsedMillis(ctx, System.currentTimeMillis());
            TraceContextUtil.withMdc(ctx, () ->
                log.info("[WorkflowFlow] stage={} workflowId={} elapsedMs={}",
                         stageName, TraceContextUtil.getWorkflowId(ctx), elapsedMs)
            );
        };
    }

    /**
     * Compact one-line summary of a finished record.
     */
    public void logRecord(WorkflowRecord record, long latencyMs) {
        TraceContextUtil.withMdc(record.id(), () ->
            log.info("[WorkflowFlow] completed workflowId={} crop={} status={} finalScore={} finalLevel={} "
                     + "mode={} price={} risk={} latencyMs={}",
                     record.id(), record.input().cropName(), record.status(),
                     record.synthesis().finalScore(), record.synthesis().finalLevel(),
                     record.logistics().deliveryMode(), record.market().recommendedPrice(),
                     record.weather().riskLevel(), latencyMs)
        );
    }

    public void logStageDegraded(String workflowId, String stageName, String reason) {
        TraceContextUtil.withMdc(workflowId, () ->
            log.warn("[WorkflowFlow] stage degraded workflowId={} stage={} reason={}",
                     workflowId, stageName, reason)
        );
    }
}
