package com.neuralroots.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Carries the workflow id and its start time through a reactive assessment pipeline.
 *
 * <p>Reactor Context is the source of truth inside the pipeline. MDC is only written as a
 * temporary bridge during a log statement, never left populated on a pooled thread.
 *
 * <pre>
 *     return TraceContextUtil.withWorkflow(pipeline, workflowId, startedAtMillis);
 * </pre>
 */
public final class TraceContextUtil {

    public static final String WORKFLOW_ID_KEY = "workflowId";
    public static final String STARTED_AT_KEY  = "workflowStartedAt";
    public static final String UNKNOWN         = "unknown";

    private TraceContextUtil() {}

    /**
     * Stores the workflow id and its start time in the Reactor Context of {@code mono}.
     * {@code contextWrite} propagates upstream during subscription, so call this at the end of
     * pipeline assembly.
     */
    public static <T> Mono<T> withWorkflow(Mono<T> mono, String workflowId, long startedAtMillis) {
        return mono.contextWrite(ctx -> ctx.put(WORKFLOW_ID_KEY, workflowId)
                                           .put(STARTED_AT_KEY, startedAtMillis));
    }

    /** Returns the workflow id from the context, or {@link #UNKNOWN}. Never {@code null}. */
    public static String getWorkflowId(ContextView ctx) {
        return ctx.getOrDefault(WORKFLOW_ID_KEY, UNKNOWN);
    }

    /** Milliseconds since the workflow started, or {@code -1} outside a workflow. */
    public static long elapsedMillis(ContextView ctx, long nowMillis) {
        Long startedAt = ctx.getOrDefault(STARTED_AT_KEY, null);
        return startedAt == null ? -1L : Math.max(0L, nowMillis - startedAt);
    }

    /**
     * Bridges {@code workflowId} into MDC for the duration of {@code logAction}, then removes it.
     */
    public static void withMdc(String workflowId, Runnable logAction) {
        MDC.put(WORKFLOW_ID_KEY, workflowId);
        try {
            logAction.run();
        } finally {
            MDC.remove(WORKFLOW_ID_KEY);
        }
    }

    /** Same as {@link #withMdc(String, Runnable)}, reading the id from a signal's context. */
    public static void withMdc(ContextView ctx, Runnable logAction) {
        withMdc(getWorkflowId(ctx), logAction);
    }
}
