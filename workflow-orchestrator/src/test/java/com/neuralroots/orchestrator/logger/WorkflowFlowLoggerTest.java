package com.neuralroots.orchestrator.logger;

import com.neuralroots.common.trace.TraceContextUtil;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowFlowLoggerTest {

    private final WorkflowFlowLogger flowLogger = new WorkflowFlowLogger();

    @Test
    @DisplayName("stage() passes values through and leaves MDC clean")
    void passThrough() {
        Mono<String> pipeline = TraceContextUtil.withWorkflow(
            Mono.just("record").doOnEach(flowLogger.stage(WorkflowFlowLogger.SYNTHESIS_COMPLETED)),
            "wf-1-000001", System.currentTimeMillis());

        StepVerifier.create(pipeline)
            .expectNext("record")
            .verifyComplete();
        assertNull(MDC.get(TraceContextUtil.WORKFLOW_ID_KEY));
    }

    @Test
    @DisplayName("stage() ignores error signals")
    void errorSignal() {
        Mono<String> pipeline = Mono.<String>error(new IllegalStateException("boom"))
            .doOnEach(flowLogger.stage(WorkflowFlowLogger.FRESHNESS_SCORED));

        StepVerifier.create(pipeline)
            .expectError(IllegalStateException.class)
            .verify();
    }
}
