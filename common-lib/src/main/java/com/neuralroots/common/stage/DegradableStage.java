package com.neuralroots.common.stage;

import com.neuralroots.common.model.StageResult;

/**
 * A fan-out stage that never fails the workflow.
 *
 * <p>{@link #evaluate(Object)} absorbs data-store failures itself. {@link #fallback} is what the
 * orchestrator substitutes when the stage misses the request deadline or throws unexpectedly;
 * it must not touch the data store and must return a result whose status is DEGRADED.
 */
public interface DegradableStage<R extends StageResult> extends Stage<StageInput, R> {

    R fallback(StageInput input, String reason);
}
