package com.neuralroots.common.model;

/**
 * Common view over the results of the three degradable stages.
 */
public interface StageResult {

    StageStatus status();

    /** Why the stage fell back, or {@code null} when {@link #status()} is OK. */
    String degradedReason();

    default boolean degraded() {
        return status() == StageStatus.DEGRADED;
    }
}
