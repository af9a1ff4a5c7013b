package com.neuralroots.common.exception;

/**
 * The freshness stage could not score otherwise-valid input. Aborts the workflow.
 */
public class FreshnessComputationException extends AssessmentException {

    public FreshnessComputationException(String message) {
        super("FreshnessScorer", message);
    }

    public FreshnessComputationException(String message, Throwable cause) {
        super("FreshnessScorer", message, cause);
    }
}
