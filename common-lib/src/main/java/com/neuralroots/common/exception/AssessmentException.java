package com.neuralroots.common.exception;

/**
 * Base of the fatal assessment failures. Carries the name of the stage that raised it.
 */
public class AssessmentException extends RuntimeException {
    private final String stageName;

    public AssessmentException(String stageName, String message) {
        super("[" + stageName + "] " + message);
        this.stageName = stageName;
    }

    public AssessmentException(String stageName, String message, Throwable cause) {
        super("[" + stageName + "] " + message, cause);
        this.stageName = stageName;
    }

    public String getStageName() {
        return stageName;
    }
}
