package com.neuralroots.common.exception;

import java.util.List;

/**
 * Malformed, non-finite or out-of-range input. Raised before any stage runs.
 */
public class ValidationException extends AssessmentException {
    private final List<FieldError> errors;

    public ValidationException(List<FieldError> errors) {
        super("validation", describe(errors));
        this.errors = List.copyOf(errors);
    }

    public ValidationException(String field, String message) {
        this(List.of(new FieldError(field, message)));
    }

    public List<FieldError> getErrors() {
        return errors;
    }

    /** First offending field. */
    public String getField() {
        return errors.isEmpty() ? null : errors.get(0).field();
    }

    private static String describe(List<FieldError> errors) {
        StringBuilder sb = new StringBuilder("Invalid request");
        for (FieldError e : errors) {
            sb.append("; ").append(e.field()).append(": ").append(e.message());
        }
        return sb.toString();
    }

    public record FieldError(String field, String message) {}
}
