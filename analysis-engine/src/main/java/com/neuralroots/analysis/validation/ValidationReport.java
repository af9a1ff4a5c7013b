package com.neuralroots.analysis.validation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.neuralroots.common.exception.ValidationException.FieldError;

import java.util.List;

public record ValidationReport(
    @JsonProperty("valid")    boolean valid,
    @JsonProperty("errors")   List<FieldError> errors,
    @JsonProperty("warnings") List<String> warnings
) {
    public ValidationReport {
        errors   = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }
}
