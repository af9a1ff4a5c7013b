package com.neuralroots.analysis.validation;

import com.neuralroots.analysis.catalog.CropCatalog;
import com.neuralroots.common.exception.ValidationException;
import com.neuralroots.common.exception.ValidationException.FieldError;
import com.neuralroots.common.model.ShipmentRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Checks a {@link ShipmentRequest} before any stage runs.
 *
 * <h3>Rules</h3>
 * <pre>
 *   cropName     required, 2–50 chars of letters, spaces, '-' or '_'
 *   temperature  required, finite, −10..60 °C
 *   humidity     required, finite, 0..100 %
 *   ageHours     optional, finite, >= 0
 *   quantity     optional, finite, > 0
 *   distanceKm   optional, finite, (0, 5000]
 *   origin, destination, targetMarket  at most 100 chars
 * </pre>
 * Unknown crops and very long hauls produce warnings, not errors.
 */
public final class ShipmentRequestValidator {

    private static final Pattern CROP_NAME = Pattern.compile("^[A-Za-z_\\- ]{2,50}$");

    private static final double MIN_TEMP         = -10.0;
    private static final double MAX_TEMP         = 60.0;
    private static final double MAX_DISTANCE_KM  = 5000.0;
    private static final double WARN_DISTANCE_KM = 2000.0;
    private static final int    MAX_TEXT_LENGTH  = 100;

    private ShipmentRequestValidator() {}

    public static ValidationReport validate(ShipmentRequest request) {
        List<FieldError> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (request == null) {
            errors.add(new FieldError("request", "request body is required"));
            return new ValidationReport(false, errors, warnings);
        }

        String cropName = request.cropName() != null ? request.cropName().trim() : "";
        if (cropName.isEmpty()) {
            errors.add(new FieldError("cropName", "cropName is required"));
        } else if (!CROP_NAME.matcher(cropName).matches()) {
            errors.add(new FieldError("cropName",
                "cropName must contain only letters, spaces, hyphen or underscore (2-50 chars)"));
        } else if (!CropCatalog.isKnown(cropName)) {
            warnings.add("Unknown crop '" + cropName + "'; using generic thresholds");
        }

        checkRequiredRange(errors, "temperature", request.temperature(), MIN_TEMP, MAX_TEMP, "°C");
        checkRequiredRange(errors, "humidity", request.humidity(), 0.0, 100.0, "%");

        if (request.ageHours() != null) {
            if (!Double.isFinite(request.ageHours())) {
                errors.add(new FieldError("ageHours", "ageHours must be a finite number"));
            } else if (request.ageHours() < 0) {
                errors.add(new FieldError("ageHours", "ageHours cannot be negative"));
            }
        }

        if (request.quantity() != null) {
            if (!Double.isFinite(request.quantity())) {
                errors.add(new FieldError("quantity", "quantity must be a finite number"));
            } else if (request.quantity() <= 0) {
                errors.add(new FieldError("quantity", "quantity must be > 0"));
            }
        }

        if (request.distanceKm() != null) {
            double d = request.distanceKm();
            if (!Double.isFinite(d)) {
                errors.add(new FieldError("distanceKm", "distanceKm must be a finite number"));
            } else if (d <= 0 || d > MAX_DISTANCE_KM) {
                errors.add(new FieldError("distanceKm", "distanceKm must be > 0 and <= " + (int) MAX_DISTANCE_KM));
            } else if (d > WARN_DISTANCE_KM) {
                warnings.add("distanceKm very high; ensure route feasibility");
            }
        }

        checkLength(errors, "origin", request.origin());
        checkLength(errors, "destination", request.destination());
        checkLength(errors, "targetMarket", request.targetMarket());

        return new ValidationReport(errors.isEmpty(), errors, warnings);
    }

    /**
     * @throws ValidationException listing every offending field
     */
    public static void requireValid(ShipmentRequest request) {
        ValidationReport report = validate(request);
        if (!report.valid()) {
            throw new ValidationException(report.errors());
        }
    }

    private static void checkRequiredRange(List<FieldError> errors, String field, Double value,
                                           double min, double max, String unit) {
        if (value == null) {
            errors.add(new FieldError(field, field + " is required"));
        } else if (!Double.isFinite(value)) {
            errors.add(new FieldError(field, field + " must be a finite number"));
        } else if (value < min || value > max) {
            errors.add(new FieldError(field,
                String.format(Locale.ROOT, "%s must be between %.0f and %.0f %s", field, min, max, unit)));
        }
    }

    private static void checkLength(List<FieldError> errors, String field, String value) {
        if (value != null && value.length() > MAX_TEXT_LENGTH) {
            errors.add(new FieldError(field, field + " too long (max " + MAX_TEXT_LENGTH + " chars)"));
        }
    }
}
