package io.mydata.core.model;

import java.util.Objects;

/**
 * Outcome of one validity check: the verdict plus the errors that produced it. Recomputed on every
 * call, never cached on the instance.
 *
 * @param valid  {@code true} when the instance and every nested resource passed
 * @param errors failures keyed by attribute, empty when valid
 */
public record ValidationResult(boolean valid, ValidationErrors errors) {

    public ValidationResult {
        Objects.requireNonNull(errors, "errors must not be null");
    }

    /** Builds a result whose verdict follows from the error set. */
    public static ValidationResult of(ValidationErrors errors) {
        return new ValidationResult(errors.isEmpty(), errors);
    }
}
