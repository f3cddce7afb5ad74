package io.easyrepo.spi;

import java.util.Objects;

/**
 * A single failed field check.
 *
 * @param property name of the offending property
 * @param message  human-readable reason
 */
public record FieldValidationError(String property, String message) {
    public FieldValidationError {
        Objects.requireNonNull(property, "property");
        Objects.requireNonNull(message, "message");
    }
}
