package io.easyrepo.spi;

import java.util.List;
import java.util.Objects;

/**
 * Validation failures of one staged entity.
 *
 * @param entity the invalid entity
 * @param errors one entry per failed field check (never empty)
 */
public record EntityValidationResult(Object entity, List<FieldValidationError> errors) {
    public EntityValidationResult {
        Objects.requireNonNull(entity, "entity");
        errors = List.copyOf(errors);
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("errors must not be empty");
        }
    }
}
