package io.easyrepo.spi;

import java.util.List;

/**
 * Raised by {@link PersistenceContext#saveChanges()} when staged entities fail validation.
 * Nothing is written to the store when this is thrown.
 */
public class EntityValidationException extends RuntimeException {
    private final List<EntityValidationResult> results;

    public EntityValidationException(List<EntityValidationResult> results) {
        super("Validation failed for " + results.size() + " entit" + (results.size() == 1 ? "y" : "ies"));
        this.results = List.copyOf(results);
    }

    public List<EntityValidationResult> results() {
        return results;
    }
}
