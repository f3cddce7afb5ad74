package io.easyrepo;

import io.easyrepo.spi.EntityValidationException;
import io.easyrepo.spi.EntityValidationResult;
import io.easyrepo.spi.FieldValidationError;

import java.util.List;

/**
 * Thrown by {@link UnitOfWork#commitTransaction()} when staged entities fail validation.
 *
 * <p>The message lists every failing entity and field:
 * <pre>
 * com.example.Customer failed validation
 * - name : must not be null
 * </pre>
 * The structured form is available from {@link #results()}.
 */
public final class ValidationFailedException extends UnitOfWorkException {
    private final List<EntityValidationResult> results;

    public ValidationFailedException(EntityValidationException cause) {
        super(describe(cause.results()), cause);
        this.results = cause.results();
    }

    public List<EntityValidationResult> results() {
        return results;
    }

    static String describe(List<EntityValidationResult> results) {
        StringBuilder sb = new StringBuilder();
        for (EntityValidationResult result : results) {
            sb.append(result.entity().getClass().getName()).append(" failed validation\n");
            for (FieldValidationError error : result.errors()) {
                sb.append("- ").append(error.property()).append(" : ").append(error.message()).append('\n');
            }
        }
        return sb.toString();
    }
}
