package io.easyrepo;

import io.easyrepo.spi.EntityValidationResult;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link UnitOfWork#tryCommit()}.
 *
 * <ul>
 *   <li>{@link Committed} — every staged change was written and the transaction committed.</li>
 *   <li>{@link ValidationFailed} — staged entities were invalid; the transaction was rolled back.</li>
 *   <li>{@link Failed} — the store rejected the flush or commit; the transaction was rolled back.</li>
 * </ul>
 *
 * @see UnitOfWork#tryCommit()
 */
public sealed interface CommitResult permits CommitResult.Committed, CommitResult.ValidationFailed, CommitResult.Failed {

    /**
     * Singleton indicating a successful commit.
     */
    Committed COMMITTED = new Committed();

    /**
     * Returns {@code true} for {@link Committed}.
     */
    default boolean isCommitted() {
        return this instanceof Committed;
    }

    /**
     * Transaction committed.
     */
    record Committed() implements CommitResult {
    }

    /**
     * Staged entities failed validation.
     *
     * @param results per-entity failures
     * @param message aggregated summary, identical to {@link ValidationFailedException#getMessage()}
     */
    record ValidationFailed(List<EntityValidationResult> results, String message) implements CommitResult {
        public ValidationFailed {
            results = List.copyOf(results);
            Objects.requireNonNull(message, "message");
        }
    }

    /**
     * The store failed while flushing or committing.
     *
     * @param error the failure, with the engine error as its cause
     */
    record Failed(PersistenceException error) implements CommitResult {
        public Failed {
            Objects.requireNonNull(error, "error");
        }
    }
}
