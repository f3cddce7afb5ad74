package io.easyrepo.jdbc.mapping;

import java.util.Optional;

/**
 * Field check applied to staged entities before they are written.
 *
 * @see EntityMapping.Builder#column
 */
public sealed interface Constraint permits Constraint.Required, Constraint.MaxLength {

    /**
     * Rejects {@code null} and empty strings.
     */
    static Constraint required() {
        return Required.INSTANCE;
    }

    /**
     * Rejects character values longer than {@code max}.
     */
    static Constraint maxLength(int max) {
        return new MaxLength(max);
    }

    /**
     * Checks a value.
     *
     * @return a message describing the violation, or empty if the value is acceptable
     */
    Optional<String> check(Object value);

    record Required() implements Constraint {
        static final Required INSTANCE = new Required();

        @Override
        public Optional<String> check(Object value) {
            if (value == null || (value instanceof CharSequence s && s.length() == 0)) {
                return Optional.of("is required");
            }
            return Optional.empty();
        }
    }

    record MaxLength(int max) implements Constraint {
        public MaxLength {
            if (max <= 0) {
                throw new IllegalArgumentException("max must be > 0");
            }
        }

        @Override
        public Optional<String> check(Object value) {
            if (value instanceof CharSequence s && s.length() > max) {
                return Optional.of("must be at most " + max + " characters");
            }
            return Optional.empty();
        }
    }
}
