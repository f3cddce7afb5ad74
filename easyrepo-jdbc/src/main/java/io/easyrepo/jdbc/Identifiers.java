package io.easyrepo.jdbc;

import java.util.Objects;

/**
 * Validation of table and column names that are concatenated into SQL.
 */
public final class Identifiers {
    private static final String IDENTIFIER_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

    private Identifiers() {}

    public static String validate(String identifier) {
        Objects.requireNonNull(identifier, "identifier");
        if (!identifier.matches(IDENTIFIER_PATTERN)) {
            throw new IllegalArgumentException("Invalid SQL identifier: " + identifier);
        }
        return identifier;
    }
}
