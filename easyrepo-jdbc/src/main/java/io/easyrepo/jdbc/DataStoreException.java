package io.easyrepo.jdbc;

/**
 * Unchecked exception for failures inside the JDBC persistence engine, usually
 * wrapping a {@link java.sql.SQLException}.
 */
public final class DataStoreException extends RuntimeException {
    public DataStoreException(String message) {
        super(message);
    }

    public DataStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
