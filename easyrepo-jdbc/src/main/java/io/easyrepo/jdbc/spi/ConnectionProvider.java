package io.easyrepo.jdbc.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections to persistence contexts.
 *
 * <p>Each {@link io.easyrepo.jdbc.JdbcPersistenceContext} obtains one connection
 * and closes it when the context is closed.
 *
 * @see io.easyrepo.jdbc.DataSourceConnectionProvider
 */
@FunctionalInterface
public interface ConnectionProvider {

    /**
     * Obtains a new JDBC connection.
     *
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}
