package io.easyrepo.jdbc.spi;

import io.easyrepo.jdbc.mapping.EntityMapping;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

/**
 * SPI for database dialect support.
 *
 * <p>Implementations provide the SQL the persistence context issues for a mapped
 * entity. Register custom dialects via
 * {@code META-INF/services/io.easyrepo.jdbc.spi.Dialect}.
 *
 * <p>Built-in dialects: H2, MySQL, PostgreSQL.
 *
 * @see io.easyrepo.jdbc.dialect.Dialects
 */
public interface Dialect {

    /**
     * Unique identifier for this dialect (e.g., "mysql", "postgresql", "h2").
     */
    String name();

    /**
     * JDBC URL prefixes this dialect handles (e.g., "jdbc:mysql:", "jdbc:mariadb:").
     */
    List<String> jdbcUrlPrefixes();

    /**
     * SQL selecting every row, ordered by id.
     */
    String selectAllSql(EntityMapping<?> mapping);

    /**
     * SQL selecting one row. Parameters: id.
     */
    String selectByIdSql(EntityMapping<?> mapping);

    /**
     * SQL selecting rows whose {@code column} is one of {@code count} values.
     * Parameters: the values.
     */
    String selectWhereInSql(EntityMapping<?> mapping, String column, int count);

    /**
     * SQL inserting one row. Parameters: id (omitted if generated), then the
     * non-id columns in declaration order.
     */
    String insertSql(EntityMapping<?> mapping);

    /**
     * SQL updating every non-id column of one row. Parameters: the non-id columns
     * in declaration order, then id.
     */
    String updateSql(EntityMapping<?> mapping);

    /**
     * SQL deleting one row. Parameters: id.
     */
    String deleteSql(EntityMapping<?> mapping);

    /**
     * Reads the database-generated id from the current row of a generated-keys result set.
     */
    Object generatedKey(ResultSet keys, EntityMapping<?> mapping) throws SQLException;
}
