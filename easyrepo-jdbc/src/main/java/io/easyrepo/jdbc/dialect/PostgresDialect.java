package io.easyrepo.jdbc.dialect;

import io.easyrepo.jdbc.mapping.EntityMapping;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

/**
 * PostgreSQL dialect.
 *
 * <p>The driver implements generated keys with {@code RETURNING *}, so the key
 * is read by column name rather than position.
 */
public final class PostgresDialect extends AbstractDialect {

    @Override
    public String name() {
        return "postgresql";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:postgresql:");
    }

    @Override
    public Object generatedKey(ResultSet keys, EntityMapping<?> mapping) throws SQLException {
        return keys.getObject(mapping.idColumn().name(), mapping.idColumn().javaType());
    }
}
