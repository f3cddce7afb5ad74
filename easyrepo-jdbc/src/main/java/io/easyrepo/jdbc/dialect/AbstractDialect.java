package io.easyrepo.jdbc.dialect;

import io.easyrepo.jdbc.mapping.Column;
import io.easyrepo.jdbc.mapping.EntityMapping;
import io.easyrepo.jdbc.spi.Dialect;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Base dialect with standard SQL implementations.
 *
 * <p>Subclasses can override methods to provide database-specific SQL.
 */
public abstract class AbstractDialect implements Dialect {

    @Override
    public String selectAllSql(EntityMapping<?> mapping) {
        return selectClause(mapping) + " ORDER BY " + mapping.idColumn().name();
    }

    @Override
    public String selectByIdSql(EntityMapping<?> mapping) {
        return selectClause(mapping) + " WHERE " + mapping.idColumn().name() + "=?";
    }

    @Override
    public String selectWhereInSql(EntityMapping<?> mapping, String column, int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("count must be > 0");
        }
        return selectClause(mapping) + " WHERE " + column + " IN (" +
                String.join(",", Collections.nCopies(count, "?")) + ")" +
                " ORDER BY " + mapping.idColumn().name();
    }

    @Override
    public String insertSql(EntityMapping<?> mapping) {
        List<? extends Column<?>> columns = insertedColumns(mapping);
        String names = columns.stream().map(Column::name).collect(Collectors.joining(", "));
        return "INSERT INTO " + mapping.table() + " (" + names + ") VALUES (" +
                String.join(",", Collections.nCopies(columns.size(), "?")) + ")";
    }

    @Override
    public String updateSql(EntityMapping<?> mapping) {
        String assignments = mapping.columns().stream()
                .map(c -> c.name() + "=?")
                .collect(Collectors.joining(", "));
        return "UPDATE " + mapping.table() + " SET " + assignments +
                " WHERE " + mapping.idColumn().name() + "=?";
    }

    @Override
    public String deleteSql(EntityMapping<?> mapping) {
        return "DELETE FROM " + mapping.table() + " WHERE " + mapping.idColumn().name() + "=?";
    }

    /** Reads the first column; drivers that return only the key columns need nothing more. */
    @Override
    public Object generatedKey(ResultSet keys, EntityMapping<?> mapping) throws SQLException {
        return keys.getObject(1, mapping.idColumn().javaType());
    }

    /** Columns written by an insert: every column, minus a generated id. */
    protected static <T> List<Column<T>> insertedColumns(EntityMapping<T> mapping) {
        return mapping.isIdGenerated() ? mapping.columns() : mapping.allColumns();
    }

    protected String selectClause(EntityMapping<?> mapping) {
        String names = mapping.allColumns().stream().map(Column::name).collect(Collectors.joining(", "));
        return "SELECT " + names + " FROM " + mapping.table();
    }
}
