package io.easyrepo.jdbc.dialect;

import io.easyrepo.jdbc.mapping.EntityMapping;

import java.util.List;

/**
 * MySQL dialect, also used for MariaDB and TiDB.
 *
 * <p>The driver reports an {@code AUTO_INCREMENT} key in a single column labelled
 * {@code GENERATED_KEY}, so the default positional read applies.
 */
public final class MySqlDialect extends AbstractDialect {

    @Override
    public String name() {
        return "mysql";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:mysql:", "jdbc:mariadb:", "jdbc:tidb:");
    }

    @Override
    public String deleteSql(EntityMapping<?> mapping) {
        return "DELETE FROM " + mapping.table() + " WHERE " + mapping.idColumn().name() + "=? LIMIT 1";
    }
}
