package io.easyrepo.jdbc.dialect;

import io.easyrepo.jdbc.spi.ConnectionProvider;
import io.easyrepo.jdbc.spi.Dialect;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

/**
 * Lookup of the {@link Dialect}s registered under
 * {@code META-INF/services/io.easyrepo.jdbc.spi.Dialect}, by name or by the JDBC URL
 * of the database a unit of work will talk to.
 */
public final class Dialects {
    private static final List<Dialect> REGISTERED = ServiceLoader.load(Dialect.class, Dialects.class.getClassLoader())
            .stream()
            .map(ServiceLoader.Provider::get)
            .toList();
    private static final Map<String, Dialect> BY_NAME = REGISTERED.stream()
            .collect(Collectors.toUnmodifiableMap(d -> d.name().toLowerCase(Locale.ROOT), d -> d, (a, b) -> a));

    private Dialects() {
    }

    /**
     * Returns every registered dialect, in service-loader order.
     */
    public static List<Dialect> all() {
        return REGISTERED;
    }

    /**
     * Looks a dialect up by its case-insensitive name, as used by the
     * {@code easyrepo.dialect} property.
     *
     * @throws IllegalArgumentException if no dialect has that name
     */
    public static Dialect get(String name) {
        Dialect dialect = BY_NAME.get(name.toLowerCase(Locale.ROOT));
        if (dialect == null) {
            throw new IllegalArgumentException("Unknown dialect: " + name + ". Available: " + BY_NAME.keySet());
        }
        return dialect;
    }

    /**
     * Detects the dialect of the database behind a {@link DataSource}.
     *
     * @throws IllegalStateException    if the connection metadata cannot be read
     * @throws IllegalArgumentException if no dialect matches
     */
    public static Dialect detect(DataSource dataSource) {
        ConnectionProvider provider = dataSource::getConnection;
        return detect(provider);
    }

    /**
     * Detects the dialect from the URL of one short-lived connection.
     *
     * @throws IllegalStateException    if the connection metadata cannot be read
     * @throws IllegalArgumentException if no dialect matches
     */
    public static Dialect detect(ConnectionProvider connectionProvider) {
        String url;
        try (Connection conn = connectionProvider.getConnection()) {
            url = conn.getMetaData().getURL();
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to detect dialect from connection", e);
        }
        return detect(url);
    }

    /**
     * Picks the first dialect claiming a prefix of the JDBC URL.
     *
     * @throws IllegalArgumentException if the URL is blank or unclaimed
     */
    public static Dialect detect(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isEmpty()) {
            throw new IllegalArgumentException("JDBC URL cannot be null or empty");
        }
        return REGISTERED.stream()
                .filter(d -> d.jdbcUrlPrefixes().stream().anyMatch(jdbcUrl::startsWith))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No dialect found for JDBC URL: " + jdbcUrl +
                        ". Supported prefixes: " + REGISTERED.stream()
                        .flatMap(d -> d.jdbcUrlPrefixes().stream())
                        .toList()));
    }
}
