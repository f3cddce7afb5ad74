/**
 * JDBC persistence engine for {@link io.easyrepo.UnitOfWork}.
 *
 * <p>{@link io.easyrepo.jdbc.JdbcPersistenceContext} implements the
 * {@link io.easyrepo.spi.PersistenceContext} SPI over one connection;
 * {@link io.easyrepo.jdbc.JdbcUnitOfWorkFactory} wires it to a
 * {@link io.easyrepo.DefaultUnitOfWork}. {@link io.easyrepo.jdbc.JdbcTemplate}
 * provides lightweight JDBC helpers and {@link io.easyrepo.jdbc.DataSourceConnectionProvider}
 * adapts a {@link javax.sql.DataSource} to the {@link io.easyrepo.jdbc.spi.ConnectionProvider} SPI.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code io.easyrepo.jdbc.mapping} — entity-to-table mappings</li>
 *   <li>{@code io.easyrepo.jdbc.dialect} — {@link io.easyrepo.jdbc.spi.Dialect} implementations</li>
 *   <li>{@code io.easyrepo.jdbc.spi} — connection and dialect SPIs</li>
 * </ul>
 */
package io.easyrepo.jdbc;
