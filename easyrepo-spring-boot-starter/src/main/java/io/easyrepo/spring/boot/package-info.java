/**
 * Spring Boot auto-configuration for easyrepo.
 *
 * <p>{@link io.easyrepo.spring.boot.EasyRepoAutoConfiguration} wires a
 * {@link io.easyrepo.jdbc.JdbcUnitOfWorkFactory} from the application's
 * {@link javax.sql.DataSource}, its {@link io.easyrepo.jdbc.mapping.EntityMapping} beans
 * and {@code easyrepo.*} application properties.
 *
 * @see io.easyrepo.spring.boot.EasyRepoAutoConfiguration
 * @see io.easyrepo.spring.boot.EasyRepoMicrometerAutoConfiguration
 * @see io.easyrepo.spring.boot.EasyRepoProperties
 */
package io.easyrepo.spring.boot;
