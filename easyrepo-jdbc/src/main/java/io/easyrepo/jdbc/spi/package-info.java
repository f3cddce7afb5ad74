/**
 * Service provider interfaces of the JDBC engine.
 */
package io.easyrepo.jdbc.spi;
