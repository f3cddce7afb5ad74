/**
 * Built-in {@link io.easyrepo.jdbc.spi.Dialect} implementations and the
 * {@link io.easyrepo.jdbc.dialect.Dialects} registry.
 */
package io.easyrepo.jdbc.dialect;
