package io.easyrepo.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for easyrepo.
 *
 * @see EasyRepoAutoConfiguration
 */
@ConfigurationProperties(prefix = "easyrepo")
public class EasyRepoProperties {

    /**
     * Dialect name ({@code h2}, {@code mysql}, {@code postgresql}). Detected from
     * the DataSource when unset.
     */
    private String dialect;

    private final Metrics metrics = new Metrics();

    public String getDialect() {
        return dialect;
    }

    public void setDialect(String dialect) {
        this.dialect = dialect;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Metrics {
        /**
         * Whether to register Micrometer counters.
         */
        private boolean enabled = true;

        /**
         * Prefix for all meter names.
         */
        private String namePrefix = "easyrepo";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
