package io.easyrepo.spring.boot;

import io.easyrepo.micrometer.MicrometerUnitOfWorkMetrics;
import io.easyrepo.spi.UnitOfWorkMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerUnitOfWorkMetrics} when Micrometer is on the classpath
 * and {@code easyrepo.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link EasyRepoAutoConfiguration} so the {@link UnitOfWorkMetrics}
 * bean is available to the unit-of-work factory.
 */
@AutoConfiguration(before = EasyRepoAutoConfiguration.class)
@ConditionalOnClass({MicrometerUnitOfWorkMetrics.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "easyrepo.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(EasyRepoProperties.class)
public class EasyRepoMicrometerAutoConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(UnitOfWorkMetrics.class)
    public MicrometerUnitOfWorkMetrics micrometerUnitOfWorkMetrics(
            MeterRegistry meterRegistry, EasyRepoProperties props) {
        return new MicrometerUnitOfWorkMetrics(meterRegistry, props.getMetrics().getNamePrefix());
    }
}
