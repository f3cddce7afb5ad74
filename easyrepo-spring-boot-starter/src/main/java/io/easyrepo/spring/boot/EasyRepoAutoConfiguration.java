package io.easyrepo.spring.boot;

import io.easyrepo.UnitOfWork;
import io.easyrepo.jdbc.DataSourceConnectionProvider;
import io.easyrepo.jdbc.JdbcUnitOfWorkFactory;
import io.easyrepo.jdbc.dialect.Dialects;
import io.easyrepo.jdbc.mapping.EntityMapping;
import io.easyrepo.jdbc.mapping.EntityMappings;
import io.easyrepo.jdbc.spi.ConnectionProvider;
import io.easyrepo.jdbc.spi.Dialect;
import io.easyrepo.spi.UnitOfWorkMetrics;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.util.List;
import java.util.logging.Logger;

/**
 * Auto-configuration for easyrepo.
 *
 * <p>Wires a {@link JdbcUnitOfWorkFactory} from a {@link DataSource}, every
 * {@link EntityMapping} bean in the context and {@link EasyRepoProperties}.
 * Each bean backs off when the application defines its own.
 *
 * @see EasyRepoProperties
 * @see EasyRepoMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(UnitOfWork.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(EasyRepoProperties.class)
public class EasyRepoAutoConfiguration {
    private static final Logger logger = Logger.getLogger(EasyRepoAutoConfiguration.class.getName());

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
        return new DataSourceConnectionProvider(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean
    public Dialect dialect(DataSource dataSource, EasyRepoProperties props) {
        String name = props.getDialect();
        if (name != null && !name.isBlank()) {
            return Dialects.get(name);
        }
        Dialect detected = Dialects.detect(dataSource);
        logger.fine(() -> "Detected dialect " + detected.name());
        return detected;
    }

    @Bean
    @ConditionalOnMissingBean
    public EntityMappings entityMappings(ObjectProvider<EntityMapping<?>> mappingsProvider) {
        List<EntityMapping<?>> mappings = mappingsProvider.orderedStream().toList();
        logger.fine(() -> "Registering " + mappings.size() + " entity mappings");
        return EntityMappings.of(mappings);
    }

    /**
     * Declared with a wildcard because the identifier type of the mapped entities
     * is not known here; it can be injected as {@code UnitOfWorkFactory<Long>}.
     */
    @Bean
    @ConditionalOnMissingBean
    public JdbcUnitOfWorkFactory<?> unitOfWorkFactory(ConnectionProvider connectionProvider,
                                                      EntityMappings entityMappings,
                                                      Dialect dialect,
                                                      ObjectProvider<UnitOfWorkMetrics> metricsProvider) {
        var builder = JdbcUnitOfWorkFactory.builder(Object.class)
                .connectionProvider(connectionProvider)
                .mappings(entityMappings)
                .dialect(dialect);
        UnitOfWorkMetrics metrics = metricsProvider.getIfAvailable();
        if (metrics != null) {
            builder.metrics(metrics);
        }
        return builder.build();
    }
}
