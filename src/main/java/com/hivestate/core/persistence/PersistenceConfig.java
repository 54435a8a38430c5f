package com.hivestate.core.persistence;

import com.hivestate.core.store.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Provides the {@link PersistentStore} over the application's pooled {@link DataSource}.
 * The schema is created by {@code StateLayerInitializer} once the context has started, so the
 * context can start while the database is still unreachable.
 */
@Configuration
public class PersistenceConfig {

    private static final Logger log = LoggerFactory.getLogger(PersistenceConfig.class);

    @Bean
    public PersistentStore persistentStore(DataSource dataSource, JsonCodec jsonCodec, Clock clock,
                                           PersistenceProperties properties) {
        log.info("Configuring JDBC persistent store (query timeout {}s)", properties.getQueryTimeoutSeconds());
        return new JdbcPersistentStore(dataSource, jsonCodec, clock, properties);
    }
}
