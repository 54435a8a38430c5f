package com.hivestate.migration;

import com.hivestate.core.cache.EphemeralStore;
import com.hivestate.core.cache.EphemeralStoreProperties;
import com.hivestate.core.cache.RedisEphemeralStore;
import com.hivestate.core.metrics.StateMetrics;
import com.hivestate.core.orchestration.HybridStateOrchestrator;
import com.hivestate.core.orchestration.OrchestratorProperties;
import com.hivestate.core.orchestration.StateManager;
import com.hivestate.core.persistence.JdbcPersistentStore;
import com.hivestate.core.persistence.PersistenceProperties;
import com.hivestate.core.persistence.PersistentStore;
import com.hivestate.core.policy.StateDistributionPolicy;
import com.hivestate.core.store.JsonCodec;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.lettuce.core.api.StatefulConnection;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettucePoolingClientConfiguration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Store managers and orchestrator wired against explicitly given targets, independent of
 * the application's own DataSource and Redis connection. Closing releases both pools.
 */
public class MigrationTargets implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MigrationTargets.class);

    private static final int PG_MIN_IDLE = 5;
    private static final int PG_MAX_POOL = 20;
    private static final Duration PG_CONNECTION_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration REDIS_COMMAND_TIMEOUT = Duration.ofSeconds(5);
    private static final int REDIS_MAX_ACTIVE = 20;

    private final HikariDataSource dataSource;
    private final LettuceConnectionFactory connectionFactory;
    private final PersistentStore persistent;
    private final EphemeralStore ephemeral;
    private final StateManager stateManager;

    private MigrationTargets(HikariDataSource dataSource, LettuceConnectionFactory connectionFactory,
                             PersistentStore persistent, EphemeralStore ephemeral, StateManager stateManager) {
        this.dataSource = dataSource;
        this.connectionFactory = connectionFactory;
        this.persistent = persistent;
        this.ephemeral = ephemeral;
        this.stateManager = stateManager;
    }

    public static MigrationTargets connect(TargetConnection target, JsonCodec json, Clock clock,
                                           PersistenceProperties persistenceProperties,
                                           EphemeralStoreProperties cacheProperties,
                                           OrchestratorProperties orchestratorProperties,
                                           StateMetrics metrics) {
        HikariConfig config = new HikariConfig();
        config.setPoolName("hivestate-migration");
        config.setJdbcUrl(target.jdbcUrl());
        config.setUsername(target.pgUser());
        config.setPassword(target.pgPassword());
        config.setMinimumIdle(PG_MIN_IDLE);
        config.setMaximumPoolSize(PG_MAX_POOL);
        config.setConnectionTimeout(PG_CONNECTION_TIMEOUT.toMillis());
        // Unreachable targets surface in the infrastructure phase, not here.
        config.setInitializationFailTimeout(-1);
        HikariDataSource dataSource = new HikariDataSource(config);

        GenericObjectPoolConfig<StatefulConnection<?, ?>> poolConfig = new GenericObjectPoolConfig<>();
        poolConfig.setMaxTotal(REDIS_MAX_ACTIVE);
        LettucePoolingClientConfiguration clientConfig = LettucePoolingClientConfiguration.builder()
                .commandTimeout(REDIS_COMMAND_TIMEOUT)
                .poolConfig(poolConfig)
                .build();
        LettuceConnectionFactory connectionFactory = new LettuceConnectionFactory(
                new RedisStandaloneConfiguration(target.redisHost(), target.redisPort()), clientConfig);
        connectionFactory.afterPropertiesSet();
        StringRedisTemplate template = new StringRedisTemplate(connectionFactory);

        PersistentStore persistent = new JdbcPersistentStore(dataSource, json, clock, persistenceProperties);
        EphemeralStore ephemeral = new RedisEphemeralStore(template, json, clock, cacheProperties);
        StateManager stateManager = new HybridStateOrchestrator(persistent, ephemeral,
                StateDistributionPolicy.from(cacheProperties), orchestratorProperties, persistenceProperties,
                metrics, clock);
        log.info("Migration targets configured: {}", target);
        return new MigrationTargets(dataSource, connectionFactory, persistent, ephemeral, stateManager);
    }

    public PersistentStore persistent() {
        return persistent;
    }

    public EphemeralStore ephemeral() {
        return ephemeral;
    }

    public StateManager stateManager() {
        return stateManager;
    }

    @Override
    public void close() {
        connectionFactory.destroy();
        dataSource.close();
        log.debug("Migration target pools closed");
    }
}
