package com.hivestate.migration;

import com.hivestate.core.cache.EphemeralStoreProperties;
import com.hivestate.core.metrics.StateMetrics;
import com.hivestate.core.orchestration.OrchestratorProperties;
import com.hivestate.core.persistence.PersistenceProperties;
import com.hivestate.core.store.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Runs a migration against the targets named in a {@link MigrationRequest}.
 */
@Service
public class MigrationService {

    private static final Logger log = LoggerFactory.getLogger(MigrationService.class);

    private final MigrationProperties migrationProperties;
    private final PersistenceProperties persistenceProperties;
    private final EphemeralStoreProperties cacheProperties;
    private final OrchestratorProperties orchestratorProperties;
    private final JsonCodec json;
    private final StateMetrics metrics;
    private final Clock clock;

    public MigrationService(MigrationProperties migrationProperties, PersistenceProperties persistenceProperties,
                            EphemeralStoreProperties cacheProperties, OrchestratorProperties orchestratorProperties,
                            JsonCodec json, StateMetrics metrics, Clock clock) {
        this.migrationProperties = migrationProperties;
        this.persistenceProperties = persistenceProperties;
        this.cacheProperties = cacheProperties;
        this.orchestratorProperties = orchestratorProperties;
        this.json = json;
        this.metrics = metrics;
        this.clock = clock;
    }

    public MigrationReport migrate(MigrationRequest request) {
        MigrationSettings settings = settingsFor(request);
        log.info("Migrating {} into {} (batch size {}, fail-fast {})", request.legacyDatabase(), request.target(),
                settings.batchSize(), settings.failFast());
        try (MigrationTargets targets = MigrationTargets.connect(request.target(), json, clock,
                persistenceProperties, cacheProperties, orchestratorProperties, metrics)) {
            LegacyStateMigrator migrator = new LegacyStateMigrator(settings, targets.persistent(),
                    targets.ephemeral(), targets.stateManager(), json, metrics, clock);
            return migrator.run();
        }
    }

    MigrationSettings settingsFor(MigrationRequest request) {
        MigrationSettings settings = MigrationSettings.from(migrationProperties, request.legacyDatabase(),
                request.dryRun());
        if (request.batchSize() != null) {
            settings = settings.withBatchSize(request.batchSize());
        }
        if (request.failFast() != null) {
            settings = settings.withFailFast(request.failFast());
        }
        return settings;
    }
}
