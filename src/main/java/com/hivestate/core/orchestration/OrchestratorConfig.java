package com.hivestate.core.orchestration;

import com.hivestate.core.cache.EphemeralStore;
import com.hivestate.core.cache.EphemeralStoreProperties;
import com.hivestate.core.metrics.StateMetrics;
import com.hivestate.core.persistence.PersistenceProperties;
import com.hivestate.core.persistence.PersistentStore;
import com.hivestate.core.policy.StateDistributionPolicy;
import com.hivestate.core.store.JsonCodec;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Composition root for the state layer: one orchestrator per application context.
 */
@Configuration
public class OrchestratorConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public JsonCodec jsonCodec() {
        return new JsonCodec();
    }

    @Bean
    public StateDistributionPolicy stateDistributionPolicy(EphemeralStoreProperties cacheProperties) {
        return StateDistributionPolicy.from(cacheProperties);
    }

    @Bean
    public StateManager stateManager(PersistentStore persistentStore, EphemeralStore ephemeralStore,
                                     StateDistributionPolicy policy, OrchestratorProperties properties,
                                     PersistenceProperties persistenceProperties, StateMetrics metrics,
                                     Clock clock) {
        return new HybridStateOrchestrator(persistentStore, ephemeralStore, policy, properties,
                persistenceProperties, metrics, clock);
    }
}
