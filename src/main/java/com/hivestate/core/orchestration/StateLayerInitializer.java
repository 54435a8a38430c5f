package com.hivestate.core.orchestration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationStartedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Initializes the state layer once the context has started, before any CLI command runs.
 * An unreachable database is logged and left to the commands to report.
 */
@Component
public class StateLayerInitializer {

    private static final Logger log = LoggerFactory.getLogger(StateLayerInitializer.class);

    private final StateManager stateManager;

    public StateLayerInitializer(StateManager stateManager) {
        this.stateManager = stateManager;
    }

    @EventListener(ApplicationStartedEvent.class)
    public void initializeStateLayer() {
        if (!stateManager.initialize()) {
            log.warn("State layer not initialized; commands will run against an unprepared store");
        }
    }
}
