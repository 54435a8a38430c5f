package com.hivestate.core.persistence;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "hivestate.persistence")
public class PersistenceProperties {

    private int queryTimeoutSeconds = 10;
    private Duration activeWindow = Duration.ofHours(1);
    private boolean initializeSchema = true;

    public int getQueryTimeoutSeconds() {
        return queryTimeoutSeconds;
    }

    public void setQueryTimeoutSeconds(int queryTimeoutSeconds) {
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    public Duration getActiveWindow() {
        return activeWindow;
    }

    public void setActiveWindow(Duration activeWindow) {
        this.activeWindow = activeWindow;
    }

    public boolean isInitializeSchema() {
        return initializeSchema;
    }

    public void setInitializeSchema(boolean initializeSchema) {
        this.initializeSchema = initializeSchema;
    }
}
