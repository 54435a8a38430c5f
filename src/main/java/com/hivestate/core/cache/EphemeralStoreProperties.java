package com.hivestate.core.cache;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * TTLs and stream limits for the ephemeral store. Defaults match the key conventions
 * other services expect; override under {@code hivestate.cache}.
 */
@Component
@ConfigurationProperties(prefix = "hivestate.cache")
public class EphemeralStoreProperties {

    private boolean enabled = true;
    private Duration defaultTtl = Duration.ofSeconds(3600);
    private Duration taskTtl = Duration.ofSeconds(1800);
    private Duration coordinationTtl = Duration.ofSeconds(300);
    private Duration sessionTtl = Duration.ofSeconds(3600);
    private Duration metricTtl = Duration.ofHours(24);
    private long streamMaxLength = 10_000;
    private Duration blockTimeout = Duration.ofMillis(1000);

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public void setDefaultTtl(Duration defaultTtl) {
        this.defaultTtl = defaultTtl;
    }

    public Duration getTaskTtl() {
        return taskTtl;
    }

    public void setTaskTtl(Duration taskTtl) {
        this.taskTtl = taskTtl;
    }

    public Duration getCoordinationTtl() {
        return coordinationTtl;
    }

    public void setCoordinationTtl(Duration coordinationTtl) {
        this.coordinationTtl = coordinationTtl;
    }

    public Duration getSessionTtl() {
        return sessionTtl;
    }

    public void setSessionTtl(Duration sessionTtl) {
        this.sessionTtl = sessionTtl;
    }

    public Duration getMetricTtl() {
        return metricTtl;
    }

    public void setMetricTtl(Duration metricTtl) {
        this.metricTtl = metricTtl;
    }

    public long getStreamMaxLength() {
        return streamMaxLength;
    }

    public void setStreamMaxLength(long streamMaxLength) {
        this.streamMaxLength = streamMaxLength;
    }

    public Duration getBlockTimeout() {
        return blockTimeout;
    }

    public void setBlockTimeout(Duration blockTimeout) {
        this.blockTimeout = blockTimeout;
    }
}
