package com.hivestate.core.orchestration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "hivestate.orchestrator")
public class OrchestratorProperties {

    /** Re-cache agent state after registration and serve agent reads cache-aside. */
    private boolean cacheAgentState = true;

    /** Cache newly created tasks and serve task reads cache-aside. */
    private boolean cacheTaskData = true;

    private double cacheHitRatioTarget = 0.95;

    /** Weight of the newest sample in the latency moving average. */
    private double latencySmoothing = 0.1;

    public boolean isCacheAgentState() {
        return cacheAgentState;
    }

    public void setCacheAgentState(boolean cacheAgentState) {
        this.cacheAgentState = cacheAgentState;
    }

    public boolean isCacheTaskData() {
        return cacheTaskData;
    }

    public void setCacheTaskData(boolean cacheTaskData) {
        this.cacheTaskData = cacheTaskData;
    }

    public double getCacheHitRatioTarget() {
        return cacheHitRatioTarget;
    }

    public void setCacheHitRatioTarget(double cacheHitRatioTarget) {
        this.cacheHitRatioTarget = cacheHitRatioTarget;
    }

    public double getLatencySmoothing() {
        return latencySmoothing;
    }

    public void setLatencySmoothing(double latencySmoothing) {
        this.latencySmoothing = latencySmoothing;
    }
}
