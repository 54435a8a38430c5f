package com.hivestate.core.model;

/**
 * One row of a batch agent update. Null status or context usage keeps the stored value.
 */
public record AgentUpdate(String agentId, AgentStatus status, Double contextUsage) {}
