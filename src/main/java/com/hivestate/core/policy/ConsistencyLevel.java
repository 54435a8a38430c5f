package com.hivestate.core.policy;

public enum ConsistencyLevel {
    STRONG,
    EVENTUAL,
    SESSION
}
