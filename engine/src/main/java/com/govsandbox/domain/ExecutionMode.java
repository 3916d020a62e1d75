package com.govsandbox.domain;

import java.util.Optional;

/**
 * Process-wide execution mode. Transitions only move one tier up: SHADOW → PILOT → PRODUCTION.
 */
public enum ExecutionMode {
    /** No real mutation; every transaction terminates as SIMULATED or REJECTED. */
    SHADOW,
    /** Bounded real mutation subject to external approval. */
    PILOT,
    /** Full real mutation; large transfers still routed to approval. */
    PRODUCTION;

    public Optional<ExecutionMode> next() {
        return switch (this) {
            case SHADOW -> Optional.of(PILOT);
            case PILOT -> Optional.of(PRODUCTION);
            case PRODUCTION -> Optional.empty();
        };
    }

    public boolean allowsRealMutation() {
        return this != SHADOW;
    }
}
