package com.relaytide.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one IngestionRecord.
 *
 *   RECEIVED ──→ PROCESSING ──→ COMPLETED
 *      │                    └──→ FAILED
 *      └──→ DUPLICATE
 *
 * COMPLETED, FAILED and DUPLICATE are terminal. PROCESSING is not: a record
 * left there past the staleness threshold may be revisited by a supervisor.
 */
public enum IngestionState {
    RECEIVED,
    PROCESSING,
    COMPLETED,
    FAILED,
    DUPLICATE;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == DUPLICATE;
    }

    public static Set<IngestionState> terminalStates() {
        Set<IngestionState> terminal = EnumSet.noneOf(IngestionState.class);
        for (IngestionState state : values()) {
            if (state.isTerminal()) {
                terminal.add(state);
            }
        }
        return terminal;
    }

    public boolean canTransitionTo(IngestionState target) {
        return switch (this) {
            case RECEIVED -> target == PROCESSING || target == DUPLICATE;
            case PROCESSING -> target == COMPLETED || target == FAILED;
            case COMPLETED, FAILED, DUPLICATE -> false;
        };
    }
}
