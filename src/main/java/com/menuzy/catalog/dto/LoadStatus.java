package com.menuzy.catalog.dto;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one load call.
 *
 * <pre>
 * RECEIVED → VALIDATED → PERSISTING → COMMITTED
 *                │            └──────→ ROLLED_BACK
 *                └───────────────────→ REJECTED
 * RECEIVED / VALIDATED ──────────────→ ROLLED_BACK (timeout or store failure before persisting)
 * </pre>
 */
public enum LoadStatus {
    RECEIVED,
    VALIDATED,
    PERSISTING,
    COMMITTED,
    REJECTED,
    ROLLED_BACK;

    public boolean isTerminal() {
        return this == COMMITTED || this == REJECTED || this == ROLLED_BACK;
    }

    public boolean canTransitionTo(LoadStatus next) {
        return allowedNext().contains(next);
    }

    /**
     * @throws IllegalStateException when {@code next} is not reachable from this status
     */
    public LoadStatus transitionTo(LoadStatus next) {
        if (!canTransitionTo(next)) {
            throw new IllegalStateException("Illegal load transition " + this + " -> " + next);
        }
        return next;
    }

    private Set<LoadStatus> allowedNext() {
        return switch (this) {
            case RECEIVED -> EnumSet.of(VALIDATED, ROLLED_BACK);
            case VALIDATED -> EnumSet.of(PERSISTING, REJECTED, ROLLED_BACK);
            case PERSISTING -> EnumSet.of(COMMITTED, ROLLED_BACK);
            case COMMITTED, REJECTED, ROLLED_BACK -> EnumSet.noneOf(LoadStatus.class);
        };
    }
}
