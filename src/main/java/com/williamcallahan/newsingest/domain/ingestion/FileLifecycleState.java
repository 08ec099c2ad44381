package com.williamcallahan.newsingest.domain.ingestion;

import java.util.EnumSet;
import java.util.Set;

/**
 * Per-file state machine for a normalization run.
 *
 * <pre>
 * DISCOVERED -> DATE_RESOLVED | DATE_UNRESOLVED
 * DATE_RESOLVED -> CONVERTED | CONVERSION_FAILED
 * DATE_UNRESOLVED -> REJECTED
 * CONVERTED -> ACCEPTED | REJECTED
 * CONVERSION_FAILED -> REJECTED
 * </pre>
 *
 * <p>Any non-terminal state may also move to {@link #REJECTED} when an unexpected error occurs.</p>
 */
public enum FileLifecycleState {
    DISCOVERED,
    DATE_RESOLVED,
    DATE_UNRESOLVED,
    CONVERTED,
    CONVERSION_FAILED,
    ACCEPTED,
    REJECTED;

    /**
     * Returns the states reachable from this one.
     */
    public Set<FileLifecycleState> successors() {
        switch (this) {
            case DISCOVERED:
                return EnumSet.of(DATE_RESOLVED, DATE_UNRESOLVED, REJECTED);
            case DATE_RESOLVED:
                return EnumSet.of(CONVERTED, CONVERSION_FAILED, REJECTED);
            case DATE_UNRESOLVED:
            case CONVERSION_FAILED:
                return EnumSet.of(REJECTED);
            case CONVERTED:
                return EnumSet.of(ACCEPTED, REJECTED);
            default:
                return EnumSet.noneOf(FileLifecycleState.class);
        }
    }

    public boolean canTransitionTo(FileLifecycleState next) {
        return successors().contains(next);
    }

    /**
     * Moves to the next state.
     *
     * @param next requested state
     * @return {@code next}
     * @throws IllegalStateException when the transition is not allowed
     */
    public FileLifecycleState transitionTo(FileLifecycleState next) {
        if (!canTransitionTo(next)) {
            throw new IllegalStateException("Illegal file state transition " + this + " -> " + next);
        }
        return next;
    }
}
