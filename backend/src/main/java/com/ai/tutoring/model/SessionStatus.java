package com.ai.tutoring.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of a tutoring session.
 *
 * <pre>
 * PENDING ──► SCHEDULED ──► IN_PROGRESS ──► COMPLETED
 *                 │               │
 *                 └──► CANCELLED ◄┘
 * </pre>
 *
 * COMPLETED and CANCELLED are terminal.
 */
public enum SessionStatus {

    PENDING,
    SCHEDULED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED;

    /** Statuses this one may move to. */
    public Set<SessionStatus> allowedNext() {
        return switch (this) {
            case PENDING -> EnumSet.of(SCHEDULED);
            case SCHEDULED -> EnumSet.of(IN_PROGRESS, CANCELLED);
            case IN_PROGRESS -> EnumSet.of(COMPLETED, CANCELLED);
            case COMPLETED, CANCELLED -> EnumSet.noneOf(SessionStatus.class);
        };
    }

    public boolean canTransitionTo(SessionStatus next) {
        return next != null && allowedNext().contains(next);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
