package com.ai.tutoring.model;

import com.ai.tutoring.exception.ErrorCode;
import com.ai.tutoring.exception.SessionStateException;

/**
 * Negotiation state of a scheduled session's cancellation.
 *
 * <p>Transitions are pure: every method returns the next state or throws
 * {@link SessionStateException} without side effects. Whether the session is
 * still {@link SessionStatus#SCHEDULED} is checked by the caller.</p>
 *
 * <ul>
 * <li>{@code NONE + request(p)} → {@code REQUESTED_BY_p}</li>
 * <li>{@code REQUESTED_BY_p + request(p)} → AlreadyRequested</li>
 * <li>{@code REQUESTED_BY_p + request(other)} → {@code MUTUALLY_CANCELLED}</li>
 * <li>{@code REQUESTED_BY_p + respond(other, ACCEPT)} → {@code MUTUALLY_CANCELLED}</li>
 * <li>{@code REQUESTED_BY_p + respond(other, REJECT)} → {@code NONE}</li>
 * </ul>
 */
public enum CancellationState {

    NONE,
    REQUESTED_BY_TUTOR,
    REQUESTED_BY_STUDENT,
    MUTUALLY_CANCELLED;

    public static CancellationState requestedBy(Party party) {
        return party == Party.TUTOR ? REQUESTED_BY_TUTOR : REQUESTED_BY_STUDENT;
    }

    /** True while {@code party} has an open request. */
    public boolean isRequestedBy(Party party) {
        return this == requestedBy(party);
    }

    public CancellationState request(Party actor) {
        if (this == MUTUALLY_CANCELLED) {
            throw new SessionStateException(ErrorCode.NOT_SCHEDULED,
                    "Session is already cancelled");
        }
        if (isRequestedBy(actor)) {
            throw new SessionStateException(ErrorCode.ALREADY_REQUESTED,
                    "Cancellation already requested by " + actor.name().toLowerCase());
        }
        // Counterparty asked first: two requests are an agreement.
        if (isRequestedBy(actor.counterpart())) {
            return MUTUALLY_CANCELLED;
        }
        return requestedBy(actor);
    }

    public CancellationState respond(Party actor, CancellationDecision decision) {
        if (this == MUTUALLY_CANCELLED) {
            throw new SessionStateException(ErrorCode.NOT_SCHEDULED,
                    "Session is already cancelled");
        }
        if (isRequestedBy(actor)) {
            throw new SessionStateException(ErrorCode.SELF_REQUEST_CONFLICT,
                    "A party cannot respond to its own cancellation request");
        }
        if (!isRequestedBy(actor.counterpart())) {
            throw new SessionStateException(ErrorCode.NO_PENDING_REQUEST,
                    "No pending cancellation request from the "
                            + actor.counterpart().name().toLowerCase());
        }
        return decision == CancellationDecision.ACCEPT ? MUTUALLY_CANCELLED : NONE;
    }
}
