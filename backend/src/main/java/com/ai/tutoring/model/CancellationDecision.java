package com.ai.tutoring.model;

/**
 * Answer of the counterparty to a pending cancellation request.
 */
public enum CancellationDecision {
    ACCEPT,
    REJECT
}
