package com.ai.tutoring.model;

/**
 * One of the two participants of a session.
 */
public enum Party {

    TUTOR,
    STUDENT;

    public Party counterpart() {
        return this == TUTOR ? STUDENT : TUTOR;
    }
}
