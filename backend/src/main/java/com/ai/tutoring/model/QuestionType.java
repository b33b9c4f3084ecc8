package com.ai.tutoring.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum QuestionType {

    MULTIPLE_CHOICE("multiple_choice"),
    TRUE_FALSE("true_false");

    private final String wireName;

    QuestionType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /** Looks up a type by its wire name, ignoring case and surrounding blanks. */
    public static Optional<QuestionType> fromWireName(String value) {
        if (value == null)
            return Optional.empty();
        String normalized = value.trim();
        return Arrays.stream(values())
                .filter(t -> t.wireName.equalsIgnoreCase(normalized))
                .findFirst();
    }

    @JsonCreator
    static QuestionType fromJson(String value) {
        return fromWireName(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown question type: " + value));
    }
}
