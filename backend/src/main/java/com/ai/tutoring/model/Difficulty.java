package com.ai.tutoring.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum Difficulty {

    EASY,
    MEDIUM,
    HARD;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase();
    }

    public static Optional<Difficulty> fromWireName(String value) {
        if (value == null)
            return Optional.empty();
        String normalized = value.trim();
        return Arrays.stream(values())
                .filter(d -> d.name().equalsIgnoreCase(normalized))
                .findFirst();
    }

    @JsonCreator
    static Difficulty fromJson(String value) {
        return fromWireName(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown difficulty: " + value));
    }
}
