package com.example.interview_orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum Verdict {
    FIT("Fit"),
    MAYBE("Maybe"),
    REJECT("Reject");

    private final String label;

    Verdict(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Optional<Verdict> fromLabel(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (Verdict verdict : values()) {
            if (verdict.label.equalsIgnoreCase(trimmed)) {
                return Optional.of(verdict);
            }
        }
        return Optional.empty();
    }
}
