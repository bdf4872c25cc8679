package com.example.interview_orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Phases only move forward, in declaration order.
 */
public enum InterviewPhase {
    INITIALIZING("initializing"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed");

    private final String wireName;

    InterviewPhase(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static InterviewPhase fromWire(String value) {
        for (InterviewPhase phase : values()) {
            if (phase.wireName.equals(value)) {
                return phase;
            }
        }
        throw new IllegalArgumentException("Unknown interview phase: " + value);
    }
}
