package com.example.interview_orchestrator.exception;

public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String sessionId) {
        super("Interview session not found: " + sessionId);
    }
}
