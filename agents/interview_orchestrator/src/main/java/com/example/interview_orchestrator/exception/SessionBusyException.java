package com.example.interview_orchestrator.exception;

public class SessionBusyException extends RuntimeException {

    public SessionBusyException(String sessionId) {
        super("Interview session " + sessionId + " is already processing a request");
    }
}
