package com.example.interview_orchestrator.exception;

public class InvalidSessionException extends InterviewValidationException {

    public InvalidSessionException(String message) {
        super(message);
    }

    public InvalidSessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
