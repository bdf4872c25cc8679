package com.example.interview_orchestrator.exception;

/**
 * Client input that cannot be processed. Thrown before any state change or oracle call.
 */
public class InterviewValidationException extends RuntimeException {

    public InterviewValidationException(String message) {
        super(message);
    }

    public InterviewValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
