package com.example.interview_orchestrator.model;

/**
 * Role and candidate text every oracle prompt is built from.
 */
public record JobContext(String jobDescription, String resume, String roleTitle) {
}
