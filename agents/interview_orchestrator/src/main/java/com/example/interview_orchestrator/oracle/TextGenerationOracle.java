package com.example.interview_orchestrator.oracle;

/**
 * External text generation service. Implementations may throw any runtime exception
 * when the service cannot be reached.
 */
public interface TextGenerationOracle {
    String generate(String prompt);
}
