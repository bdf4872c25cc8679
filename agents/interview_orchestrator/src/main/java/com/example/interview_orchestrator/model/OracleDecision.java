package com.example.interview_orchestrator.model;

import org.springframework.util.StringUtils;

/**
 * Validated oracle output. A blank or missing question means the oracle wants the interview to end.
 */
public record OracleDecision(String question, boolean wantsFollowUp, String reasoning) {

    public static OracleDecision endOfInterview(String reasoning) {
        return new OracleDecision(null, false, reasoning);
    }

    public static OracleDecision mainQuestion(String question, String reasoning) {
        return new OracleDecision(question, false, reasoning);
    }

    public static OracleDecision followUp(String question, String reasoning) {
        return new OracleDecision(question, true, reasoning);
    }

    public boolean hasQuestion() {
        return StringUtils.hasText(question);
    }
}
