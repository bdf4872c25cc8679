package com.example.interview_orchestrator.service;

import com.example.interview_orchestrator.model.InterviewSession;

public final class SessionSync {

    private SessionSync() {
    }

    /**
     * Takes counters, phase and ids from the orchestrator's copy and the conversation history from the
     * local copy, so an answer appended locally during the round trip survives.
     */
    public static InterviewSession merge(InterviewSession local, InterviewSession authoritative) {
        return authoritative.toBuilder()
                .conversationHistory(local.getConversationHistory())
                .build();
    }
}
