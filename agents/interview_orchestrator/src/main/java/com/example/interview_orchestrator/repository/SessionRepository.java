package com.example.interview_orchestrator.repository;

import java.util.Optional;

public interface SessionRepository {

    Optional<InterviewRecord> get(String sessionId);

    /**
     * Stores the record, replacing whatever was stored under the id.
     */
    void put(String sessionId, InterviewRecord record);
}
