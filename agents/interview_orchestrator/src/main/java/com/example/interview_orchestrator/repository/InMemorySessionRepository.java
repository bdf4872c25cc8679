package com.example.interview_orchestrator.repository;

import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemorySessionRepository implements SessionRepository {

    private final Map<String, InterviewRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<InterviewRecord> get(String sessionId) {
        return Optional.ofNullable(records.get(sessionId));
    }

    @Override
    public void put(String sessionId, InterviewRecord record) {
        records.put(sessionId, record);
    }
}
