package com.example.interview_orchestrator.repository;

import com.example.interview_orchestrator.model.InterviewBlueprint;
import com.example.interview_orchestrator.model.InterviewSession;
import com.example.interview_orchestrator.model.JobContext;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Everything the server keeps for one interview. Replaced as a whole on every write.
 */
@Value
@Builder(toBuilder = true)
public class InterviewRecord {
    String sessionId;
    JobContext job;
    InterviewBlueprint blueprint;
    boolean blueprintAnalyzed;
    InterviewSession session;
    // question awaiting an answer, null before the first question and once the closing answer is in
    String currentQuestion;
    Instant createdAt;
}
