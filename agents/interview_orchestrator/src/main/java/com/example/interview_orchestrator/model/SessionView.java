package com.example.interview_orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record SessionView(@JsonProperty("session_id") String sessionId,
                          @JsonProperty("created_at") Instant createdAt,
                          @JsonProperty("current_question") String currentQuestion,
                          @JsonProperty("interview_state") InterviewSession session,
                          @JsonProperty("progress") InterviewProgress progress,
                          @JsonProperty("blueprint_analyzed") boolean blueprintAnalyzed,
                          @JsonProperty("blueprint") InterviewBlueprint blueprint) {
}
