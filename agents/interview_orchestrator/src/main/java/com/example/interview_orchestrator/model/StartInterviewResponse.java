package com.example.interview_orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record StartInterviewResponse(@JsonProperty("session_id") String sessionId,
                                     @JsonProperty("blueprint_analyzed") boolean blueprintAnalyzed,
                                     @JsonProperty("blueprint") InterviewBlueprint blueprint,
                                     @JsonProperty("first_question") NextQuestionResponse firstQuestion) {
}
