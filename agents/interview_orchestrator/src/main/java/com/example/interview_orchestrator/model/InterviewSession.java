package com.example.interview_orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Progress record of one candidate's interview. Instances are immutable; every transition
 * produces a new value through {@link #toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InterviewSession {
    @JsonProperty("current_question_index")
    int currentQuestionIndex;

    @JsonProperty("question_type")
    QuestionType questionType;

    @JsonProperty("followup_count")
    int followupCount;

    @JsonProperty("max_questions")
    int maxQuestions;

    @JsonProperty("max_followups")
    int maxFollowups;

    @JsonProperty("interview_phase")
    InterviewPhase interviewPhase;

    @JsonProperty("current_question_id")
    String currentQuestionId;

    // number of question ids minted so far
    @JsonProperty("question_sequence")
    long questionSequence;

    @JsonProperty("conversation_history")
    List<InterviewAnswer> conversationHistory;

    public static InterviewSession start(int maxQuestions, int maxFollowups) {
        return InterviewSession.builder()
                .currentQuestionIndex(0)
                .questionType(QuestionType.MAIN)
                .followupCount(0)
                .maxQuestions(maxQuestions)
                .maxFollowups(maxFollowups)
                .interviewPhase(InterviewPhase.INITIALIZING)
                .questionSequence(0)
                .conversationHistory(List.of())
                .build();
    }

    @JsonIgnore
    public boolean isCompleted() {
        return interviewPhase == InterviewPhase.COMPLETED;
    }
}
