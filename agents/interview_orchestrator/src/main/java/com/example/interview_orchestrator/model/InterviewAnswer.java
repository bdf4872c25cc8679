package com.example.interview_orchestrator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * One answered turn of the transcript.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InterviewAnswer {
    @JsonProperty("question")
    String question;

    @JsonProperty("answer")
    String answer;

    @JsonProperty("timestamp")
    Instant timestamp;

    @JsonProperty("question_id")
    String questionId;

    @JsonProperty("question_type")
    QuestionType questionType;

    // only set for follow-ups
    @JsonProperty("main_question_index")
    Integer mainQuestionIndex;
}
