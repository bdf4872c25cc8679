package com.example.interview_orchestrator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record NextQuestionResponse(@JsonProperty("question") String question,
                                   @JsonProperty("question_id") String questionId,
                                   @JsonProperty("question_type") QuestionType questionType,
                                   @JsonProperty("updated_state") InterviewSession updatedSession,
                                   @JsonProperty("interview_complete") boolean complete,
                                   @JsonProperty("reasoning") String reasoning) {

    /**
     * Answer for a session that has already finished; carries the state back untouched.
     */
    public static NextQuestionResponse terminal(InterviewSession session) {
        return new NextQuestionResponse(null, "", QuestionType.MAIN, session, true, null);
    }

    public NextQuestionResponse withUpdatedSession(InterviewSession session) {
        return new NextQuestionResponse(question, questionId, questionType, session, complete, reasoning);
    }
}
