package com.example.interview_orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Read-only view of where a session stands, for display.
 */
public record InterviewProgress(@JsonProperty("question_number") int questionNumber,
                                @JsonProperty("total_questions") int totalQuestions,
                                @JsonProperty("followup_count") int followupCount,
                                @JsonProperty("max_followups") int maxFollowups,
                                @JsonProperty("is_follow_up") boolean followUp,
                                @JsonProperty("percent") int percent,
                                @JsonProperty("can_continue") boolean canContinue) {

    public static InterviewProgress of(InterviewSession session) {
        int percent = 0;
        if (session.getMaxQuestions() > 0) {
            double raw = (session.getCurrentQuestionIndex() + 1) * 100.0 / session.getMaxQuestions();
            percent = (int) Math.min(100, Math.round(raw));
        }
        boolean canContinue = !session.isCompleted()
                && session.getCurrentQuestionIndex() < session.getMaxQuestions();
        return new InterviewProgress(
                session.getCurrentQuestionIndex() + 1,
                session.getMaxQuestions(),
                session.getFollowupCount(),
                session.getMaxFollowups(),
                session.getQuestionType() == QuestionType.FOLLOWUP,
                percent,
                canContinue);
    }
}
