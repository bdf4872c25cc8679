package com.example.interview_orchestrator.service;

import com.example.interview_orchestrator.model.InterviewPhase;
import com.example.interview_orchestrator.model.InterviewSession;
import com.example.interview_orchestrator.model.NextQuestionResponse;
import com.example.interview_orchestrator.model.OracleDecision;
import com.example.interview_orchestrator.model.QuestionType;
import org.springframework.util.StringUtils;

/**
 * Interview progression rules. Stateless: every call maps an immutable session and a validated
 * decision to a new session, so no locking is needed here.
 */
public final class InterviewStateMachine {

    private InterviewStateMachine() {
    }

    /**
     * A follow-up may only be asked right after an answer to a main question, within the budget.
     */
    public static boolean isFollowUpEligible(InterviewSession session, String lastAnswer) {
        return StringUtils.hasText(lastAnswer)
                && session.getQuestionType() == QuestionType.MAIN
                && session.getFollowupCount() < session.getMaxFollowups();
    }

    public static NextQuestionResponse advance(InterviewSession session, String lastAnswer, OracleDecision decision) {
        if (session.isCompleted()) {
            return NextQuestionResponse.terminal(session);
        }

        if (!decision.hasQuestion()) {
            InterviewSession ended = session.toBuilder()
                    .interviewPhase(InterviewPhase.COMPLETED)
                    .build();
            return new NextQuestionResponse(null, "", QuestionType.MAIN, ended, true, decision.reasoning());
        }

        String question = decision.question().trim();
        long sequence = session.getQuestionSequence() + 1;

        if (decision.wantsFollowUp() && isFollowUpEligible(session, lastAnswer)) {
            String id = mintId(QuestionType.FOLLOWUP, session.getCurrentQuestionIndex(), sequence);
            InterviewSession next = session.toBuilder()
                    .followupCount(session.getFollowupCount() + 1)
                    .questionType(QuestionType.FOLLOWUP)
                    .currentQuestionId(id)
                    .questionSequence(sequence)
                    .interviewPhase(InterviewPhase.IN_PROGRESS)
                    .build();
            return new NextQuestionResponse(question, id, QuestionType.FOLLOWUP, next, false, decision.reasoning());
        }

        int index = session.getCurrentQuestionIndex() + 1;
        String id = mintId(QuestionType.MAIN, index, sequence);
        boolean completed = index >= session.getMaxQuestions();
        InterviewSession next = session.toBuilder()
                .currentQuestionIndex(index)
                .followupCount(0)
                .questionType(QuestionType.MAIN)
                .currentQuestionId(id)
                .questionSequence(sequence)
                .interviewPhase(completed ? InterviewPhase.COMPLETED : InterviewPhase.IN_PROGRESS)
                .build();
        return new NextQuestionResponse(question, id, QuestionType.MAIN, next, completed, decision.reasoning());
    }

    static String mintId(QuestionType type, int index, long sequence) {
        return type.wireName() + "-" + index + "-" + sequence;
    }
}
