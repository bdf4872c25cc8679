package com.example.interview_orchestrator.service;

import com.example.interview_orchestrator.model.InterviewBlueprint;
import com.example.interview_orchestrator.model.InterviewSession;
import com.example.interview_orchestrator.model.JobContext;
import com.example.interview_orchestrator.model.NextQuestionResponse;
import com.example.interview_orchestrator.model.OracleDecision;
import com.example.interview_orchestrator.oracle.DecisionContext;
import com.example.interview_orchestrator.oracle.QuestionOracleAdapter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Sequences one interview step: validate, decide on the prompt shape, consult the oracle and
 * apply the transition. Callers must not run two steps for the same session concurrently.
 */
@Slf4j
@Service
public class InterviewOrchestrator {

    private final QuestionOracleAdapter oracleAdapter;
    private final SessionCodec sessionCodec;

    public InterviewOrchestrator(QuestionOracleAdapter oracleAdapter, SessionCodec sessionCodec) {
        this.oracleAdapter = oracleAdapter;
        this.sessionCodec = sessionCodec;
    }

    public NextQuestionResponse advanceQuestion(JobContext job,
                                                InterviewSession session,
                                                String lastAnswer,
                                                InterviewBlueprint blueprint) {
        InterviewRequests.requireJobContext(job);
        sessionCodec.validate(session);

        if (session.isCompleted()) {
            log.debug("Session already completed, echoing state");
            return NextQuestionResponse.terminal(session);
        }

        boolean followUpEligible = InterviewStateMachine.isFollowUpEligible(session, lastAnswer);
        DecisionContext context = new DecisionContext(job, session, lastAnswer, blueprint, followUpEligible);
        OracleDecision decision = oracleAdapter.requestDecision(context);

        if (followUpEligible && !(decision.hasQuestion() && decision.wantsFollowUp())) {
            // no follow-up wanted (or none could be produced): move on instead of ending the interview
            log.info("No follow-up for question {}, requesting next main question", session.getCurrentQuestionIndex());
            decision = oracleAdapter.requestDecision(context.asMainQuestion());
            followUpEligible = false;
        }

        if (!followUpEligible && decision.wantsFollowUp()) {
            log.debug("Clamping follow-up request outside the follow-up budget");
            decision = new OracleDecision(decision.question(), false, decision.reasoning());
        }

        NextQuestionResponse response = InterviewStateMachine.advance(session, lastAnswer, decision);
        InterviewSession next = response.updatedSession();
        log.debug("Transition {} -> {} (index {}, followups {}/{}, phase {})",
                session.getCurrentQuestionId(), response.questionId(), next.getCurrentQuestionIndex(),
                next.getFollowupCount(), next.getMaxFollowups(), next.getInterviewPhase().wireName());
        return response;
    }
}
