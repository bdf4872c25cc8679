package com.example.interview_orchestrator.oracle;

import com.example.interview_orchestrator.model.InterviewBlueprint;
import com.example.interview_orchestrator.model.InterviewSession;
import com.example.interview_orchestrator.model.JobContext;

/**
 * Everything a question decision is based on. {@code followUp} tells which prompt shape to use.
 */
public record DecisionContext(JobContext job,
                              InterviewSession session,
                              String lastAnswer,
                              InterviewBlueprint blueprint,
                              boolean followUp) {

    public DecisionContext asMainQuestion() {
        return new DecisionContext(job, session, lastAnswer, blueprint, false);
    }
}
