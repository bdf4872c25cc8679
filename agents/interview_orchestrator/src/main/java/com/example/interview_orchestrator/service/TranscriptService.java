package com.example.interview_orchestrator.service;

import com.example.interview_orchestrator.model.InterviewAnswer;
import com.example.interview_orchestrator.model.InterviewSession;
import com.example.interview_orchestrator.model.QuestionType;
import com.example.interview_orchestrator.model.Transcript;
import org.springframework.stereotype.Service;

import java.time.Clock;

@Service
public class TranscriptService {

    private final Clock clock;

    public TranscriptService(Clock clock) {
        this.clock = clock;
    }

    /**
     * Appends the answer to the question currently open in the session.
     */
    public InterviewSession record(InterviewSession session, String question, String answer) {
        boolean followUp = session.getQuestionType() == QuestionType.FOLLOWUP;
        InterviewAnswer entry = InterviewAnswer.builder()
                .question(question)
                .answer(answer)
                .timestamp(clock.instant())
                .questionId(session.getCurrentQuestionId())
                .questionType(session.getQuestionType())
                .mainQuestionIndex(followUp ? session.getCurrentQuestionIndex() : null)
                .build();
        return Transcript.append(session, entry);
    }
}
