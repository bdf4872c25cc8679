package com.example.interview_orchestrator.service;

import com.example.interview_orchestrator.TestFixtures;
import com.example.interview_orchestrator.model.InterviewPhase;
import com.example.interview_orchestrator.model.InterviewSession;
import com.example.interview_orchestrator.model.QuestionType;
import org.junit.jupiter.api.Test;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;

class SessionSyncTest {

    private final TranscriptService transcript = new TranscriptService(Clock.systemUTC());

    @Test
    void keepsLocalHistoryAndAuthoritativeCounters() {
        InterviewSession sent = transcript.record(
                TestFixtures.session(1, QuestionType.MAIN, 0, 3, 1, InterviewPhase.IN_PROGRESS), "Q1", "A1");
        InterviewSession local = transcript.record(sent, "Q1", "A1, continued");
        InterviewSession authoritative = sent.toBuilder()
                .currentQuestionIndex(2)
                .currentQuestionId("main-2-2")
                .questionSequence(2)
                .build();

        InterviewSession merged = SessionSync.merge(local, authoritative);

        assertThat(merged.getConversationHistory()).isEqualTo(local.getConversationHistory()).hasSize(2);
        assertThat(merged.getCurrentQuestionIndex()).isEqualTo(2);
        assertThat(merged.getCurrentQuestionId()).isEqualTo("main-2-2");
        assertThat(merged.getQuestionSequence()).isEqualTo(2);
        assertThat(merged.getInterviewPhase()).isEqualTo(InterviewPhase.IN_PROGRESS);
    }

    @Test
    void phaseComesFromAuthoritativeCopy() {
        InterviewSession local = TestFixtures.session(2, QuestionType.MAIN, 0, 3, 1, InterviewPhase.IN_PROGRESS);
        InterviewSession authoritative = local.toBuilder().interviewPhase(InterviewPhase.COMPLETED).build();

        assertThat(SessionSync.merge(local, authoritative).isCompleted()).isTrue();
    }
}
