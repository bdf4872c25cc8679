package com.example.interview_orchestrator.oracle;

import com.example.interview_orchestrator.TestFixtures;
import com.example.interview_orchestrator.model.InterviewBlueprint;
import com.example.interview_orchestrator.model.InterviewPhase;
import com.example.interview_orchestrator.model.InterviewSession;
import com.example.interview_orchestrator.model.OracleDecision;
import com.example.interview_orchestrator.model.QuestionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static com.example.interview_orchestrator.TestFixtures.JOB;
import static com.example.interview_orchestrator.TestFixtures.session;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class QuestionOracleAdapterTest {

    private TextGenerationOracle oracle;
    private QuestionOracleAdapter adapter;

    @BeforeEach
    void setUp() {
        oracle = mock(TextGenerationOracle.class);
        adapter = new QuestionOracleAdapter(TestFixtures.gateway(oracle), TestFixtures.properties(3, 1));
    }

    private DecisionContext mainContext(int index) {
        InterviewSession state = session(index, QuestionType.MAIN, 0, 3, 1, InterviewPhase.IN_PROGRESS);
        return new DecisionContext(JOB, state, null, null, false);
    }

    private DecisionContext followUpContext() {
        InterviewSession state = session(1, QuestionType.MAIN, 0, 3, 1, InterviewPhase.IN_PROGRESS);
        return new DecisionContext(JOB, state, "We sharded by merchant id.", InterviewBlueprint.fallback(), true);
    }

    @Test
    void parsesMainQuestion() {
        when(oracle.generate(anyString())).thenReturn("{\"question\": \"  Describe your CI pipeline. \", \"reasoning\": \"devops\"}");

        OracleDecision decision = adapter.requestDecision(mainContext(0));

        assertThat(decision.question()).isEqualTo("Describe your CI pipeline.");
        assertThat(decision.wantsFollowUp()).isFalse();
        assertThat(decision.reasoning()).isEqualTo("devops");
        verify(oracle, times(1)).generate(anyString());
    }

    @Test
    @DisplayName("follow-up context with a question and no flag means a follow-up")
    void followUpQuestionWithoutFlag() {
        when(oracle.generate(anyString())).thenReturn("```json\n{\"question\": \"Why merchant id?\"}\n```");

        OracleDecision decision = adapter.requestDecision(followUpContext());

        assertThat(decision.question()).isEqualTo("Why merchant id?");
        assertThat(decision.wantsFollowUp()).isTrue();
    }

    @Test
    void followUpPromptCarriesLastAnswerAndBlueprint() {
        when(oracle.generate(anyString())).thenReturn("{\"question\": null, \"wantsFollowUp\": false}");

        adapter.requestDecision(followUpContext());

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(oracle).generate(prompt.capture());
        assertThat(prompt.getValue())
                .contains("We sharded by merchant id.")
                .contains("Technical depth, Communication")
                .contains("Backend Engineer");
    }

    @Test
    void explicitNoFollowUp() {
        when(oracle.generate(anyString())).thenReturn("{\"question\": null, \"wantsFollowUp\": false, \"reasoning\": \"clear\"}");

        OracleDecision decision = adapter.requestDecision(followUpContext());

        assertThat(decision.hasQuestion()).isFalse();
        assertThat(decision.wantsFollowUp()).isFalse();
        assertThat(decision.reasoning()).isEqualTo("clear");
    }

    @Test
    @DisplayName("unavailable oracle in follow-up context skips the follow-up")
    void followUpFallbackOnTransportError() {
        when(oracle.generate(anyString())).thenThrow(new IllegalStateException("connection refused"));

        OracleDecision decision = adapter.requestDecision(followUpContext());

        assertThat(decision.hasQuestion()).isFalse();
        assertThat(decision.wantsFollowUp()).isFalse();
    }

    @Test
    @DisplayName("unusable output in main context yields the templated question")
    void mainFallbackOnMalformedOutput() {
        when(oracle.generate(anyString())).thenReturn("Sorry, I am unable to help with that.");

        OracleDecision decision = adapter.requestDecision(mainContext(1));

        assertThat(decision.question()).isEqualTo("Tell me about your experience relevant to this Backend Engineer role.");
        assertThat(decision.wantsFollowUp()).isFalse();
        assertThat(decision.reasoning()).isEqualTo(QuestionOracleAdapter.FALLBACK_REASONING);
    }

    @Test
    void mainFallbackAtBudgetEndsInterview() {
        when(oracle.generate(anyString())).thenThrow(new RuntimeException("timeout"));
        InterviewSession spent = session(3, QuestionType.FOLLOWUP, 1, 3, 1, InterviewPhase.IN_PROGRESS);

        OracleDecision decision = adapter.requestDecision(new DecisionContext(JOB, spent, null, null, false));

        assertThat(decision.hasQuestion()).isFalse();
    }

    @Test
    @DisplayName("wrongly typed fields fall back instead of failing")
    void wrongTypesFallBack() {
        when(oracle.generate(anyString()))
                .thenReturn("{\"question\": 42}")
                .thenReturn("{\"question\": \"Q\", \"wantsFollowUp\": \"yes\"}");

        assertThat(adapter.requestDecision(mainContext(0)).reasoning()).isEqualTo(QuestionOracleAdapter.FALLBACK_REASONING);
        assertThat(adapter.requestDecision(followUpContext()).hasQuestion()).isFalse();
    }

    @Test
    void nonTextReasoningIsDropped() {
        when(oracle.generate(anyString())).thenReturn("{\"question\": \"Q\", \"reasoning\": {\"why\": 1}}");

        OracleDecision decision = adapter.requestDecision(mainContext(0));

        assertThat(decision.question()).isEqualTo("Q");
        assertThat(decision.reasoning()).isNull();
    }
}
