package com.example.interview_orchestrator.service;

import com.example.interview_orchestrator.TestFixtures;
import com.example.interview_orchestrator.exception.InterviewValidationException;
import com.example.interview_orchestrator.model.EvaluationResult;
import com.example.interview_orchestrator.model.InterviewAnswer;
import com.example.interview_orchestrator.model.QuestionType;
import com.example.interview_orchestrator.model.Verdict;
import com.example.interview_orchestrator.oracle.TextGenerationOracle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;

import static com.example.interview_orchestrator.TestFixtures.JOB;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class EvaluationServiceTest {

    private static final List<InterviewAnswer> TRANSCRIPT = List.of(
            InterviewAnswer.builder()
                    .question("How do you keep payments idempotent?")
                    .answer("Idempotency keys stored with the ledger entry.")
                    .timestamp(Instant.parse("2026-10-18T10:00:00Z"))
                    .questionId("main-1-1")
                    .questionType(QuestionType.MAIN)
                    .build(),
            InterviewAnswer.builder()
                    .question("What happens on a duplicate key?")
                    .answer("We return the original response.")
                    .timestamp(Instant.parse("2026-10-18T10:02:00Z"))
                    .questionId("followup-1-2")
                    .questionType(QuestionType.FOLLOWUP)
                    .mainQuestionIndex(1)
                    .build());

    private TextGenerationOracle oracle;
    private EvaluationService service;

    @BeforeEach
    void setUp() {
        oracle = mock(TextGenerationOracle.class);
        service = new EvaluationService(TestFixtures.gateway(oracle));
    }

    @Test
    void wellFormedReportIsKept() {
        when(oracle.generate(anyString())).thenReturn("""
                {"alignment_percentage": 82, "technical_score": 8, "problem_solving_score": 7.5,
                 "communication_score": 9, "strengths": ["Idempotency"], "weaknesses": ["Observability"],
                 "final_verdict": "Fit", "summary": "Strong backend candidate."}
                """);

        EvaluationResult result = service.evaluate(TRANSCRIPT, JOB, null);

        assertThat(result.getAlignmentPercentage()).isEqualTo(82);
        assertThat(result.getProblemSolvingScore()).isEqualTo(7.5);
        assertThat(result.getStrengths()).containsExactly("Idempotency");
        assertThat(result.getFinalVerdict()).isEqualTo(Verdict.FIT);
        assertThat(result.getSummary()).isEqualTo("Strong backend candidate.");
    }

    @Test
    void promptLabelsFollowUps() {
        when(oracle.generate(anyString())).thenReturn("{}");

        service.evaluate(TRANSCRIPT, JOB, null);

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(oracle).generate(prompt.capture());
        assertThat(prompt.getValue())
                .contains("Q1: How do you keep payments idempotent?")
                .contains("Q2 (Follow-up): What happens on a duplicate key?");
    }

    @Test
    @DisplayName("missing weaknesses become an empty list")
    void missingWeaknesses() {
        when(oracle.generate(anyString())).thenReturn("{\"alignment_percentage\": 50, \"strengths\": [\"a\"], \"final_verdict\": \"Maybe\", \"summary\": \"ok\"}");

        EvaluationResult result = service.evaluate(TRANSCRIPT, JOB, null);

        assertThat(result.getWeaknesses()).isEmpty();
        assertThat(result.getStrengths()).containsExactly("a");
    }

    @Test
    @DisplayName("out of range and non-numeric scores are clamped")
    void scoresAreClamped() {
        when(oracle.generate(anyString())).thenReturn("""
                {"alignment_percentage": 140, "technical_score": -3, "problem_solving_score": "eight",
                 "communication_score": "9", "strengths": "many", "weaknesses": ["slow", 3, null, "vague"],
                 "final_verdict": "Strong hire", "summary": 12}
                """);

        EvaluationResult result = service.evaluate(TRANSCRIPT, JOB, null);

        assertThat(result.getAlignmentPercentage()).isEqualTo(100);
        assertThat(result.getTechnicalScore()).isZero();
        assertThat(result.getProblemSolvingScore()).isZero();
        assertThat(result.getCommunicationScore()).isEqualTo(9);
        assertThat(result.getStrengths()).isEmpty();
        assertThat(result.getWeaknesses()).containsExactly("slow", "vague");
        assertThat(result.getFinalVerdict()).isEqualTo(Verdict.MAYBE);
        assertThat(result.getSummary()).isEqualTo(EvaluationService.DEFAULT_SUMMARY);
    }

    @Test
    void unavailableOracleYieldsFallbackReport() {
        when(oracle.generate(anyString())).thenThrow(new IllegalStateException("quota exceeded"));

        EvaluationResult result = service.evaluate(TRANSCRIPT, JOB, null);

        assertThat(result.getFinalVerdict()).isEqualTo(Verdict.MAYBE);
        assertThat(result.getAlignmentPercentage()).isEqualTo(65);
        assertThat(result.getSummary()).contains("2 questions");
        assertThat(result.getStrengths()).isNotEmpty();
    }

    @Test
    void emptyTranscriptIsRejected() {
        assertThatThrownBy(() -> service.evaluate(List.of(), JOB, null))
                .isInstanceOf(InterviewValidationException.class);
        assertThatThrownBy(() -> service.evaluate(null, JOB, null))
                .isInstanceOf(InterviewValidationException.class);
        verifyNoInteractions(oracle);
    }

    @Test
    @DisplayName("arbitrary oracle text always yields values in range")
    void rangesHoldForGarbage() {
        List<String> outputs = List.of("", "null", "[]", "{\"alignment_percentage\": true}",
                "{\"technical_score\": 1e309}", "{\"communication_score\": \"NaN\"}", "{{{", "text {\"summary\": [1]} more");
        for (String output : outputs) {
            when(oracle.generate(anyString())).thenReturn(output);

            EvaluationResult result = service.evaluate(TRANSCRIPT, JOB, null);

            assertThat(result.getAlignmentPercentage()).isBetween(0.0, 100.0);
            assertThat(result.getTechnicalScore()).isBetween(0.0, 10.0);
            assertThat(result.getProblemSolvingScore()).isBetween(0.0, 10.0);
            assertThat(result.getCommunicationScore()).isBetween(0.0, 10.0);
            assertThat(result.getStrengths()).isNotNull();
            assertThat(result.getWeaknesses()).isNotNull();
            assertThat(result.getFinalVerdict()).isNotNull();
            assertThat(result.getSummary()).isNotBlank();
        }
    }

    @Nested
    @DisplayName("answer sheet evaluation")
    class AnswerSheet {

        private final List<String> questions = List.of("How do you keep payments idempotent?");
        private final List<InterviewAnswer> answers = List.of(InterviewAnswer.builder()
                .question("How do you keep payments idempotent?")
                .answer("Idempotency keys stored with the ledger entry.")
                .timestamp(Instant.parse("2026-10-18T10:00:00Z"))
                .build());

        @Test
        void completeReportIsKept() {
            when(oracle.generate(anyString())).thenReturn("""
                    {"alignment_percentage": 88, "technical_score": 9, "problem_solving_score": 8,
                     "communication_score": 12, "strengths": ["Ledgers"], "weaknesses": [],
                     "final_verdict": "fit", "summary": "Hire."}
                    """);

            EvaluationResult result = service.evaluateAnswers(JOB.jobDescription(), JOB.resume(), questions, answers);

            assertThat(result.getAlignmentPercentage()).isEqualTo(88);
            assertThat(result.getCommunicationScore()).isEqualTo(10);
            assertThat(result.getFinalVerdict()).isEqualTo(Verdict.FIT);
            assertThat(result.getSummary()).isEqualTo("Hire.");
        }

        @Test
        void promptListsEachAnswerAndOptionalResume() {
            when(oracle.generate(anyString())).thenReturn("{}");

            service.evaluateAnswers(JOB.jobDescription(), null, questions, answers);

            ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
            verify(oracle).generate(prompt.capture());
            assertThat(prompt.getValue())
                    .contains("Q1: How do you keep payments idempotent?\nA1: Idempotency keys stored with the ledger entry.")
                    .doesNotContain("Candidate Resume:");
        }

        @Test
        @DisplayName("a report with a missing or mistyped field is replaced by the baseline")
        void incompleteReportUsesBaseline() {
            when(oracle.generate(anyString())).thenReturn("""
                    {"alignment_percentage": "88", "technical_score": 9, "problem_solving_score": 8,
                     "communication_score": 7, "strengths": [], "weaknesses": [], "summary": "Hire."}
                    """);

            EvaluationResult result = service.evaluateAnswers(JOB.jobDescription(), JOB.resume(), questions, answers);

            assertThat(result).isEqualTo(EvaluationService.baseline());
            assertThat(result.getAlignmentPercentage()).isEqualTo(60);
            assertThat(result.getWeaknesses()).containsExactly("Needs deeper examples", "Limited edge-case discussion");
        }

        @Test
        void unavailableOracleUsesBaseline() {
            when(oracle.generate(anyString())).thenThrow(new IllegalStateException("quota exceeded"));

            assertThat(service.evaluateAnswers(JOB.jobDescription(), JOB.resume(), questions, answers))
                    .isEqualTo(EvaluationService.baseline());
        }

        @Test
        void requiresJobDescriptionQuestionsAndAnswers() {
            assertThatThrownBy(() -> service.evaluateAnswers(" ", JOB.resume(), questions, answers))
                    .isInstanceOf(InterviewValidationException.class)
                    .hasMessage("Invalid evaluation request");
            assertThatThrownBy(() -> service.evaluateAnswers(JOB.jobDescription(), JOB.resume(), List.of(), answers))
                    .isInstanceOf(InterviewValidationException.class);
            assertThatThrownBy(() -> service.evaluateAnswers(JOB.jobDescription(), JOB.resume(), questions, null))
                    .isInstanceOf(InterviewValidationException.class);
            verifyNoInteractions(oracle);
        }
    }
}
