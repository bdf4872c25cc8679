package com.example.interview_orchestrator.service;

import com.example.interview_orchestrator.exception.InterviewValidationException;
import com.example.interview_orchestrator.model.EvaluationResult;
import com.example.interview_orchestrator.model.InterviewAnswer;
import com.example.interview_orchestrator.model.InterviewBlueprint;
import com.example.interview_orchestrator.model.JobContext;
import com.example.interview_orchestrator.model.Transcript;
import com.example.interview_orchestrator.model.Verdict;
import com.example.interview_orchestrator.oracle.InterviewPrompts;
import com.example.interview_orchestrator.oracle.OracleGateway;
import com.example.interview_orchestrator.oracle.OracleReply;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores a finished transcript with a single oracle call. Always returns a complete report.
 */
@Slf4j
@Service
public class EvaluationService {

    static final String DEFAULT_SUMMARY = "Evaluation completed.";

    private final OracleGateway gateway;

    public EvaluationService(OracleGateway gateway) {
        this.gateway = gateway;
    }

    public EvaluationResult evaluate(List<InterviewAnswer> transcript, JobContext job, InterviewBlueprint blueprint) {
        if (transcript == null || transcript.isEmpty()) {
            throw new InterviewValidationException("Cannot evaluate an empty transcript");
        }
        InterviewRequests.requireJobContext(job);

        String prompt = InterviewPrompts.evaluation(job, Transcript.render(transcript), blueprint);
        OracleReply reply = gateway.call("evaluation", prompt);
        if (!reply.isOk()) {
            log.info("Returning fallback evaluation for {} answers", transcript.size());
            return fallback(transcript.size());
        }
        return sanitize(reply.payload());
    }

    /**
     * Scores a plain question/answer sheet. Unlike {@link #evaluate}, a report missing any score,
     * list or summary is thrown away in favour of the fixed baseline report.
     */
    public EvaluationResult evaluateAnswers(String jobDescription, String resume,
                                            List<String> questions, List<InterviewAnswer> answers) {
        if (!StringUtils.hasText(jobDescription) || questions == null || questions.isEmpty()
                || answers == null || answers.isEmpty()) {
            throw new InterviewValidationException("Invalid evaluation request");
        }

        String prompt = InterviewPrompts.answerSheetEvaluation(jobDescription, resume, Transcript.render(answers));
        OracleReply reply = gateway.call("answer sheet evaluation", prompt);
        if (!reply.isOk() || !isCompleteReport(reply.payload())) {
            log.info("Returning baseline evaluation for {} answers", answers.size());
            return baseline();
        }
        return sanitize(reply.payload());
    }

    static boolean isCompleteReport(ObjectNode json) {
        return json.path("alignment_percentage").isNumber()
                && json.path("technical_score").isNumber()
                && json.path("problem_solving_score").isNumber()
                && json.path("communication_score").isNumber()
                && json.path("strengths").isArray()
                && json.path("weaknesses").isArray()
                && json.path("summary").isTextual();
    }

    static EvaluationResult baseline() {
        return EvaluationResult.builder()
                .alignmentPercentage(60)
                .technicalScore(7)
                .problemSolvingScore(6)
                .communicationScore(7)
                .strengths(List.of("Clear communication", "Basic technical understanding"))
                .weaknesses(List.of("Needs deeper examples", "Limited edge-case discussion"))
                .finalVerdict(Verdict.MAYBE)
                .summary("The candidate demonstrates baseline competency but requires deeper technical validation.")
                .build();
    }

    static EvaluationResult sanitize(ObjectNode json) {
        return EvaluationResult.builder()
                .alignmentPercentage(clamp(json.get("alignment_percentage"), 0, 100))
                .technicalScore(clamp(json.get("technical_score"), 0, 10))
                .problemSolvingScore(clamp(json.get("problem_solving_score"), 0, 10))
                .communicationScore(clamp(json.get("communication_score"), 0, 10))
                .strengths(textList(json.get("strengths")))
                .weaknesses(textList(json.get("weaknesses")))
                .finalVerdict(verdict(json.get("final_verdict")))
                .summary(json.hasNonNull("summary") && json.get("summary").isTextual()
                        ? json.get("summary").asText()
                        : DEFAULT_SUMMARY)
                .build();
    }

    static EvaluationResult fallback(int answered) {
        return EvaluationResult.builder()
                .alignmentPercentage(65)
                .technicalScore(7)
                .problemSolvingScore(6)
                .communicationScore(7)
                .strengths(List.of("Completed interview", "Engaged in discussion"))
                .weaknesses(List.of("Automated evaluation incomplete"))
                .finalVerdict(Verdict.MAYBE)
                .summary("The candidate answered " + answered + " questions. Manual review is recommended.")
                .build();
    }

    static double clamp(JsonNode node, double min, double max) {
        double value;
        if (node == null || node.isNull()) {
            return min;
        } else if (node.isNumber()) {
            value = node.doubleValue();
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return min;
            }
        } else {
            return min;
        }
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.min(max, Math.max(min, value));
    }

    static List<String> textList(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        node.forEach(element -> {
            if (element.isTextual()) {
                values.add(element.asText());
            }
        });
        return List.copyOf(values);
    }

    private static Verdict verdict(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return Verdict.MAYBE;
        }
        return Verdict.fromLabel(node.asText()).orElse(Verdict.MAYBE);
    }
}
