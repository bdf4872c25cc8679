package com.example.interview_orchestrator.service;

import com.example.interview_orchestrator.model.JobContext;
import com.example.interview_orchestrator.model.QuestionSet;
import com.example.interview_orchestrator.oracle.InterviewPrompts;
import com.example.interview_orchestrator.oracle.OracleGateway;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
public class QuestionSetService {

    private final OracleGateway gateway;

    public QuestionSetService(OracleGateway gateway) {
        this.gateway = gateway;
    }

    /**
     * Prepares the whole question list in one oracle call. Falls back to five generic questions
     * naming the role when the oracle gives no usable list.
     */
    public QuestionSet generateQuestions(JobContext job) {
        InterviewRequests.requireJobContext(job);

        Optional<ArrayNode> reply = gateway.callForList("question set", InterviewPrompts.questionBank(job));
        List<String> questions = reply.map(QuestionSetService::texts).orElse(List.of());
        if (questions.isEmpty()) {
            log.info("Using fallback questions for role '{}'", job.roleTitle());
            return QuestionSet.of(fallback(job.roleTitle()), false);
        }
        return QuestionSet.of(questions, true);
    }

    static List<String> fallback(String roleTitle) {
        return List.of(
                "Tell me about your experience relevant to this " + roleTitle + " position.",
                "What technical challenges have you faced in your previous projects?",
                "How do you approach problem-solving in complex technical scenarios?",
                "Describe a project where you demonstrated strong technical skills.",
                "What interests you most about this role?");
    }

    private static List<String> texts(ArrayNode array) {
        List<String> values = new ArrayList<>();
        for (JsonNode element : array) {
            if (element.isTextual() && !element.asText().isBlank()) {
                values.add(element.asText().trim());
            }
        }
        return values;
    }
}
