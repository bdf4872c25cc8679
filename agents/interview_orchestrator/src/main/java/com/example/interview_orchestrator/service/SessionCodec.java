package com.example.interview_orchestrator.service;

import com.example.interview_orchestrator.exception.InvalidSessionException;
import com.example.interview_orchestrator.model.InterviewAnswer;
import com.example.interview_orchestrator.model.InterviewPhase;
import com.example.interview_orchestrator.model.InterviewSession;
import com.example.interview_orchestrator.model.QuestionType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Text form of {@link InterviewSession}. Payloads that do not describe a valid session are
 * rejected as they are; nothing is filled in or corrected.
 */
@Component
public class SessionCodec {

    private static final List<String> REQUIRED_FIELDS = List.of(
            "current_question_index", "question_type", "followup_count", "max_questions",
            "max_followups", "interview_phase", "conversation_history");

    private final ObjectMapper objectMapper;

    public SessionCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(InterviewSession session) {
        try {
            return objectMapper.writeValueAsString(session);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize interview session", e);
        }
    }

    public InterviewSession decode(String text) {
        JsonNode node;
        try {
            node = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new InvalidSessionException("Interview session is not valid JSON", e);
        }
        return decode(node);
    }

    public InterviewSession decode(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new InvalidSessionException("Interview session must be a JSON object");
        }
        for (String field : REQUIRED_FIELDS) {
            JsonNode value = node.get(field);
            if (value == null || value.isNull()) {
                throw new InvalidSessionException("Interview session is missing " + field);
            }
        }
        if (!node.get("conversation_history").isArray()) {
            throw new InvalidSessionException("conversation_history must be an array");
        }
        InterviewSession session;
        try {
            session = objectMapper.treeToValue(node, InterviewSession.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new InvalidSessionException("Interview session could not be read: " + e.getMessage(), e);
        }
        validate(session);
        return session;
    }

    /**
     * Checks the structural invariants every stored or transported session must satisfy.
     */
    public void validate(InterviewSession session) {
        if (session == null) {
            throw new InvalidSessionException("Interview session is required");
        }
        if (session.getQuestionType() == null || session.getInterviewPhase() == null) {
            throw new InvalidSessionException("question_type and interview_phase are required");
        }
        if (session.getMaxQuestions() < 1) {
            throw new InvalidSessionException("max_questions must be at least 1");
        }
        if (session.getMaxFollowups() < 0) {
            throw new InvalidSessionException("max_followups must not be negative");
        }
        if (session.getCurrentQuestionIndex() < 0 || session.getCurrentQuestionIndex() > session.getMaxQuestions()) {
            throw new InvalidSessionException("current_question_index is out of range");
        }
        if (session.getFollowupCount() < 0 || session.getFollowupCount() > session.getMaxFollowups()) {
            throw new InvalidSessionException("followup_count is outside the follow-up budget");
        }
        if (session.getQuestionType() == QuestionType.FOLLOWUP && session.getFollowupCount() == 0) {
            throw new InvalidSessionException("a follow-up question requires followup_count above zero");
        }
        if (session.getQuestionSequence() < 0) {
            throw new InvalidSessionException("question_sequence must not be negative");
        }
        if (session.getInterviewPhase() != InterviewPhase.COMPLETED
                && session.getCurrentQuestionIndex() >= session.getMaxQuestions()
                && session.getQuestionType() == QuestionType.MAIN) {
            throw new InvalidSessionException("session has used its question budget but is not completed");
        }
        if (session.getConversationHistory() == null) {
            throw new InvalidSessionException("conversation_history is required");
        }
        for (InterviewAnswer entry : session.getConversationHistory()) {
            if (entry == null || entry.getQuestion() == null || entry.getAnswer() == null) {
                throw new InvalidSessionException("conversation_history entries need a question and an answer");
            }
        }
    }
}
