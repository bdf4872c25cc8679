package com.example.interview_orchestrator.oracle;

import com.example.interview_orchestrator.config.InterviewProperties;
import com.example.interview_orchestrator.model.InterviewSession;
import com.example.interview_orchestrator.model.OracleDecision;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Turns a {@link DecisionContext} into a validated {@link OracleDecision}. Any failure along the
 * way yields the fallback decision for the context instead of an exception.
 */
@Slf4j
@Service
public class QuestionOracleAdapter {

    static final String FALLBACK_REASONING = "Fallback due to AI error";

    private final OracleGateway gateway;
    private final InterviewProperties properties;

    public QuestionOracleAdapter(OracleGateway gateway, InterviewProperties properties) {
        this.gateway = gateway;
        this.properties = properties;
    }

    public OracleDecision requestDecision(DecisionContext context) {
        String purpose = context.followUp() ? "follow-up decision" : "main question";
        String prompt = context.followUp()
                ? InterviewPrompts.followUp(context)
                : InterviewPrompts.mainQuestion(context);

        OracleReply reply = gateway.call(purpose, prompt);
        if (!reply.isOk()) {
            return fallback(context);
        }
        return parse(reply.payload(), context.followUp())
                .orElseGet(() -> {
                    log.warn("Oracle {} failed validation, using fallback: {}", purpose, reply.payload());
                    return fallback(context);
                });
    }

    Optional<OracleDecision> parse(ObjectNode json, boolean followUpContext) {
        JsonNode questionNode = json.get("question");
        String question = null;
        if (questionNode != null && !questionNode.isNull()) {
            if (!questionNode.isTextual()) {
                return Optional.empty();
            }
            question = questionNode.asText().trim();
            if (question.isEmpty()) {
                question = null;
            }
        }

        JsonNode reasoningNode = json.get("reasoning");
        String reasoning = reasoningNode != null && reasoningNode.isTextual() ? reasoningNode.asText() : null;

        JsonNode wantsNode = json.get("wantsFollowUp");
        boolean wantsFollowUp;
        if (wantsNode == null || wantsNode.isNull()) {
            // a follow-up prompt answered with a question means "ask it"
            wantsFollowUp = followUpContext && question != null;
        } else if (wantsNode.isBoolean()) {
            wantsFollowUp = wantsNode.booleanValue();
        } else {
            return Optional.empty();
        }
        return Optional.of(new OracleDecision(question, wantsFollowUp, reasoning));
    }

    OracleDecision fallback(DecisionContext context) {
        if (context.followUp()) {
            log.info("Skipping follow-up after oracle failure");
            return OracleDecision.endOfInterview(FALLBACK_REASONING);
        }
        InterviewSession session = context.session();
        if (session.getCurrentQuestionIndex() >= session.getMaxQuestions()) {
            log.info("Oracle failed with the question budget spent, ending interview");
            return OracleDecision.endOfInterview(FALLBACK_REASONING);
        }
        String question = String.format(properties.getFallbackQuestion(), context.job().roleTitle());
        log.info("Using templated fallback question for question {}", session.getCurrentQuestionIndex() + 1);
        return OracleDecision.mainQuestion(question, FALLBACK_REASONING);
    }
}
