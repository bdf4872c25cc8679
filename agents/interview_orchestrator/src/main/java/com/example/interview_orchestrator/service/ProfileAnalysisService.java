package com.example.interview_orchestrator.service;

import com.example.interview_orchestrator.model.AnalyzeProfileResponse;
import com.example.interview_orchestrator.model.InterviewBlueprint;
import com.example.interview_orchestrator.model.JobContext;
import com.example.interview_orchestrator.oracle.InterviewPrompts;
import com.example.interview_orchestrator.oracle.OracleGateway;
import com.example.interview_orchestrator.oracle.OracleReply;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
public class ProfileAnalysisService {

    private static final List<String> BLUEPRINT_FIELDS = List.of(
            "key_skills", "skill_gaps", "notable_projects", "focus_areas", "suggested_question_themes");

    private final OracleGateway gateway;

    public ProfileAnalysisService(OracleGateway gateway) {
        this.gateway = gateway;
    }

    /**
     * Builds the interview blueprint. When the oracle cannot provide one the fixed fallback
     * blueprint is returned with {@code success=false}.
     */
    public AnalyzeProfileResponse analyzeProfile(JobContext job) {
        InterviewRequests.requireJobContext(job);

        OracleReply reply = gateway.call("profile analysis", InterviewPrompts.profileAnalysis(job));
        Optional<InterviewBlueprint> blueprint = reply.isOk() ? parse(reply.payload()) : Optional.empty();
        if (blueprint.isEmpty()) {
            log.info("Using fallback blueprint for role '{}'", job.roleTitle());
            return new AnalyzeProfileResponse(false, InterviewBlueprint.fallback());
        }
        return new AnalyzeProfileResponse(true, blueprint.get());
    }

    static Optional<InterviewBlueprint> parse(ObjectNode json) {
        for (String field : BLUEPRINT_FIELDS) {
            if (!json.path(field).isArray()) {
                log.warn("Blueprint field {} missing or not a list", field);
                return Optional.empty();
            }
        }
        return Optional.of(new InterviewBlueprint(
                texts(json.get("key_skills")),
                texts(json.get("skill_gaps")),
                texts(json.get("notable_projects")),
                texts(json.get("focus_areas")),
                texts(json.get("suggested_question_themes"))));
    }

    private static List<String> texts(JsonNode array) {
        List<String> values = new ArrayList<>();
        for (JsonNode element : array) {
            if (element.isTextual() && !element.asText().isBlank()) {
                values.add(element.asText().trim());
            }
        }
        return values;
    }
}
