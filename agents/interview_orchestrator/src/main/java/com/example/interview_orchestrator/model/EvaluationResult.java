package com.example.interview_orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class EvaluationResult {
    @JsonProperty("alignment_percentage")
    double alignmentPercentage;

    @JsonProperty("technical_score")
    double technicalScore;

    @JsonProperty("problem_solving_score")
    double problemSolvingScore;

    @JsonProperty("communication_score")
    double communicationScore;

    @JsonProperty("strengths")
    List<String> strengths;

    @JsonProperty("weaknesses")
    List<String> weaknesses;

    @JsonProperty("final_verdict")
    Verdict finalVerdict;

    @JsonProperty("summary")
    String summary;
}
