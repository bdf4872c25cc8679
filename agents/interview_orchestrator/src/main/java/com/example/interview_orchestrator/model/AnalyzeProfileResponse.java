package com.example.interview_orchestrator.model;

public record AnalyzeProfileResponse(boolean success, InterviewBlueprint blueprint) {
}
