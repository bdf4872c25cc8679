package com.example.interview_orchestrator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "interview")
public class InterviewProperties {
    private int maxQuestions = 7;
    private int maxFollowups = 2;
    // %s is replaced by the role title
    private String fallbackQuestion = "Tell me about your experience relevant to this %s role.";
}
