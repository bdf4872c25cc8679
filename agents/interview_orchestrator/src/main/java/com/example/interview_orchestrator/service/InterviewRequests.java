package com.example.interview_orchestrator.service;

import com.example.interview_orchestrator.exception.InterviewValidationException;
import com.example.interview_orchestrator.model.JobContext;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

final class InterviewRequests {

    private InterviewRequests() {
    }

    static void requireJobContext(JobContext job) {
        if (job == null) {
            throw new InterviewValidationException("Missing required fields: jobDescription, resume, roleTitle");
        }
        List<String> missing = new ArrayList<>();
        if (!StringUtils.hasText(job.jobDescription())) {
            missing.add("jobDescription");
        }
        if (!StringUtils.hasText(job.resume())) {
            missing.add("resume");
        }
        if (!StringUtils.hasText(job.roleTitle())) {
            missing.add("roleTitle");
        }
        if (!missing.isEmpty()) {
            throw new InterviewValidationException("Missing required fields: " + String.join(", ", missing));
        }
    }
}
