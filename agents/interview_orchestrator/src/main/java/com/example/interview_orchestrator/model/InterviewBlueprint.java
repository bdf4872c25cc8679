package com.example.interview_orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Profile analysis computed once per interview and passed along unchanged afterwards.
 */
public record InterviewBlueprint(@JsonProperty("key_skills") List<String> keySkills,
                                 @JsonProperty("skill_gaps") List<String> skillGaps,
                                 @JsonProperty("notable_projects") List<String> notableProjects,
                                 @JsonProperty("focus_areas") List<String> focusAreas,
                                 @JsonProperty("suggested_question_themes") List<String> suggestedQuestionThemes) {

    public InterviewBlueprint {
        keySkills = keySkills == null ? List.of() : List.copyOf(keySkills);
        skillGaps = skillGaps == null ? List.of() : List.copyOf(skillGaps);
        notableProjects = notableProjects == null ? List.of() : List.copyOf(notableProjects);
        focusAreas = focusAreas == null ? List.of() : List.copyOf(focusAreas);
        suggestedQuestionThemes = suggestedQuestionThemes == null ? List.of() : List.copyOf(suggestedQuestionThemes);
    }

    public static InterviewBlueprint fallback() {
        return new InterviewBlueprint(
                List.of("Technical skills", "Problem-solving"),
                List.of("Experience gaps"),
                List.of("Previous work"),
                List.of("Technical depth", "Communication"),
                List.of("Projects", "Challenges"));
    }
}
