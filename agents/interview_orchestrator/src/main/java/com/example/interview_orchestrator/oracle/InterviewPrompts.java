package com.example.interview_orchestrator.oracle;

import com.example.interview_orchestrator.model.InterviewBlueprint;
import com.example.interview_orchestrator.model.InterviewSession;
import com.example.interview_orchestrator.model.JobContext;
import com.example.interview_orchestrator.model.Transcript;

public final class InterviewPrompts {

    private InterviewPrompts() {
    }

    public static String mainQuestion(DecisionContext context) {
        JobContext job = context.job();
        InterviewSession session = context.session();
        String transcript = Transcript.render(session.getConversationHistory());
        return """
                You are a senior %s interviewer.

                Job Description:
                %s

                Candidate Resume:
                %s

                %s
                Interview so far:
                %s

                Generate question %d of %d. If the interview has covered enough, return "question": null.

                Return STRICT JSON:
                {
                  "question": string | null,
                  "reasoning": string
                }
                """.formatted(
                job.roleTitle(),
                job.jobDescription(),
                job.resume(),
                focusBlock(context.blueprint()),
                transcript.isEmpty() ? "No questions yet." : transcript,
                session.getCurrentQuestionIndex() + 1,
                session.getMaxQuestions());
    }

    public static String followUp(DecisionContext context) {
        JobContext job = context.job();
        return """
                You are a senior %s interviewer.

                Job Description:
                %s

                Candidate Resume:
                %s

                %s
                Interview so far:
                %s

                Last answer:
                "%s"

                Decide if a follow-up question is needed. Ask one if the answer was vague,
                incomplete, or mentioned something worth exploring. Skip it if the answer was
                comprehensive.

                Return STRICT JSON:
                {
                  "question": string | null,
                  "wantsFollowUp": boolean,
                  "reasoning": string
                }
                """.formatted(
                job.roleTitle(),
                job.jobDescription(),
                job.resume(),
                focusBlock(context.blueprint()),
                Transcript.render(context.session().getConversationHistory()),
                context.lastAnswer());
    }

    public static String profileAnalysis(JobContext job) {
        return """
                You are an expert technical recruiter analyzing a candidate for a %s role.

                Job Description:
                %s

                Candidate Resume:
                %s

                Return STRICT JSON only:
                {
                  "key_skills": [],
                  "skill_gaps": [],
                  "notable_projects": [],
                  "focus_areas": [],
                  "suggested_question_themes": []
                }
                """.formatted(job.roleTitle(), job.jobDescription(), job.resume());
    }

    public static String evaluation(JobContext job, String transcript, InterviewBlueprint blueprint) {
        return """
                You are a senior interviewer evaluating a candidate for a %s role.

                Job Description:
                %s

                Candidate Resume:
                %s

                %s
                Interview Transcript:
                %s

                Return STRICT JSON only:
                {
                  "alignment_percentage": 0,
                  "technical_score": 0,
                  "problem_solving_score": 0,
                  "communication_score": 0,
                  "strengths": [],
                  "weaknesses": [],
                  "final_verdict": "Fit" | "Maybe" | "Reject",
                  "summary": ""
                }
                """.formatted(job.roleTitle(), job.jobDescription(), job.resume(), focusBlock(blueprint), transcript);
    }

    public static String questionBank(JobContext job) {
        return """
                You are an expert technical interviewer. Generate 5-7 interview questions for a %s position.

                Job Description:
                %s

                Candidate Resume:
                %s

                The questions should assess technical skills relevant to the role, evaluate problem-solving,
                test domain knowledge from the candidate's experience and explore background and fit.
                Make them specific to this resume and these job requirements.

                Return ONLY a JSON array of question strings:
                ["Question 1", "Question 2", "Question 3"]
                """.formatted(job.roleTitle(), job.jobDescription(), job.resume());
    }

    public static String answerSheetEvaluation(String jobDescription, String resume, String transcript) {
        return """
                You are a senior technical interviewer.

                Job Description:
                %s

                %s
                Interview Q&A:
                %s

                Evaluate the candidate and return STRICT JSON only:
                {
                  "alignment_percentage": 0,
                  "technical_score": 0,
                  "problem_solving_score": 0,
                  "communication_score": 0,
                  "strengths": [],
                  "weaknesses": [],
                  "final_verdict": "Fit" | "Maybe" | "Reject",
                  "summary": ""
                }
                """.formatted(jobDescription, resumeBlock(resume), transcript);
    }

    private static String resumeBlock(String resume) {
        return resume == null || resume.isBlank() ? "" : "Candidate Resume:\n" + resume + "\n";
    }

    private static String focusBlock(InterviewBlueprint blueprint) {
        if (blueprint == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        if (!blueprint.focusAreas().isEmpty()) {
            sb.append("Focus Areas: ").append(String.join(", ", blueprint.focusAreas())).append('\n');
        }
        if (!blueprint.suggestedQuestionThemes().isEmpty()) {
            sb.append("Question Themes: ").append(String.join(", ", blueprint.suggestedQuestionThemes())).append('\n');
        }
        if (!blueprint.skillGaps().isEmpty()) {
            sb.append("Possible Gaps: ").append(String.join(", ", blueprint.skillGaps())).append('\n');
        }
        return sb.toString();
    }
}
