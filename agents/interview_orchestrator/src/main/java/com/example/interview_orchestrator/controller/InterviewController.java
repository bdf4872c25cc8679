package com.example.interview_orchestrator.controller;

import com.example.interview_orchestrator.model.AnalyzeProfileResponse;
import com.example.interview_orchestrator.model.EvaluationResult;
import com.example.interview_orchestrator.model.InterviewAnswer;
import com.example.interview_orchestrator.model.InterviewBlueprint;
import com.example.interview_orchestrator.model.JobContext;
import com.example.interview_orchestrator.model.NextQuestionResponse;
import com.example.interview_orchestrator.model.QuestionSet;
import com.example.interview_orchestrator.model.SessionView;
import com.example.interview_orchestrator.model.StartInterviewResponse;
import com.example.interview_orchestrator.service.EvaluationService;
import com.example.interview_orchestrator.service.InterviewOrchestrator;
import com.example.interview_orchestrator.service.InterviewSessionService;
import com.example.interview_orchestrator.service.ProfileAnalysisService;
import com.example.interview_orchestrator.service.QuestionSetService;
import com.example.interview_orchestrator.service.SessionCodec;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/interview")
public class InterviewController {

    private final InterviewOrchestrator orchestrator;
    private final ProfileAnalysisService profileAnalysisService;
    private final EvaluationService evaluationService;
    private final InterviewSessionService sessionService;
    private final QuestionSetService questionSetService;
    private final SessionCodec sessionCodec;

    public InterviewController(InterviewOrchestrator orchestrator,
                               ProfileAnalysisService profileAnalysisService,
                               EvaluationService evaluationService,
                               InterviewSessionService sessionService,
                               QuestionSetService questionSetService,
                               SessionCodec sessionCodec) {
        this.orchestrator = orchestrator;
        this.profileAnalysisService = profileAnalysisService;
        this.evaluationService = evaluationService;
        this.sessionService = sessionService;
        this.questionSetService = questionSetService;
        this.sessionCodec = sessionCodec;
    }

    // --- stateless: the client carries the session ---

    @PostMapping("/analyze-profile")
    public ResponseEntity<AnalyzeProfileResponse> analyzeProfile(@RequestBody ProfileRequest request) {
        return ResponseEntity.ok(profileAnalysisService.analyzeProfile(request.job()));
    }

    @PostMapping("/next-question")
    public ResponseEntity<NextQuestionResponse> nextQuestion(@RequestBody NextQuestionRequest request) {
        log.debug(">>> next-question for role '{}'", request.roleTitle());
        return ResponseEntity.ok(orchestrator.advanceQuestion(
                request.job(),
                sessionCodec.decode(request.interviewState()),
                request.lastAnswer(),
                request.blueprint()));
    }

    @PostMapping("/final-evaluation")
    public ResponseEntity<EvaluationResult> finalEvaluation(@RequestBody EvaluationRequest request) {
        return ResponseEntity.ok(evaluationService.evaluate(request.conversationHistory(), request.job(),
                request.blueprint()));
    }

    // --- fixed question list, answered in one go ---

    @PostMapping("/generate-questions")
    public ResponseEntity<QuestionSet> generateQuestions(@RequestBody ProfileRequest request) {
        return ResponseEntity.ok(questionSetService.generateQuestions(request.job()));
    }

    @PostMapping("/evaluate")
    public ResponseEntity<EvaluationResult> evaluateAnswers(@RequestBody AnswerSheetRequest request) {
        return ResponseEntity.ok(evaluationService.evaluateAnswers(request.jobDescription(), request.resume(),
                request.questions(), request.answers()));
    }

    // --- stateful: the server keeps the session ---

    @PostMapping("/sessions")
    public ResponseEntity<StartInterviewResponse> start(@RequestBody StartRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(sessionService.start(request.job(), request.maxQuestions(), request.maxFollowups()));
    }

    @GetMapping("/sessions/{sessionId}")
    public ResponseEntity<SessionView> session(@PathVariable String sessionId) {
        return ResponseEntity.ok(sessionService.get(sessionId));
    }

    @PostMapping("/sessions/{sessionId}/answers")
    public ResponseEntity<NextQuestionResponse> answer(@PathVariable String sessionId,
                                                       @RequestBody AnswerRequest request) {
        return ResponseEntity.ok(sessionService.answer(sessionId, request.answer()));
    }

    @PostMapping("/sessions/{sessionId}/evaluation")
    public ResponseEntity<EvaluationResult> evaluate(@PathVariable String sessionId) {
        return ResponseEntity.ok(sessionService.evaluate(sessionId));
    }

    public record ProfileRequest(String jobDescription, String resume, String roleTitle) {
        JobContext job() {
            return new JobContext(jobDescription, resume, roleTitle);
        }
    }

    public record NextQuestionRequest(String jobDescription,
                                      String resume,
                                      String roleTitle,
                                      @JsonProperty("interview_state") JsonNode interviewState,
                                      @JsonProperty("last_answer") String lastAnswer,
                                      InterviewBlueprint blueprint) {
        JobContext job() {
            return new JobContext(jobDescription, resume, roleTitle);
        }
    }

    public record EvaluationRequest(String jobDescription,
                                    String resume,
                                    String roleTitle,
                                    @JsonProperty("conversation_history") List<InterviewAnswer> conversationHistory,
                                    InterviewBlueprint blueprint) {
        JobContext job() {
            return new JobContext(jobDescription, resume, roleTitle);
        }
    }

    public record StartRequest(String jobDescription,
                               String resume,
                               String roleTitle,
                               Integer maxQuestions,
                               Integer maxFollowups) {
        JobContext job() {
            return new JobContext(jobDescription, resume, roleTitle);
        }
    }

    public record AnswerSheetRequest(String jobDescription,
                                     String resume,
                                     List<String> questions,
                                     List<InterviewAnswer> answers) {}

    public record AnswerRequest(String answer) {}
}
