package com.example.interview_orchestrator.service;

import com.example.interview_orchestrator.config.InterviewProperties;
import com.example.interview_orchestrator.exception.InterviewValidationException;
import com.example.interview_orchestrator.exception.SessionNotFoundException;
import com.example.interview_orchestrator.model.AnalyzeProfileResponse;
import com.example.interview_orchestrator.model.EvaluationResult;
import com.example.interview_orchestrator.model.InterviewProgress;
import com.example.interview_orchestrator.model.InterviewSession;
import com.example.interview_orchestrator.model.JobContext;
import com.example.interview_orchestrator.model.NextQuestionResponse;
import com.example.interview_orchestrator.model.SessionView;
import com.example.interview_orchestrator.model.StartInterviewResponse;
import com.example.interview_orchestrator.repository.InterviewRecord;
import com.example.interview_orchestrator.repository.SessionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.UUID;

/**
 * Server-held interviews: owns the session repository and serializes work per session.
 */
@Slf4j
@Service
public class InterviewSessionService {

    private final SessionRepository repository;
    private final SessionLockRegistry locks;
    private final InterviewOrchestrator orchestrator;
    private final ProfileAnalysisService profileAnalysisService;
    private final EvaluationService evaluationService;
    private final TranscriptService transcriptService;
    private final InterviewProperties properties;
    private final Clock clock;

    public InterviewSessionService(SessionRepository repository,
                                   SessionLockRegistry locks,
                                   InterviewOrchestrator orchestrator,
                                   ProfileAnalysisService profileAnalysisService,
                                   EvaluationService evaluationService,
                                   TranscriptService transcriptService,
                                   InterviewProperties properties,
                                   Clock clock) {
        this.repository = repository;
        this.locks = locks;
        this.orchestrator = orchestrator;
        this.profileAnalysisService = profileAnalysisService;
        this.evaluationService = evaluationService;
        this.transcriptService = transcriptService;
        this.properties = properties;
        this.clock = clock;
    }

    public StartInterviewResponse start(JobContext job, Integer maxQuestions, Integer maxFollowups) {
        InterviewRequests.requireJobContext(job);
        int questions = maxQuestions != null ? maxQuestions : properties.getMaxQuestions();
        int followups = maxFollowups != null ? maxFollowups : properties.getMaxFollowups();
        if (questions < 1) {
            throw new InterviewValidationException("maxQuestions must be at least 1");
        }
        if (followups < 0) {
            throw new InterviewValidationException("maxFollowups must not be negative");
        }

        AnalyzeProfileResponse analysis = profileAnalysisService.analyzeProfile(job);
        String sessionId = UUID.randomUUID().toString();
        InterviewRecord record = InterviewRecord.builder()
                .sessionId(sessionId)
                .job(job)
                .blueprint(analysis.blueprint())
                .blueprintAnalyzed(analysis.success())
                .session(InterviewSession.start(questions, followups))
                .createdAt(clock.instant())
                .build();
        repository.put(sessionId, record);
        log.info("Started interview {} for role '{}' ({} questions, {} follow-ups)",
                sessionId, job.roleTitle(), questions, followups);

        NextQuestionResponse first = locks.withLock(sessionId, () -> advance(record, null));
        return new StartInterviewResponse(sessionId, analysis.success(), analysis.blueprint(), first);
    }

    /**
     * Records the answer to the open question and moves the interview on.
     */
    public NextQuestionResponse answer(String sessionId, String answer) {
        if (!StringUtils.hasText(answer)) {
            throw new InterviewValidationException("Answer text is required");
        }
        return locks.withLock(sessionId, () -> {
            InterviewRecord record = load(sessionId);
            if (record.getSession().isCompleted()) {
                return closeInterview(record, answer.trim());
            }
            InterviewSession local = record.getSession();
            if (record.getCurrentQuestion() != null) {
                local = transcriptService.record(local, record.getCurrentQuestion(), answer.trim());
            }
            return advance(record.toBuilder().session(local).build(), answer.trim());
        });
    }

    /**
     * The last question is issued together with completion, so its answer still has to land in the
     * transcript. Anything sent after that is ignored.
     */
    private NextQuestionResponse closeInterview(InterviewRecord record, String answer) {
        if (record.getCurrentQuestion() == null) {
            return NextQuestionResponse.terminal(record.getSession());
        }
        InterviewSession session = transcriptService.record(record.getSession(), record.getCurrentQuestion(), answer);
        repository.put(record.getSessionId(), record.toBuilder()
                .session(session)
                .currentQuestion(null)
                .build());
        log.info("Recorded closing answer for interview {} ({} answers)", record.getSessionId(),
                session.getConversationHistory().size());
        return NextQuestionResponse.terminal(session);
    }

    public SessionView get(String sessionId) {
        InterviewRecord record = load(sessionId);
        return new SessionView(sessionId, record.getCreatedAt(), record.getCurrentQuestion(), record.getSession(),
                InterviewProgress.of(record.getSession()), record.isBlueprintAnalyzed(), record.getBlueprint());
    }

    public EvaluationResult evaluate(String sessionId) {
        InterviewRecord record = load(sessionId);
        return evaluationService.evaluate(record.getSession().getConversationHistory(), record.getJob(),
                record.getBlueprint());
    }

    private NextQuestionResponse advance(InterviewRecord record, String lastAnswer) {
        InterviewSession local = record.getSession();
        NextQuestionResponse response = orchestrator.advanceQuestion(record.getJob(), local, lastAnswer,
                record.getBlueprint());
        InterviewSession merged = SessionSync.merge(local, response.updatedSession());
        repository.put(record.getSessionId(), record.toBuilder()
                .session(merged)
                .currentQuestion(response.question())
                .build());
        if (response.complete()) {
            log.info("Interview {} completed after {} answers", record.getSessionId(),
                    merged.getConversationHistory().size());
        }
        return response.withUpdatedSession(merged);
    }

    private InterviewRecord load(String sessionId) {
        return repository.get(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }
}
