package com.example.interview_orchestrator.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Append-only helpers over a session's conversation history.
 */
public final class Transcript {

    private Transcript() {
    }

    public static InterviewSession append(InterviewSession session, InterviewAnswer entry) {
        List<InterviewAnswer> history = new ArrayList<>(session.getConversationHistory());
        history.add(entry);
        return session.toBuilder()
                .conversationHistory(Collections.unmodifiableList(history))
                .build();
    }

    /**
     * Renders the history as numbered Q/A pairs, marking follow-ups.
     */
    public static String render(List<InterviewAnswer> history) {
        return IntStream.range(0, history.size())
                .mapToObj(i -> {
                    InterviewAnswer qa = history.get(i);
                    String label = qa.getQuestionType() == QuestionType.FOLLOWUP ? " (Follow-up)" : "";
                    return "Q" + (i + 1) + label + ": " + qa.getQuestion() + "\nA" + (i + 1) + ": " + qa.getAnswer();
                })
                .collect(Collectors.joining("\n\n"));
    }
}
