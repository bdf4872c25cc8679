package com.example.interview_orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.stream.IntStream;

/**
 * A fixed list of questions prepared up front, for interviews that do not adapt to answers.
 */
public record QuestionSet(List<String> questions, List<String> questionIds, @JsonIgnore boolean generated) {

    public QuestionSet {
        questions = List.copyOf(questions);
        questionIds = List.copyOf(questionIds);
    }

    public static QuestionSet of(List<String> questions, boolean generated) {
        List<String> ids = IntStream.rangeClosed(1, questions.size())
                .mapToObj(i -> "q" + i)
                .toList();
        return new QuestionSet(questions, ids, generated);
    }
}
