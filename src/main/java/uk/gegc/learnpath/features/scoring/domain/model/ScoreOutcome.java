package uk.gegc.learnpath.features.scoring.domain.model;

import java.util.List;

/**
 * @param score percentage of correct answers, rounded half up; 0 when the challenge has no questions
 */
public record ScoreOutcome(int score, int correctCount, int totalQuestions, List<QuestionOutcome> questions) {

    public record QuestionOutcome(int index, QuestionType type, GradedAnswer grade) {
    }
}
