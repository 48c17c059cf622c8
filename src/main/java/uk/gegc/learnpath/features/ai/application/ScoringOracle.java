package uk.gegc.learnpath.features.ai.application;

public interface ScoringOracle {

    /**
     * Grades a free-text answer against a reference answer.
     *
     * @return a score between 0 and 100
     * @throws uk.gegc.learnpath.shared.exception.UpstreamServiceException when the model cannot produce a score
     */
    int score(String question, String answer, String referenceAnswer, String rubric);
}
