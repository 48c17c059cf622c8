package uk.gegc.learnpath.features.scoring.domain.model;

/**
 * @param oracleScore 0-100 grade from the scoring model, only for open-text questions it answered
 * @param degraded    open-text answer graded by the substring fallback because the model was unavailable
 */
public record GradedAnswer(boolean correct, Integer oracleScore, boolean degraded) {

    public static GradedAnswer of(boolean correct) {
        return new GradedAnswer(correct, null, false);
    }

    public static GradedAnswer incorrect() {
        return of(false);
    }
}
