package uk.gegc.learnpath.features.scoring.infra.grader;

import com.fasterxml.jackson.databind.JsonNode;
import uk.gegc.learnpath.features.scoring.domain.model.ChallengeQuestion;
import uk.gegc.learnpath.features.scoring.domain.model.GradedAnswer;
import uk.gegc.learnpath.features.scoring.domain.model.QuestionType;

public abstract class AnswerGrader {

    /**
     * Returns the question type that this grader supports
     * @return the supported question type
     */
    public abstract QuestionType supportedType();

    /**
     * Grades one answer. A missing answer, or a question without a reference answer, is incorrect.
     */
    public GradedAnswer grade(ChallengeQuestion question, JsonNode expected, JsonNode given) {
        if (isMissing(expected) || isMissing(given)) {
            return GradedAnswer.incorrect();
        }
        return doGrade(question, expected, given);
    }

    protected abstract GradedAnswer doGrade(ChallengeQuestion question, JsonNode expected, JsonNode given);

    protected static boolean isMissing(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    /**
     * Compares scalar JSON values by their textual form, so {@code 1} and {@code "1"} match.
     */
    protected static boolean scalarEquals(JsonNode a, JsonNode b) {
        if (a.isValueNode() && b.isValueNode()) {
            if (a.isNumber() && b.isNumber()) {
                return a.decimalValue().compareTo(b.decimalValue()) == 0;
            }
            return a.asText().equals(b.asText());
        }
        return a.equals(b);
    }
}
