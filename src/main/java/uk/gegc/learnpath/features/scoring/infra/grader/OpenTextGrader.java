package uk.gegc.learnpath.features.scoring.infra.grader;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.learnpath.features.ai.application.ScoringOracle;
import uk.gegc.learnpath.features.scoring.domain.model.ChallengeQuestion;
import uk.gegc.learnpath.features.scoring.domain.model.GradedAnswer;
import uk.gegc.learnpath.features.scoring.domain.model.QuestionType;
import uk.gegc.learnpath.shared.exception.UpstreamServiceException;

import java.util.Locale;

/**
 * Grades free text with the scoring model; a score of 70 or more counts as correct.
 * When the model is unavailable the answer is correct if it contains the reference
 * answer, ignoring case.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OpenTextGrader extends AnswerGrader {

    public static final String DEFAULT_RUBRIC = "Rate this answer on accuracy and completeness (0-100)";
    public static final int PASS_THRESHOLD = 70;

    private final ScoringOracle scoringOracle;

    @Override
    public QuestionType supportedType() {
        return QuestionType.OPEN_TEXT;
    }

    @Override
    protected GradedAnswer doGrade(ChallengeQuestion question, JsonNode expected, JsonNode given) {
        String answer = given.asText();
        String reference = expected.asText();
        String rubric = question.rubric() == null || question.rubric().isBlank() ? DEFAULT_RUBRIC : question.rubric();
        try {
            int score = scoringOracle.score(question.prompt(), answer, reference, rubric);
            return new GradedAnswer(score >= PASS_THRESHOLD, score, false);
        } catch (UpstreamServiceException ex) {
            log.warn("Scoring model unavailable for question {}, falling back to substring match: {}",
                    question.index(), ex.getMessage());
            boolean contains = answer.toLowerCase(Locale.ROOT).contains(reference.toLowerCase(Locale.ROOT));
            return new GradedAnswer(contains, null, true);
        }
    }
}
