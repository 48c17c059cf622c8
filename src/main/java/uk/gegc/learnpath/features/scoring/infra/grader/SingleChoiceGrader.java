package uk.gegc.learnpath.features.scoring.infra.grader;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import uk.gegc.learnpath.features.scoring.domain.model.ChallengeQuestion;
import uk.gegc.learnpath.features.scoring.domain.model.GradedAnswer;
import uk.gegc.learnpath.features.scoring.domain.model.QuestionType;

@Component
public class SingleChoiceGrader extends AnswerGrader {

    @Override
    public QuestionType supportedType() {
        return QuestionType.SINGLE_CHOICE;
    }

    @Override
    protected GradedAnswer doGrade(ChallengeQuestion question, JsonNode expected, JsonNode given) {
        return GradedAnswer.of(scalarEquals(expected, given));
    }
}
