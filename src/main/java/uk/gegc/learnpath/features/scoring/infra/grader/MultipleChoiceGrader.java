package uk.gegc.learnpath.features.scoring.infra.grader;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import uk.gegc.learnpath.features.scoring.domain.model.ChallengeQuestion;
import uk.gegc.learnpath.features.scoring.domain.model.GradedAnswer;
import uk.gegc.learnpath.features.scoring.domain.model.QuestionType;

import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Correct only when the selected options equal the expected options as sets.
 */
@Component
public class MultipleChoiceGrader extends AnswerGrader {

    @Override
    public QuestionType supportedType() {
        return QuestionType.MULTIPLE_CHOICE;
    }

    @Override
    protected GradedAnswer doGrade(ChallengeQuestion question, JsonNode expected, JsonNode given) {
        return GradedAnswer.of(toSet(expected).equals(toSet(given)));
    }

    private static Set<String> toSet(JsonNode node) {
        if (!node.isArray()) {
            return Set.of(node.asText());
        }
        return StreamSupport.stream(node.spliterator(), false)
                .map(JsonNode::asText)
                .collect(Collectors.toSet());
    }
}
