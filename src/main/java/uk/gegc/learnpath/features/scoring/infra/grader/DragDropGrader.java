package uk.gegc.learnpath.features.scoring.infra.grader;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import uk.gegc.learnpath.features.scoring.domain.model.ChallengeQuestion;
import uk.gegc.learnpath.features.scoring.domain.model.GradedAnswer;
import uk.gegc.learnpath.features.scoring.domain.model.QuestionType;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Compares the submitted placement with the reference placement. Object placements
 * match regardless of key order; arrays must match element by element.
 */
@Component
public class DragDropGrader extends AnswerGrader {

    @Override
    public QuestionType supportedType() {
        return QuestionType.DRAG_DROP;
    }

    @Override
    protected GradedAnswer doGrade(ChallengeQuestion question, JsonNode expected, JsonNode given) {
        if (expected.isObject() && given.isObject()) {
            return GradedAnswer.of(toMapping(expected).equals(toMapping(given)));
        }
        if (expected.isArray() && given.isArray()) {
            if (expected.size() != given.size()) {
                return GradedAnswer.incorrect();
            }
            for (int i = 0; i < expected.size(); i++) {
                if (!scalarEquals(expected.get(i), given.get(i))) {
                    return GradedAnswer.incorrect();
                }
            }
            return GradedAnswer.of(true);
        }
        return GradedAnswer.of(scalarEquals(expected, given));
    }

    private static Map<String, String> toMapping(JsonNode node) {
        Map<String, String> mapping = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            mapping.put(field.getKey(), value.isValueNode() ? value.asText() : value.toString());
        }
        return mapping;
    }
}
