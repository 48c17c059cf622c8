package uk.gegc.learnpath.features.scoring.infra.factory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.learnpath.features.scoring.domain.model.QuestionType;
import uk.gegc.learnpath.features.scoring.infra.grader.AnswerGrader;
import uk.gegc.learnpath.shared.exception.ValidationException;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
public class AnswerGraderFactory {
    private final Map<QuestionType, AnswerGrader> graderMap = new EnumMap<>(QuestionType.class);

    public AnswerGraderFactory(List<AnswerGrader> graders) {
        graders.forEach(grader -> graderMap.put(grader.supportedType(), grader));
        log.info("AnswerGraderFactory initialized with graders for types: {}", graderMap.keySet());
    }

    public AnswerGrader getGrader(QuestionType type) {
        AnswerGrader grader = graderMap.get(type);
        if (grader == null) {
            throw new ValidationException("No grader for question type " + type);
        }
        return grader;
    }
}
