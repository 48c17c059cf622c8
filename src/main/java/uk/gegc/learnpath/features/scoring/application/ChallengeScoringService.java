package uk.gegc.learnpath.features.scoring.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.learnpath.features.content.domain.model.Challenge;
import uk.gegc.learnpath.features.scoring.domain.model.ChallengeQuestion;
import uk.gegc.learnpath.features.scoring.domain.model.GradedAnswer;
import uk.gegc.learnpath.features.scoring.domain.model.QuestionType;
import uk.gegc.learnpath.features.scoring.domain.model.ScoreOutcome;
import uk.gegc.learnpath.features.scoring.infra.factory.AnswerGraderFactory;
import uk.gegc.learnpath.shared.exception.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Grades a set of answers against a challenge definition and its stored solution.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChallengeScoringService {

    private final AnswerGraderFactory graderFactory;
    private final ObjectMapper objectMapper;

    public ScoreOutcome score(Challenge challenge, Map<Integer, JsonNode> answers) {
        List<ChallengeQuestion> questions = parseQuestions(challenge.getContent());
        JsonNode expectedAnswers = readTree(challenge.getSolution()).path("answers");
        return score(questions, expectedAnswers, answers == null ? Map.of() : answers);
    }

    ScoreOutcome score(List<ChallengeQuestion> questions, JsonNode expectedAnswers, Map<Integer, JsonNode> answers) {
        List<ScoreOutcome.QuestionOutcome> outcomes = new ArrayList<>(questions.size());
        int correct = 0;
        for (ChallengeQuestion question : questions) {
            JsonNode expected = expectedAnswers.path(question.index());
            GradedAnswer grade = graderFactory.getGrader(question.type())
                    .grade(question, expected, answers.get(question.index()));
            if (grade.correct()) {
                correct++;
            }
            outcomes.add(new ScoreOutcome.QuestionOutcome(question.index(), question.type(), grade));
        }
        int total = questions.size();
        int score = total == 0 ? 0 : (int) Math.round(100.0 * correct / total);
        return new ScoreOutcome(score, correct, total, List.copyOf(outcomes));
    }

    List<ChallengeQuestion> parseQuestions(String content) {
        JsonNode questions = readTree(content).path("questions");
        if (!questions.isArray()) {
            return List.of();
        }
        List<ChallengeQuestion> parsed = new ArrayList<>(questions.size());
        for (int i = 0; i < questions.size(); i++) {
            JsonNode node = questions.get(i);
            parsed.add(new ChallengeQuestion(
                    i,
                    QuestionType.fromValue(node.path("type").asText(null)),
                    node.path("question").asText(""),
                    node.hasNonNull("rubric") ? node.get("rubric").asText() : null,
                    node
            ));
        }
        return parsed;
    }

    private JsonNode readTree(String json) {
        if (json == null || json.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.error("Stored challenge document is not valid JSON", e);
            throw new ValidationException("Challenge definition is not valid JSON");
        }
    }
}
