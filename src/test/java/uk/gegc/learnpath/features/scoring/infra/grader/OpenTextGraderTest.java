package uk.gegc.learnpath.features.scoring.infra.grader;

import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.learnpath.features.ai.application.ScoringOracle;
import uk.gegc.learnpath.features.scoring.domain.model.ChallengeQuestion;
import uk.gegc.learnpath.features.scoring.domain.model.GradedAnswer;
import uk.gegc.learnpath.features.scoring.domain.model.QuestionType;
import uk.gegc.learnpath.shared.exception.UpstreamServiceException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("OpenTextGrader Tests")
class OpenTextGraderTest {

    @Mock
    private ScoringOracle scoringOracle;

    @InjectMocks
    private OpenTextGrader grader;

    private final ChallengeQuestion question =
            new ChallengeQuestion(0, QuestionType.OPEN_TEXT, "What is a closure?", null, null);

    @Test
    @DisplayName("score of 70 counts as correct")
    void threshold_inclusive() {
        when(scoringOracle.score(anyString(), anyString(), anyString(), anyString())).thenReturn(70);

        GradedAnswer grade = grader.grade(question, TextNode.valueOf("captured scope"), TextNode.valueOf("a function with its scope"));

        assertThat(grade.correct()).isTrue();
        assertThat(grade.oracleScore()).isEqualTo(70);
        assertThat(grade.degraded()).isFalse();
    }

    @Test
    @DisplayName("score of 69 is incorrect")
    void belowThreshold_incorrect() {
        when(scoringOracle.score(anyString(), anyString(), anyString(), anyString())).thenReturn(69);

        assertThat(grader.grade(question, TextNode.valueOf("x"), TextNode.valueOf("y")).correct()).isFalse();
    }

    @Test
    @DisplayName("default rubric is used when the question has none")
    void defaultRubric() {
        when(scoringOracle.score(anyString(), anyString(), anyString(), anyString())).thenReturn(100);

        grader.grade(question, TextNode.valueOf("ref"), TextNode.valueOf("answer"));

        verify(scoringOracle).score("What is a closure?", "answer", "ref", OpenTextGrader.DEFAULT_RUBRIC);
    }

    @Test
    @DisplayName("oracle failure falls back to case-insensitive containment")
    void oracleFailure_substringFallback() {
        when(scoringOracle.score(anyString(), anyString(), anyString(), eq(OpenTextGrader.DEFAULT_RUBRIC)))
                .thenThrow(new UpstreamServiceException("model down"));

        GradedAnswer contains = grader.grade(question, TextNode.valueOf("Lexical Scope"),
                TextNode.valueOf("It keeps its lexical scope alive"));
        GradedAnswer missing = grader.grade(question, TextNode.valueOf("Lexical Scope"),
                TextNode.valueOf("No idea"));

        assertThat(contains.correct()).isTrue();
        assertThat(contains.degraded()).isTrue();
        assertThat(contains.oracleScore()).isNull();
        assertThat(missing.correct()).isFalse();
        assertThat(missing.degraded()).isTrue();
    }

    @Test
    @DisplayName("missing answer is incorrect without calling the oracle")
    void missingAnswer_noOracleCall() {
        assertThat(grader.grade(question, TextNode.valueOf("ref"), null).correct()).isFalse();
        verifyNoInteractions(scoringOracle);
    }
}
