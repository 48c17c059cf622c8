package uk.gegc.learnpath.features.scoring.infra.grader;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.parallel.Execution;
import org.junit.jupiter.api.parallel.ExecutionMode;
import uk.gegc.learnpath.features.scoring.domain.model.ChallengeQuestion;
import uk.gegc.learnpath.features.scoring.domain.model.QuestionType;

import static org.assertj.core.api.Assertions.assertThat;

@Execution(ExecutionMode.CONCURRENT)
class ChoiceGradersTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private JsonNode json(String value) throws Exception {
        return mapper.readTree(value);
    }

    @Nested
    @DisplayName("single choice")
    class SingleChoice {
        private final SingleChoiceGrader grader = new SingleChoiceGrader();
        private final ChallengeQuestion question = new ChallengeQuestion(0, QuestionType.SINGLE_CHOICE, "Pick one", null, null);

        @Test
        void matchingIndex_correct() throws Exception {
            assertThat(grader.grade(question, json("2"), json("2")).correct()).isTrue();
        }

        @Test
        void numberAndNumericString_match() throws Exception {
            assertThat(grader.grade(question, json("2"), json("\"2\"")).correct()).isTrue();
        }

        @Test
        void differentIndex_incorrect() throws Exception {
            assertThat(grader.grade(question, json("2"), json("1")).correct()).isFalse();
        }

        @Test
        void missingAnswer_incorrect() throws Exception {
            assertThat(grader.grade(question, json("2"), null).correct()).isFalse();
            assertThat(grader.grade(question, json("2"), NullNode.getInstance()).correct()).isFalse();
        }
    }

    @Nested
    @DisplayName("multiple choice")
    class MultipleChoice {
        private final MultipleChoiceGrader grader = new MultipleChoiceGrader();
        private final ChallengeQuestion question = new ChallengeQuestion(1, QuestionType.MULTIPLE_CHOICE, "Pick all", null, null);

        @Test
        void sameSetDifferentOrder_correct() throws Exception {
            assertThat(grader.grade(question, json("[0, 2]"), json("[2, 0]")).correct()).isTrue();
        }

        @Test
        void subset_incorrect() throws Exception {
            assertThat(grader.grade(question, json("[0, 2]"), json("[0]")).correct()).isFalse();
        }

        @Test
        void superset_incorrect() throws Exception {
            assertThat(grader.grade(question, json("[0, 2]"), json("[0, 1, 2]")).correct()).isFalse();
        }

        @Test
        void scalarAnswerAgainstSingletonSet_correct() throws Exception {
            assertThat(grader.grade(question, json("[3]"), json("3")).correct()).isTrue();
        }
    }

    @Nested
    @DisplayName("drag and drop")
    class DragDrop {
        private final DragDropGrader grader = new DragDropGrader();
        private final ChallengeQuestion question = new ChallengeQuestion(2, QuestionType.DRAG_DROP, "Place items", null, null);

        @Test
        void sameMappingDifferentKeyOrder_correct() throws Exception {
            assertThat(grader.grade(question,
                    json("{\"item-1\":\"zone-a\",\"item-2\":\"zone-b\"}"),
                    json("{\"item-2\":\"zone-b\",\"item-1\":\"zone-a\"}")).correct()).isTrue();
        }

        @Test
        void oneItemMisplaced_incorrect() throws Exception {
            assertThat(grader.grade(question,
                    json("{\"item-1\":\"zone-a\",\"item-2\":\"zone-b\"}"),
                    json("{\"item-1\":\"zone-b\",\"item-2\":\"zone-b\"}")).correct()).isFalse();
        }

        @Test
        void missingPlacement_incorrect() throws Exception {
            assertThat(grader.grade(question,
                    json("{\"item-1\":\"zone-a\",\"item-2\":\"zone-b\"}"),
                    json("{\"item-1\":\"zone-a\"}")).correct()).isFalse();
        }

        @Test
        void orderedArrays_compareElementwise() throws Exception {
            assertThat(grader.grade(question, json("[\"a\",\"b\"]"), json("[\"a\",\"b\"]")).correct()).isTrue();
            assertThat(grader.grade(question, json("[\"a\",\"b\"]"), json("[\"b\",\"a\"]")).correct()).isFalse();
        }
    }
}
