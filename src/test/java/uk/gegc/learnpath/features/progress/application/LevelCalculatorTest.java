package uk.gegc.learnpath.features.progress.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.parallel.Execution;
import org.junit.jupiter.api.parallel.ExecutionMode;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import uk.gegc.learnpath.features.progress.domain.model.XpLevel;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Execution(ExecutionMode.CONCURRENT)
class LevelCalculatorTest {

    private static final List<XpLevel> LEVELS = List.of(
            level(1, "Newcomer", 0),
            level(2, "Explorer", 100),
            level(3, "Learner", 250)
    );

    @ParameterizedTest(name = "{0} XP -> level {1}")
    @CsvSource({
            "0, 1, Newcomer",
            "99, 1, Newcomer",
            "100, 2, Explorer",
            "249, 2, Explorer",
            "250, 3, Learner",
            "100000, 3, Learner"
    })
    void resolve_highestReachedThreshold(int totalXp, int expectedLevel, String expectedTitle) {
        LevelCalculator.LevelInfo info = LevelCalculator.resolve(LEVELS, totalXp);

        assertThat(info.level()).isEqualTo(expectedLevel);
        assertThat(info.title()).isEqualTo(expectedTitle);
    }

    @Test
    @DisplayName("empty level table yields level 1")
    void emptyTable_levelOne() {
        assertThat(LevelCalculator.resolve(List.of(), 5000)).isEqualTo(LevelCalculator.DEFAULT_LEVEL);
    }

    private static XpLevel level(int id, String title, int required) {
        XpLevel level = new XpLevel();
        level.setLevelId(id);
        level.setTitle(title);
        level.setXpRequired(required);
        return level;
    }
}
