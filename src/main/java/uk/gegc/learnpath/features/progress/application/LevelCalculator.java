package uk.gegc.learnpath.features.progress.application;

import uk.gegc.learnpath.features.progress.domain.model.XpLevel;

import java.util.List;

/**
 * Derives a user's level from total XP: the highest level whose threshold is at most the total.
 */
public final class LevelCalculator {

    public static final LevelInfo DEFAULT_LEVEL = new LevelInfo(1, null);

    private LevelCalculator() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * @param levelsAscending level table ordered by {@code xpRequired} ascending
     */
    public static LevelInfo resolve(List<XpLevel> levelsAscending, int totalXp) {
        LevelInfo current = DEFAULT_LEVEL;
        if (levelsAscending == null) {
            return current;
        }
        for (XpLevel level : levelsAscending) {
            if (level.getXpRequired() > totalXp) {
                break;
            }
            current = new LevelInfo(level.getLevelId(), level.getTitle());
        }
        return current;
    }

    public record LevelInfo(int level, String title) {
    }
}
