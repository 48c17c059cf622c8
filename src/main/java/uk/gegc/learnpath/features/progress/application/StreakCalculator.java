package uk.gegc.learnpath.features.progress.application;

import java.time.LocalDate;

/**
 * Daily activity streaks. A streak grows by one on the day after the last activity,
 * stays unchanged on the same day and restarts at one after a gap.
 */
public final class StreakCalculator {

    private StreakCalculator() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static Streak next(Streak current, LocalDate lastActivity, LocalDate today) {
        int streak;
        if (lastActivity == null) {
            streak = 1;
        } else if (!today.isAfter(lastActivity)) {
            return current;
        } else if (lastActivity.plusDays(1).equals(today)) {
            streak = current.current() + 1;
        } else {
            streak = 1;
        }
        return new Streak(streak, Math.max(current.longest(), streak));
    }

    public record Streak(int current, int longest) {
    }
}
