package uk.gegc.learnpath.features.progress.api.dto;

import java.time.LocalDate;
import java.util.UUID;

public record UserXpDto(
        UUID userId,
        int totalXp,
        int currentLevel,
        String levelTitle,
        Integer nextLevelXp,
        int currentStreak,
        int longestStreak,
        LocalDate lastActivityDate
) {
}
