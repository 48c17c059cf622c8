package uk.gegc.learnpath.features.analytics.api.dto;

import uk.gegc.learnpath.features.content.domain.model.ContentKind;

import java.util.Map;
import java.util.UUID;

public record UserLearningStatsDto(
        UUID userId,
        int totalXp,
        int currentLevel,
        String levelTitle,
        Map<ContentKind, Long> completedByKind,
        long certificates,
        int currentStreak,
        int longestStreak,
        long totalStudyMinutes
) {
}
