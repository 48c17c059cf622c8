package uk.gegc.learnpath.features.progress.api.dto;

import uk.gegc.learnpath.features.content.domain.model.ContentKind;
import uk.gegc.learnpath.features.progress.domain.model.ProgressStatus;

import java.time.Instant;
import java.util.UUID;

public record UserProgressDto(
        UUID id,
        UUID userId,
        UUID contentId,
        ContentKind contentKind,
        ProgressStatus status,
        int completionPercentage,
        int xpEarned,
        int attempts,
        Integer score,
        int timeSpentMinutes,
        Instant startedAt,
        Instant completedAt,
        Instant lastAccessedAt
) {
}
