package uk.gegc.learnpath.features.analytics.api.dto;

import uk.gegc.learnpath.features.content.domain.model.ContentKind;

import java.time.Instant;
import java.util.UUID;

public record RecentCompletionDto(UUID userId, UUID contentId, ContentKind contentKind, int xpEarned, Instant completedAt) {
}
