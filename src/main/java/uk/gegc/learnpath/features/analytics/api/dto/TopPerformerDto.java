package uk.gegc.learnpath.features.analytics.api.dto;

import java.util.UUID;

public record TopPerformerDto(UUID userId, String displayName, int totalXp, int level, String levelTitle) {
}
