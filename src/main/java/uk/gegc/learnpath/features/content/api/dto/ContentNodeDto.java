package uk.gegc.learnpath.features.content.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import uk.gegc.learnpath.features.content.domain.model.*;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Flat view of a content node; kind-specific attributes are omitted when not applicable.
 * The challenge solution is never exposed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ContentNodeDto(
        ContentKind kind,
        UUID id,
        UUID parentId,
        String title,
        String slug,
        ContentStatus status,
        Integer sortOrder,
        String description,
        String shortDescription,
        Difficulty difficulty,
        Integer estimatedHours,
        Integer estimatedMinutes,
        Boolean featured,
        String content,
        String summary,
        Integer xpReward,
        LessonType lessonType,
        String videoUrl,
        ChallengeType challengeType,
        JsonNode questions,
        List<String> hints,
        Integer maxAttempts,
        Integer timeLimitMinutes,
        UUID createdBy,
        UUID updatedBy,
        UUID publishedBy,
        Instant publishedAt,
        Instant createdAt,
        Instant updatedAt
) {
}
