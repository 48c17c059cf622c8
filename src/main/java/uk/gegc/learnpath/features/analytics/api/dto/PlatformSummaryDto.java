package uk.gegc.learnpath.features.analytics.api.dto;

import uk.gegc.learnpath.features.content.domain.model.ContentKind;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Platform-wide rollup. A field whose query failed holds zero or an empty collection.
 */
public record PlatformSummaryDto(
        long totalUsers,
        long activeUsers,
        Map<ContentKind, ContentCountDto> contentCounts,
        long totalCertificates,
        List<LevelDistributionDto> xpDistribution,
        List<TopPerformerDto> topPerformers,
        List<PathEnrollmentDto> pathEnrollments,
        List<RecentCompletionDto> recentCompletions,
        Instant generatedAt
) {
}
