package uk.gegc.learnpath.features.analytics.application;

import uk.gegc.learnpath.features.analytics.api.dto.PlatformSummaryDto;
import uk.gegc.learnpath.features.analytics.api.dto.UserLearningStatsDto;

import java.util.UUID;

public interface AnalyticsService {

    PlatformSummaryDto getPlatformSummary();

    UserLearningStatsDto getUserLearningStats(UUID userId);
}
