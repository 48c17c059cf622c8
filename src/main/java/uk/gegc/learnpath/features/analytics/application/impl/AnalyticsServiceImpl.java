package uk.gegc.learnpath.features.analytics.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import uk.gegc.learnpath.features.analytics.api.dto.*;
import uk.gegc.learnpath.features.analytics.application.AnalyticsService;
import uk.gegc.learnpath.features.analytics.config.AnalyticsProperties;
import uk.gegc.learnpath.features.certificate.domain.model.CertificateStatus;
import uk.gegc.learnpath.features.certificate.domain.repository.CertificateRepository;
import uk.gegc.learnpath.features.content.domain.model.ContentKind;
import uk.gegc.learnpath.features.content.domain.model.ContentNode;
import uk.gegc.learnpath.features.content.domain.model.ContentStatus;
import uk.gegc.learnpath.features.content.domain.repository.ContentNodeRepository;
import uk.gegc.learnpath.features.content.infra.registry.ContentNodeRegistry;
import uk.gegc.learnpath.features.progress.domain.model.ProgressStatus;
import uk.gegc.learnpath.features.progress.domain.model.UserXp;
import uk.gegc.learnpath.features.progress.domain.repository.UserProgressRepository;
import uk.gegc.learnpath.features.progress.domain.repository.UserXpRepository;
import uk.gegc.learnpath.features.user.domain.model.UserProfile;
import uk.gegc.learnpath.features.user.domain.repository.UserProfileRepository;
import uk.gegc.learnpath.shared.cache.CacheKeys;
import uk.gegc.learnpath.shared.cache.CacheProperties;
import uk.gegc.learnpath.shared.cache.TtlCache;
import uk.gegc.learnpath.shared.query.QuerySpec;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Read-only rollups. Each sub-query runs on the analytics pool and fails on its own:
 * a failure is logged and replaces only that field with its empty value.
 */
@Service
@Slf4j
public class AnalyticsServiceImpl implements AnalyticsService {

    private final UserProfileRepository userProfileRepository;
    private final UserProgressRepository userProgressRepository;
    private final UserXpRepository userXpRepository;
    private final CertificateRepository certificateRepository;
    private final ContentNodeRegistry registry;
    private final TtlCache cache;
    private final CacheProperties cacheProperties;
    private final AnalyticsProperties analyticsProperties;
    private final Executor analyticsExecutor;
    private final Clock clock;

    public AnalyticsServiceImpl(UserProfileRepository userProfileRepository,
                                UserProgressRepository userProgressRepository,
                                UserXpRepository userXpRepository,
                                CertificateRepository certificateRepository,
                                ContentNodeRegistry registry,
                                TtlCache cache,
                                CacheProperties cacheProperties,
                                AnalyticsProperties analyticsProperties,
                                @Qualifier("analyticsTaskExecutor") Executor analyticsExecutor,
                                Clock clock) {
        this.userProfileRepository = userProfileRepository;
        this.userProgressRepository = userProgressRepository;
        this.userXpRepository = userXpRepository;
        this.certificateRepository = certificateRepository;
        this.registry = registry;
        this.cache = cache;
        this.cacheProperties = cacheProperties;
        this.analyticsProperties = analyticsProperties;
        this.analyticsExecutor = analyticsExecutor;
        this.clock = clock;
    }

    @Override
    public PlatformSummaryDto getPlatformSummary() {
        return cache.getOrLoad(CacheKeys.CONTENT_STATS, this::computePlatformSummary, cacheProperties.getStatsTtl());
    }

    @Override
    public UserLearningStatsDto getUserLearningStats(UUID userId) {
        return cache.getOrLoad(CacheKeys.userStats(userId), () -> computeUserStats(userId), cacheProperties.getStatsTtl());
    }

    PlatformSummaryDto computePlatformSummary() {
        CompletableFuture<Long> totalUsers = fetch("totalUsers", userProfileRepository::count, 0L);
        CompletableFuture<Long> activeUsers = fetch("activeUsers", () -> userProfileRepository
                .countByLastActiveAtGreaterThanEqual(clock.instant().minus(analyticsProperties.getActiveWindow())), 0L);
        CompletableFuture<Map<ContentKind, ContentCountDto>> contentCounts = fetch("contentCounts",
                this::countContent, emptyContentCounts());
        CompletableFuture<Long> totalCertificates = fetch("totalCertificates",
                () -> certificateRepository.countByStatus(CertificateStatus.ISSUED), 0L);
        CompletableFuture<List<LevelDistributionDto>> xpDistribution = fetch("xpDistribution",
                () -> userXpRepository.countUsersPerLevel().stream()
                        .map(row -> new LevelDistributionDto(row.getLevel(), row.getUsers()))
                        .toList(), List.of());
        CompletableFuture<List<TopPerformerDto>> topPerformers = fetch("topPerformers", this::topPerformers, List.of());
        CompletableFuture<List<PathEnrollmentDto>> pathEnrollments = fetch("pathEnrollments", this::pathEnrollments, List.of());
        CompletableFuture<List<RecentCompletionDto>> recentCompletions = fetch("recentCompletions",
                () -> userProgressRepository.findRecentCompletions(PageRequest.of(0, analyticsProperties.getRecentCompletionsLimit()))
                        .stream()
                        .map(p -> new RecentCompletionDto(p.getUserId(), p.getContentId(), p.getContentKind(),
                                p.getXpEarned(), p.getCompletedAt()))
                        .toList(), List.of());

        CompletableFuture.allOf(totalUsers, activeUsers, contentCounts, totalCertificates,
                xpDistribution, topPerformers, pathEnrollments, recentCompletions).join();

        return new PlatformSummaryDto(
                totalUsers.join(),
                activeUsers.join(),
                contentCounts.join(),
                totalCertificates.join(),
                xpDistribution.join(),
                topPerformers.join(),
                pathEnrollments.join(),
                recentCompletions.join(),
                clock.instant()
        );
    }

    UserLearningStatsDto computeUserStats(UUID userId) {
        CompletableFuture<Optional<UserXp>> xp = fetch("userXp", () -> userXpRepository.findById(userId), Optional.empty());
        CompletableFuture<Map<ContentKind, Long>> completed = fetch("completedByKind", () -> {
            Map<ContentKind, Long> counts = new EnumMap<>(ContentKind.class);
            for (ContentKind kind : ContentKind.values()) {
                counts.put(kind, userProgressRepository.countByUserIdAndContentKindAndStatus(userId, kind, ProgressStatus.COMPLETED));
            }
            return counts;
        }, Map.of());
        CompletableFuture<Long> certificates = fetch("userCertificates",
                () -> certificateRepository.countByUserIdAndStatus(userId, CertificateStatus.ISSUED), 0L);
        CompletableFuture<Long> studyMinutes = fetch("studyMinutes",
                () -> userProgressRepository.sumTimeSpentMinutes(userId), 0L);

        CompletableFuture.allOf(xp, completed, certificates, studyMinutes).join();

        Optional<UserXp> aggregate = xp.join();
        return new UserLearningStatsDto(
                userId,
                aggregate.map(UserXp::getTotalXp).orElse(0),
                aggregate.map(UserXp::getCurrentLevel).orElse(1),
                aggregate.map(UserXp::getLevelTitle).orElse(null),
                completed.join(),
                certificates.join(),
                aggregate.map(UserXp::getCurrentStreak).orElse(0),
                aggregate.map(UserXp::getLongestStreak).orElse(0),
                studyMinutes.join()
        );
    }

    private <T> CompletableFuture<T> fetch(String field, Supplier<T> query, T fallback) {
        return CompletableFuture.supplyAsync(query, analyticsExecutor)
                .exceptionally(ex -> {
                    log.warn("Analytics query '{}' failed, using default: {}", field, rootMessage(ex));
                    return fallback;
                });
    }

    private Map<ContentKind, ContentCountDto> countContent() {
        Map<ContentKind, ContentCountDto> counts = new EnumMap<>(ContentKind.class);
        for (ContentKind kind : ContentKind.values()) {
            ContentNodeRepository<ContentNode> repository = registry.repository(kind);
            long published = repository.count(QuerySpec.builder().eq("status", ContentStatus.PUBLISHED).build());
            counts.put(kind, new ContentCountDto(repository.count(), published));
        }
        return counts;
    }

    private List<TopPerformerDto> topPerformers() {
        List<UserXp> top = userXpRepository.findAllByOrderByTotalXpDesc(
                PageRequest.of(0, analyticsProperties.getTopPerformersLimit()));
        Map<UUID, String> names = userProfileRepository
                .findAllByIdIn(top.stream().map(UserXp::getUserId).toList()).stream()
                .filter(profile -> profile.getDisplayName() != null)
                .collect(Collectors.toMap(UserProfile::getId, UserProfile::getDisplayName));
        return top.stream()
                .map(xp -> new TopPerformerDto(xp.getUserId(), names.get(xp.getUserId()), xp.getTotalXp(),
                        xp.getCurrentLevel(), xp.getLevelTitle()))
                .toList();
    }

    private List<PathEnrollmentDto> pathEnrollments() {
        Map<UUID, Long> learners = userProgressRepository.countLearnersPerPath().stream()
                .collect(Collectors.toMap(UserProgressRepository.PathLearnerCount::getPathId,
                        UserProgressRepository.PathLearnerCount::getLearners));
        Map<UUID, Long> completed = certificateRepository.countIssuedByContent(ContentKind.PATH).stream()
                .collect(Collectors.toMap(CertificateRepository.ContentCertificateCount::getContentId,
                        CertificateRepository.ContentCertificateCount::getIssued));
        List<ContentNode> paths = registry.repository(ContentKind.PATH)
                .select(QuerySpec.builder().eq("status", ContentStatus.PUBLISHED).orderBy("sortOrder", true).build());
        return paths.stream()
                .map(path -> new PathEnrollmentDto(path.getId(), path.getTitle(),
                        learners.getOrDefault(path.getId(), 0L), completed.getOrDefault(path.getId(), 0L)))
                .toList();
    }

    private static Map<ContentKind, ContentCountDto> emptyContentCounts() {
        return Arrays.stream(ContentKind.values())
                .collect(Collectors.toMap(Function.identity(), kind -> ContentCountDto.EMPTY,
                        (a, b) -> a, () -> new EnumMap<>(ContentKind.class)));
    }

    private static String rootMessage(Throwable ex) {
        Throwable cause = ex;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }
}
