package uk.gegc.learnpath.features.progress.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.learnpath.features.content.domain.model.ContentKind;
import uk.gegc.learnpath.features.content.domain.model.Lesson;
import uk.gegc.learnpath.features.content.domain.repository.LessonRepository;
import uk.gegc.learnpath.features.progress.api.dto.*;
import uk.gegc.learnpath.features.progress.application.LevelCalculator;
import uk.gegc.learnpath.features.progress.application.ProgressService;
import uk.gegc.learnpath.features.progress.application.StreakCalculator;
import uk.gegc.learnpath.features.progress.domain.event.ContentCompletedEvent;
import uk.gegc.learnpath.features.progress.domain.model.ProgressStatus;
import uk.gegc.learnpath.features.progress.domain.model.UserProgress;
import uk.gegc.learnpath.features.progress.domain.model.UserXp;
import uk.gegc.learnpath.features.progress.domain.model.XpLevel;
import uk.gegc.learnpath.features.progress.domain.repository.UserProgressRepository;
import uk.gegc.learnpath.features.progress.domain.repository.UserXpRepository;
import uk.gegc.learnpath.features.progress.domain.repository.XpLevelRepository;
import uk.gegc.learnpath.shared.cache.CacheInvalidator;
import uk.gegc.learnpath.shared.cache.CacheKeys;
import uk.gegc.learnpath.shared.cache.CacheProperties;
import uk.gegc.learnpath.shared.cache.TtlCache;
import uk.gegc.learnpath.shared.exception.ConflictException;
import uk.gegc.learnpath.shared.exception.ResourceNotFoundException;
import uk.gegc.learnpath.shared.exception.ValidationException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class ProgressServiceImpl implements ProgressService {

    private final UserProgressRepository userProgressRepository;
    private final UserXpRepository userXpRepository;
    private final XpLevelRepository xpLevelRepository;
    private final LessonRepository lessonRepository;
    private final TtlCache cache;
    private final CacheProperties cacheProperties;
    private final CacheInvalidator cacheInvalidator;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Override
    public List<UserProgressDto> getUserProgress(UUID userId, UUID contentId) {
        return cache.getOrLoad(CacheKeys.userProgress(userId, contentId), () -> {
            List<UserProgress> rows = contentId == null
                    ? userProgressRepository.findAllByUserIdOrderByLastAccessedAtDesc(userId)
                    : userProgressRepository.findAllByUserIdAndContentId(userId, contentId);
            return rows.stream().map(ProgressServiceImpl::toDto).toList();
        }, cacheProperties.getProgressTtl());
    }

    @Override
    @Transactional
    public ProgressResult recordProgress(UUID userId, UUID contentId, ContentKind kind, ProgressUpdate update) {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(contentId, "contentId");
        Objects.requireNonNull(kind, "kind");
        validate(update);

        Instant now = clock.instant();
        UserProgress progress = userProgressRepository
                .findByUserIdAndContentIdAndContentKind(userId, contentId, kind)
                .orElseGet(() -> newProgress(userId, contentId, kind));

        if (progress.getStartedAt() == null) {
            progress.setStartedAt(now);
        }
        progress.setLastAccessedAt(now);

        int previousXp = progress.getXpEarned();
        if (update.xpEarned() != null) {
            progress.setXpEarned(Math.max(previousXp, update.xpEarned()));
        }
        if (update.completionPercentage() != null) {
            progress.setCompletionPercentage(Math.max(progress.getCompletionPercentage(), update.completionPercentage()));
        }
        if (update.score() != null) {
            progress.setScore(update.score());
        }
        if (update.timeSpentMinutes() != null) {
            progress.setTimeSpentMinutes(progress.getTimeSpentMinutes() + update.timeSpentMinutes());
        }
        if (update.incrementAttempts()) {
            progress.setAttempts(progress.getAttempts() + 1);
        }

        boolean newlyCompleted = false;
        if (update.status() != null && progress.getStatus() != ProgressStatus.COMPLETED) {
            progress.setStatus(update.status());
            if (update.status() == ProgressStatus.COMPLETED) {
                progress.setCompletedAt(now);
                progress.setCompletionPercentage(100);
                newlyCompleted = true;
            }
        }

        UserProgress saved = userProgressRepository.save(progress);
        int xpDelta = saved.getXpEarned() - previousXp;
        applyToAggregate(userId, xpDelta, LocalDate.now(clock));

        cacheInvalidator.invalidateAfterCommit(
                CacheKeys.userProgressPrefix(userId),
                CacheKeys.userXp(userId),
                CacheKeys.userStats(userId),
                CacheKeys.STATS
        );
        if (newlyCompleted) {
            log.info("User {} completed {} {} (+{} XP)", userId, kind.getKey(), contentId, xpDelta);
            if (kind == ContentKind.LESSON || kind == ContentKind.CHALLENGE) {
                eventPublisher.publishEvent(new ContentCompletedEvent(this, userId, contentId, kind, saved.getCompletedAt()));
            }
        }
        return new ProgressResult(toDto(saved), xpDelta, newlyCompleted);
    }

    @Override
    @Transactional
    public ProgressResult completeLesson(UUID userId, UUID lessonId) {
        Lesson lesson = lessonRepository.findById(lessonId)
                .orElseThrow(() -> new ResourceNotFoundException("Lesson", lessonId));
        if (!lesson.isPublished()) {
            throw new ConflictException("Lesson " + lessonId + " is not published");
        }

        return recordProgress(userId, lessonId, ContentKind.LESSON,
                ProgressUpdate.completed(Objects.requireNonNullElse(lesson.getXpReward(), Lesson.DEFAULT_XP_REWARD)));
    }

    @Override
    public UserXpDto getUserXp(UUID userId) {
        return cache.getOrLoad(CacheKeys.userXp(userId), () -> {
            List<XpLevel> levels = xpLevelRepository.findAllByOrderByXpRequiredAsc();
            return userXpRepository.findById(userId)
                    .map(xp -> toDto(xp, levels))
                    .orElseGet(() -> emptyAggregate(userId, levels));
        }, cacheProperties.getProgressTtl());
    }

    @Override
    public List<XpLevelDto> getXpLevels() {
        return cache.getOrLoad(CacheKeys.XP_LEVELS, () -> xpLevelRepository.findAllByOrderByXpRequiredAsc().stream()
                .map(level -> new XpLevelDto(level.getLevelId(), level.getTitle(), level.getXpRequired(),
                        level.getBadgeIcon(), level.getBadgeColor()))
                .toList(), cacheProperties.getLevelsTtl());
    }

    private void applyToAggregate(UUID userId, int xpDelta, LocalDate today) {
        UserXp xp = userXpRepository.findById(userId).orElseGet(() -> {
            UserXp created = new UserXp();
            created.setUserId(userId);
            return created;
        });

        xp.setTotalXp(xp.getTotalXp() + Math.max(0, xpDelta));
        LevelCalculator.LevelInfo level = LevelCalculator.resolve(xpLevelRepository.findAllByOrderByXpRequiredAsc(), xp.getTotalXp());
        if (level.level() > xp.getCurrentLevel()) {
            log.info("User {} reached level {} ({})", userId, level.level(), level.title());
        }
        xp.setCurrentLevel(level.level());
        xp.setLevelTitle(level.title());

        StreakCalculator.Streak streak = StreakCalculator.next(
                new StreakCalculator.Streak(xp.getCurrentStreak(), xp.getLongestStreak()),
                xp.getLastActivityDate(),
                today);
        xp.setCurrentStreak(streak.current());
        xp.setLongestStreak(streak.longest());
        if (xp.getLastActivityDate() == null || today.isAfter(xp.getLastActivityDate())) {
            xp.setLastActivityDate(today);
        }
        userXpRepository.save(xp);
    }

    private static void validate(ProgressUpdate update) {
        if (update == null) {
            throw new ValidationException("Progress update is required");
        }
        if (update.completionPercentage() != null
                && (update.completionPercentage() < 0 || update.completionPercentage() > 100)) {
            throw new ValidationException("Completion percentage must be between 0 and 100");
        }
        if (update.xpEarned() != null && update.xpEarned() < 0) {
            throw new ValidationException("XP earned must not be negative");
        }
        if (update.score() != null && (update.score() < 0 || update.score() > 100)) {
            throw new ValidationException("Score must be between 0 and 100");
        }
        if (update.timeSpentMinutes() != null && update.timeSpentMinutes() < 0) {
            throw new ValidationException("Time spent must not be negative");
        }
    }

    private static UserProgress newProgress(UUID userId, UUID contentId, ContentKind kind) {
        UserProgress progress = new UserProgress();
        progress.setUserId(userId);
        progress.setContentId(contentId);
        progress.setContentKind(kind);
        progress.setStatus(ProgressStatus.IN_PROGRESS);
        return progress;
    }

    private static UserXpDto emptyAggregate(UUID userId, List<XpLevel> levels) {
        LevelCalculator.LevelInfo level = LevelCalculator.resolve(levels, 0);
        return new UserXpDto(userId, 0, level.level(), level.title(), nextLevelXp(levels, 0), 0, 0, null);
    }

    private static UserXpDto toDto(UserXp xp, List<XpLevel> levels) {
        return new UserXpDto(
                xp.getUserId(),
                xp.getTotalXp(),
                xp.getCurrentLevel(),
                xp.getLevelTitle(),
                nextLevelXp(levels, xp.getTotalXp()),
                xp.getCurrentStreak(),
                xp.getLongestStreak(),
                xp.getLastActivityDate()
        );
    }

    private static Integer nextLevelXp(List<XpLevel> levels, int totalXp) {
        return levels.stream()
                .map(XpLevel::getXpRequired)
                .filter(required -> required > totalXp)
                .findFirst()
                .orElse(null);
    }

    static UserProgressDto toDto(UserProgress progress) {
        return new UserProgressDto(
                progress.getId(),
                progress.getUserId(),
                progress.getContentId(),
                progress.getContentKind(),
                progress.getStatus(),
                progress.getCompletionPercentage(),
                progress.getXpEarned(),
                progress.getAttempts(),
                progress.getScore(),
                progress.getTimeSpentMinutes(),
                progress.getStartedAt(),
                progress.getCompletedAt(),
                progress.getLastAccessedAt()
        );
    }
}
