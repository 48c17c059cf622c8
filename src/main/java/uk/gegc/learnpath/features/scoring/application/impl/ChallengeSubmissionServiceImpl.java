package uk.gegc.learnpath.features.scoring.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.learnpath.features.content.domain.model.Challenge;
import uk.gegc.learnpath.features.content.domain.model.ContentKind;
import uk.gegc.learnpath.features.content.domain.repository.ChallengeRepository;
import uk.gegc.learnpath.features.progress.api.dto.ProgressResult;
import uk.gegc.learnpath.features.progress.api.dto.ProgressUpdate;
import uk.gegc.learnpath.features.progress.application.ProgressService;
import uk.gegc.learnpath.features.progress.domain.model.ProgressStatus;
import uk.gegc.learnpath.features.progress.domain.model.UserProgress;
import uk.gegc.learnpath.features.progress.domain.repository.UserProgressRepository;
import uk.gegc.learnpath.features.scoring.api.dto.ChallengeResult;
import uk.gegc.learnpath.features.scoring.api.dto.ChallengeSubmissionRequest;
import uk.gegc.learnpath.features.scoring.api.dto.QuestionResultDto;
import uk.gegc.learnpath.features.scoring.application.ChallengeScoringService;
import uk.gegc.learnpath.features.scoring.application.ChallengeSubmissionService;
import uk.gegc.learnpath.features.scoring.application.XpRewardPolicy;
import uk.gegc.learnpath.features.scoring.domain.model.ScoreOutcome;
import uk.gegc.learnpath.shared.exception.ConflictException;
import uk.gegc.learnpath.shared.exception.ResourceNotFoundException;
import uk.gegc.learnpath.shared.security.AccessPolicy;
import uk.gegc.learnpath.shared.security.CurrentUser;
import uk.gegc.learnpath.shared.security.CurrentUserResolver;
import uk.gegc.learnpath.shared.security.PermissionName;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Grading runs outside any transaction since open-text questions may call the scoring model;
 * only the progress write is transactional.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChallengeSubmissionServiceImpl implements ChallengeSubmissionService {

    public static final int PASS_THRESHOLD = 70;

    private final ChallengeRepository challengeRepository;
    private final UserProgressRepository userProgressRepository;
    private final ChallengeScoringService scoringService;
    private final ProgressService progressService;
    private final CurrentUserResolver currentUserResolver;
    private final AccessPolicy accessPolicy;

    @Override
    public ChallengeResult submit(UUID challengeId, ChallengeSubmissionRequest request) {
        CurrentUser user = currentUserResolver.requireCurrentUser();
        accessPolicy.requireAny(user, PermissionName.PROGRESS_UPDATE);

        Challenge challenge = challengeRepository.findById(challengeId)
                .orElseThrow(() -> new ResourceNotFoundException("Challenge", challengeId));
        if (!challenge.isPublished()) {
            throw new ConflictException("Challenge " + challengeId + " is not published");
        }

        int attemptsUsed = userProgressRepository
                .findByUserIdAndContentIdAndContentKind(user.id(), challengeId, ContentKind.CHALLENGE)
                .map(UserProgress::getAttempts)
                .orElse(0);
        Integer maxAttempts = challenge.getMaxAttempts();
        if (maxAttempts != null && attemptsUsed >= maxAttempts) {
            throw new ConflictException("Maximum attempts (" + maxAttempts + ") reached for challenge " + challengeId);
        }

        ScoreOutcome outcome = scoringService.score(challenge, request.answers());
        int baseReward = Objects.requireNonNullElse(challenge.getXpReward(), Challenge.DEFAULT_XP_REWARD);
        int xpAwarded = XpRewardPolicy.award(outcome.score(), baseReward);
        boolean passed = outcome.score() >= PASS_THRESHOLD;

        ProgressResult progress = progressService.recordProgress(user.id(), challengeId, ContentKind.CHALLENGE,
                new ProgressUpdate(
                        passed ? ProgressStatus.COMPLETED : ProgressStatus.IN_PROGRESS,
                        outcome.score(),
                        xpAwarded,
                        outcome.score(),
                        request.timeSpentMinutes(),
                        true
                ));

        int used = progress.progress().attempts();
        Integer remaining = maxAttempts == null ? null : Math.max(0, maxAttempts - used);
        log.info("User {} scored {} on challenge {} (attempt {}, +{} XP)",
                user.id(), outcome.score(), challengeId, used, progress.xpDelta());

        return new ChallengeResult(
                challengeId,
                outcome.score(),
                outcome.correctCount(),
                outcome.totalQuestions(),
                xpAwarded,
                progress.xpDelta(),
                passed,
                toQuestionResults(outcome),
                used,
                remaining,
                remaining == null || remaining > 0
        );
    }

    private static List<QuestionResultDto> toQuestionResults(ScoreOutcome outcome) {
        return outcome.questions().stream()
                .map(q -> new QuestionResultDto(q.index(), q.type(), q.grade().correct(),
                        q.grade().oracleScore(), q.grade().degraded()))
                .toList();
    }
}
