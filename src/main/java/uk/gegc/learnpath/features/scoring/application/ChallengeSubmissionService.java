package uk.gegc.learnpath.features.scoring.application;

import uk.gegc.learnpath.features.scoring.api.dto.ChallengeResult;
import uk.gegc.learnpath.features.scoring.api.dto.ChallengeSubmissionRequest;

import java.util.UUID;

public interface ChallengeSubmissionService {

    /**
     * Grades the current user's answers and records the attempt.
     *
     * @throws uk.gegc.learnpath.shared.exception.ConflictException when no attempts remain or the challenge is not published
     */
    ChallengeResult submit(UUID challengeId, ChallengeSubmissionRequest request);
}
