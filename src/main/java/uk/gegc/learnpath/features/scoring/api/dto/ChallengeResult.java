package uk.gegc.learnpath.features.scoring.api.dto;

import java.util.List;
import java.util.UUID;

/**
 * @param xpAwarded         XP the score is worth under the reward policy
 * @param xpGained          XP actually added to the user's total; 0 when an earlier attempt earned as much
 * @param attemptsRemaining null when the challenge allows unlimited attempts
 */
public record ChallengeResult(
        UUID challengeId,
        int score,
        int correctCount,
        int totalQuestions,
        int xpAwarded,
        int xpGained,
        boolean passed,
        List<QuestionResultDto> questions,
        int attemptsUsed,
        Integer attemptsRemaining,
        boolean canRetake
) {
}
