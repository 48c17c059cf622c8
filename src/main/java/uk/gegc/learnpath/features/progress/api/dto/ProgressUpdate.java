package uk.gegc.learnpath.features.progress.api.dto;

import uk.gegc.learnpath.features.progress.domain.model.ProgressStatus;

/**
 * Upsert payload. Null fields leave the stored value untouched.
 *
 * @param timeSpentMinutes minutes to add to the stored total
 */
public record ProgressUpdate(
        ProgressStatus status,
        Integer completionPercentage,
        Integer xpEarned,
        Integer score,
        Integer timeSpentMinutes,
        boolean incrementAttempts
) {

    public static ProgressUpdate completed(int xp) {
        return new ProgressUpdate(ProgressStatus.COMPLETED, 100, xp, null, null, false);
    }
}
