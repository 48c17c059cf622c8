package uk.gegc.learnpath.features.progress.api.dto;

/**
 * @param xpDelta        XP added to the user's total by this write
 * @param newlyCompleted whether this write moved the item to completed for the first time
 */
public record ProgressResult(UserProgressDto progress, int xpDelta, boolean newlyCompleted) {
}
