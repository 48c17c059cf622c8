package uk.gegc.learnpath.features.progress.application;

import uk.gegc.learnpath.features.content.domain.model.ContentKind;
import uk.gegc.learnpath.features.progress.api.dto.*;

import java.util.List;
import java.util.UUID;

public interface ProgressService {

    /**
     * @param contentId restricts the result to one item when not null
     */
    List<UserProgressDto> getUserProgress(UUID userId, UUID contentId);

    /**
     * Upserts the progress row and updates the user's XP aggregate in the same transaction.
     * XP per item never decreases and a completed item never reverts.
     */
    ProgressResult recordProgress(UUID userId, UUID contentId, ContentKind kind, ProgressUpdate update);

    ProgressResult completeLesson(UUID userId, UUID lessonId);

    UserXpDto getUserXp(UUID userId);

    List<XpLevelDto> getXpLevels();
}
