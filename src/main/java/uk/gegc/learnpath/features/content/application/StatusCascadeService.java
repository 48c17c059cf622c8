package uk.gegc.learnpath.features.content.application;

import uk.gegc.learnpath.features.content.domain.model.ContentKind;
import uk.gegc.learnpath.features.content.domain.model.ContentStatus;

import java.util.UUID;

public interface StatusCascadeService {

    /**
     * Applies {@code targetStatus} to every descendant of the node, level by level.
     * Only {@link ContentStatus#DRAFT} and {@link ContentStatus#ARCHIVED} are accepted.
     * Levels already processed stay committed if a deeper level fails.
     *
     * @param actorId stamped as {@code updatedBy} on rewritten nodes, may be null for system runs
     */
    CascadeResult cascade(UUID nodeId, ContentKind nodeKind, ContentStatus targetStatus, UUID actorId);
}
