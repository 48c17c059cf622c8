package uk.gegc.learnpath.features.certificate.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.learnpath.features.content.domain.model.ContentKind;
import uk.gegc.learnpath.features.content.domain.model.ContentNode;
import uk.gegc.learnpath.features.content.domain.model.ContentStatus;
import uk.gegc.learnpath.features.content.infra.registry.ContentNodeRegistry;
import uk.gegc.learnpath.features.progress.domain.model.ProgressStatus;
import uk.gegc.learnpath.features.progress.domain.repository.UserProgressRepository;
import uk.gegc.learnpath.shared.exception.ValidationException;
import uk.gegc.learnpath.shared.query.QuerySpec;

import java.util.List;
import java.util.UUID;

/**
 * Decides whether a learner has finished a path or course. Only published children count,
 * and a node with no published children at any level below it is never complete.
 */
@Component
@RequiredArgsConstructor
public class CompletionChecker {

    private final ContentNodeRegistry registry;
    private final UserProgressRepository userProgressRepository;

    public boolean isCompleted(UUID userId, UUID contentId, ContentKind kind) {
        if (kind != ContentKind.PATH && kind != ContentKind.COURSE && kind != ContentKind.MODULE) {
            throw new ValidationException("Completion is tracked for paths, courses and modules only");
        }
        return isNodeCompleted(userId, contentId, kind);
    }

    private boolean isNodeCompleted(UUID userId, UUID nodeId, ContentKind kind) {
        ContentKind childKind = kind.child();
        List<UUID> childIds = publishedChildren(childKind, nodeId);
        if (childIds.isEmpty()) {
            return false;
        }
        if (childKind == ContentKind.LESSON) {
            long completed = userProgressRepository.countByUserIdAndContentKindAndStatusAndContentIdIn(
                    userId, ContentKind.LESSON, ProgressStatus.COMPLETED, childIds);
            return completed == childIds.size();
        }
        for (UUID childId : childIds) {
            if (!isNodeCompleted(userId, childId, childKind)) {
                return false;
            }
        }
        return true;
    }

    private List<UUID> publishedChildren(ContentKind childKind, UUID parentId) {
        QuerySpec spec = QuerySpec.builder()
                .eq(childKind.getParentAttribute(), parentId)
                .eq("status", ContentStatus.PUBLISHED)
                .build();
        return registry.repository(childKind).select(spec).stream()
                .map(ContentNode::getId)
                .toList();
    }
}
