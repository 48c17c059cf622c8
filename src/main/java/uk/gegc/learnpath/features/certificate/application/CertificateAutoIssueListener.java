package uk.gegc.learnpath.features.certificate.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import uk.gegc.learnpath.features.certificate.config.CertificateProperties;
import uk.gegc.learnpath.features.content.domain.model.ContentKind;
import uk.gegc.learnpath.features.content.domain.model.ContentNode;
import uk.gegc.learnpath.features.content.infra.registry.ContentNodeRegistry;
import uk.gegc.learnpath.features.progress.domain.event.ContentCompletedEvent;
import uk.gegc.learnpath.shared.exception.ConflictException;

import java.util.UUID;

/**
 * Awards course and path certificates once the completing transaction has committed.
 * Failures are logged and never reach the learner's request.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CertificateAutoIssueListener {

    private final CertificateService certificateService;
    private final ContentNodeRegistry registry;
    private final CertificateProperties properties;

    @Async("generalTaskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onContentCompleted(ContentCompletedEvent event) {
        if (!properties.isAutoIssue()) {
            return;
        }
        try {
            UUID courseId = ancestorId(event.getContentKind(), event.getContentId(), ContentKind.COURSE);
            if (courseId == null) {
                return;
            }
            certificateService.awardIfCompleted(event.getUserId(), courseId, ContentKind.COURSE);

            UUID pathId = ancestorId(ContentKind.COURSE, courseId, ContentKind.PATH);
            if (pathId != null) {
                certificateService.awardIfCompleted(event.getUserId(), pathId, ContentKind.PATH);
            }
        } catch (ConflictException e) {
            log.debug("Certificate for user {} was already awarded by a concurrent completion: {}",
                    event.getUserId(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Automatic certificate issuance failed for user {} after completing {} {}",
                    event.getUserId(), event.getContentKind().getKey(), event.getContentId(), e);
        }
    }

    /**
     * Walks parent links from {@code kind} up to {@code target}; null when a link is missing.
     */
    UUID ancestorId(ContentKind kind, UUID id, ContentKind target) {
        ContentKind currentKind = kind;
        UUID currentId = id;
        while (currentKind != target) {
            if (currentKind.isRoot() || currentId == null) {
                return null;
            }
            currentId = registry.find(currentKind, currentId)
                    .map(ContentNode::getParentId)
                    .orElse(null);
            currentKind = currentKind.parent();
        }
        return currentId;
    }
}
