package uk.gegc.learnpath.features.progress.domain.event;

import org.springframework.context.ApplicationEvent;
import uk.gegc.learnpath.features.content.domain.model.ContentKind;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a user completes a lesson or challenge for the first time.
 * Listeners use it to award certificates for enclosing courses and paths.
 */
public class ContentCompletedEvent extends ApplicationEvent {

    private final UUID userId;
    private final UUID contentId;
    private final ContentKind contentKind;
    private final Instant completedAt;

    public ContentCompletedEvent(Object source, UUID userId, UUID contentId, ContentKind contentKind, Instant completedAt) {
        super(source);
        this.userId = userId;
        this.contentId = contentId;
        this.contentKind = contentKind;
        this.completedAt = completedAt;
    }

    public UUID getUserId() {
        return userId;
    }

    public UUID getContentId() {
        return contentId;
    }

    public ContentKind getContentKind() {
        return contentKind;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }
}
