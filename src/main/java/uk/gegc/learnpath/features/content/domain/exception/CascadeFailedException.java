package uk.gegc.learnpath.features.content.domain.exception;

import uk.gegc.learnpath.features.content.application.CascadeResult;
import uk.gegc.learnpath.features.content.domain.model.ContentKind;
import uk.gegc.learnpath.shared.exception.UpstreamServiceException;

/**
 * A status cascade stopped at {@code failedLevel}. {@code partialResult} lists the nodes of the
 * shallower levels that were already rewritten and stay committed.
 */
public class CascadeFailedException extends UpstreamServiceException {

    private final ContentKind failedLevel;
    private final CascadeResult partialResult;

    public CascadeFailedException(ContentKind failedLevel, CascadeResult partialResult, Throwable cause) {
        super("Status cascade failed at level '" + failedLevel.getKey() + "'; shallower levels were already updated", cause);
        this.failedLevel = failedLevel;
        this.partialResult = partialResult;
    }

    public ContentKind getFailedLevel() {
        return failedLevel;
    }

    public CascadeResult getPartialResult() {
        return partialResult;
    }
}
