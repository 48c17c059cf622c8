package uk.gegc.learnpath.shared.exception;

/**
 * Exception thrown when the backing store or the scoring oracle fails
 */
public class UpstreamServiceException extends RuntimeException {

    public UpstreamServiceException(String message) {
        super(message);
    }

    public UpstreamServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
