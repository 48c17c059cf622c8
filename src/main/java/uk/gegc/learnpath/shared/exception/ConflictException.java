package uk.gegc.learnpath.shared.exception;

/**
 * Raised when a write collides with existing state, e.g. a duplicate slug among siblings
 * or a retake after the attempt limit has been reached.
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
