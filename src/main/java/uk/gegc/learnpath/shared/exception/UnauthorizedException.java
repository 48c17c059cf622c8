package uk.gegc.learnpath.shared.exception;

/**
 * No authenticated user could be resolved for an operation that requires one.
 */
public class UnauthorizedException extends RuntimeException {

    public UnauthorizedException(String message) {
        super(message);
    }
}
