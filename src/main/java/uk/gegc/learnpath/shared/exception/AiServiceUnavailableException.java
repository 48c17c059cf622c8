package uk.gegc.learnpath.shared.exception;

/**
 * The authoring assistant is switched off for this deployment.
 */
public class AiServiceUnavailableException extends RuntimeException {

    public AiServiceUnavailableException(String message) {
        super(message);
    }
}
