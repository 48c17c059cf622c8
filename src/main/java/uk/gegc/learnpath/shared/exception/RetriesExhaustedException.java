package uk.gegc.learnpath.shared.exception;

public class RetriesExhaustedException extends RuntimeException {

    private final int attempts;

    public RetriesExhaustedException(String message, int attempts) {
        super(message);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
