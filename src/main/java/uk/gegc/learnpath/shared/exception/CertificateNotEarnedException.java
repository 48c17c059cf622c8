package uk.gegc.learnpath.shared.exception;

import java.util.UUID;

/**
 * Raised when a certificate is requested for content the learner has not completed.
 */
public class CertificateNotEarnedException extends RuntimeException {

    public CertificateNotEarnedException(UUID userId, String kind, UUID contentId) {
        super(String.format("User %s has not completed %s %s", userId, kind, contentId));
    }
}
