package uk.gegc.learnpath.features.certificate.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.learnpath.features.certificate.config.CertificateProperties;
import uk.gegc.learnpath.shared.exception.RetriesExhaustedException;

import java.security.SecureRandom;
import java.util.function.Predicate;

/**
 * Produces public verification codes of the form {@code XXX-XXX-XXX-XXX}
 * from uppercase letters and digits.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VerificationCodeGenerator {

    static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    static final int GROUPS = 4;
    static final int GROUP_LENGTH = 3;

    private static final SecureRandom RNG = new SecureRandom();

    private final CertificateProperties properties;

    /**
     * @param isTaken store lookup; called once per candidate
     * @throws RetriesExhaustedException when every candidate collided
     */
    public String generateUnique(Predicate<String> isTaken) {
        int attempts = Math.max(1, properties.getCodeGenerationAttempts());
        for (int attempt = 1; attempt <= attempts; attempt++) {
            String candidate = newCode();
            if (!isTaken.test(candidate)) {
                return candidate;
            }
            log.warn("Verification code collision on attempt {} of {}", attempt, attempts);
        }
        throw new RetriesExhaustedException("Could not generate a unique verification code", attempts);
    }

    public String newCode() {
        StringBuilder code = new StringBuilder(GROUPS * (GROUP_LENGTH + 1) - 1);
        for (int group = 0; group < GROUPS; group++) {
            if (group > 0) {
                code.append('-');
            }
            for (int i = 0; i < GROUP_LENGTH; i++) {
                code.append(ALPHABET.charAt(RNG.nextInt(ALPHABET.length())));
            }
        }
        return code.toString();
    }
}
