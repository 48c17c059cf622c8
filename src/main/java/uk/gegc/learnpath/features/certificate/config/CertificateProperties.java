package uk.gegc.learnpath.features.certificate.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "learnpath.certificates")
public class CertificateProperties {

    /**
     * Store lookups allowed while searching for an unused verification code.
     */
    private int codeGenerationAttempts = 10;

    /**
     * Issue certificates automatically when a learner finishes the last lesson of a course or path.
     */
    private boolean autoIssue = true;
}
