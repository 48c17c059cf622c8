package uk.gegc.learnpath.shared.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Retry and backoff settings for calls to the scoring model.
 */
@Component
@ConfigurationProperties(prefix = "ai.rate-limit")
@Data
public class AiRateLimitConfig {

    /**
     * Maximum number of attempts per grading call
     */
    private int maxRetries = 3;

    /**
     * Base delay in milliseconds for exponential backoff
     */
    private long baseDelayMs = 500;

    /**
     * Cap for exponential backoff
     */
    private long maxDelayMs = 10000;

    /**
     * Jitter factor for backoff calculation (0.0 = no jitter, 0.5 = ±50% variation)
     */
    private double jitterFactor = 0.25;
}
