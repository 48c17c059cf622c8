package uk.gegc.learnpath.shared.cache;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Time-to-live per data volatility class.
 */
@Data
@Component
@ConfigurationProperties(prefix = "learnpath.cache")
public class CacheProperties {

    /**
     * Learning content (paths, courses, modules, lessons, challenges).
     */
    private Duration contentTtl = Duration.ofMinutes(2);

    /**
     * Per-user progress, XP aggregates and personal stats.
     */
    private Duration progressTtl = Duration.ofMinutes(1);

    /**
     * Platform-wide analytics rollups.
     */
    private Duration statsTtl = Duration.ofMinutes(5);

    /**
     * XP level table.
     */
    private Duration levelsTtl = Duration.ofHours(1);

    /**
     * Certificate lists and verification lookups.
     */
    private Duration certificateTtl = Duration.ofMinutes(2);
}
