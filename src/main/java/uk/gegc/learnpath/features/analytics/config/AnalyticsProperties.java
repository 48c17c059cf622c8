package uk.gegc.learnpath.features.analytics.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Rollup sizes. Pool sizes under the same prefix are read by {@code AsyncConfig}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "learnpath.analytics")
public class AnalyticsProperties {

    private int topPerformersLimit = 10;

    private int recentCompletionsLimit = 20;

    /**
     * Window for counting a user as active.
     */
    private Duration activeWindow = Duration.ofDays(30);
}
