package uk.gegc.learnpath.features.ai.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "learnpath.ai.authoring")
public class AuthoringProperties {

    /**
     * When false every authoring call fails fast with 503 instead of reaching the model.
     */
    private boolean enabled = true;

    /**
     * Longest text, in characters, accepted as input to a single call.
     */
    private int maxInputLength = 20000;

    /**
     * Summary length used when the caller does not ask for one.
     */
    private int defaultSummaryLength = 200;

    /**
     * Characters of the body sent along with the title when writing a meta description.
     */
    private int metaDescriptionExcerptLength = 500;
}
