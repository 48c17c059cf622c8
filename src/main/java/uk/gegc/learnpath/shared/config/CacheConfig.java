package uk.gegc.learnpath.shared.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.gegc.learnpath.shared.cache.TtlCache;

import java.time.Clock;

@Configuration
public class CacheConfig {

    @Bean
    public TtlCache ttlCache(Clock clock) {
        return new TtlCache(clock);
    }
}
