package uk.gegc.learnpath.shared.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.parallel.Execution;
import org.junit.jupiter.api.parallel.ExecutionMode;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Execution(ExecutionMode.CONCURRENT)
@DisplayName("TtlCache Tests")
class TtlCacheTest {

    private MutableClock clock;
    private TtlCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T10:00:00Z"));
        cache = new TtlCache(clock);
    }

    @Nested
    @DisplayName("getOrLoad")
    class GetOrLoad {

        @Test
        @DisplayName("two reads within ttl invoke the loader once")
        void withinTtl_loaderCalledOnce() {
            AtomicInteger calls = new AtomicInteger();

            String first = cache.getOrLoad("k", () -> "v" + calls.incrementAndGet(), Duration.ofMinutes(2));
            clock.advance(Duration.ofSeconds(119));
            String second = cache.getOrLoad("k", () -> "v" + calls.incrementAndGet(), Duration.ofMinutes(2));

            assertThat(first).isEqualTo("v1");
            assertThat(second).isEqualTo("v1");
            assertThat(calls).hasValue(1);
        }

        @Test
        @DisplayName("an entry expires exactly at storedAt + ttl")
        void atTtl_reloads() {
            AtomicInteger calls = new AtomicInteger();
            cache.getOrLoad("k", calls::incrementAndGet, Duration.ofMinutes(1));

            clock.advance(Duration.ofMinutes(1));
            Integer reloaded = cache.getOrLoad("k", calls::incrementAndGet, Duration.ofMinutes(1));

            assertThat(reloaded).isEqualTo(2);
        }

        @Test
        @DisplayName("failing reload with an existing entry returns the stale value")
        void failingReload_returnsStale() {
            cache.getOrLoad("k", () -> "stale", Duration.ofSeconds(1));
            clock.advance(Duration.ofMinutes(10));

            String value = cache.getOrLoad("k", () -> {
                throw new IllegalStateException("store down");
            }, Duration.ofSeconds(1));

            assertThat(value).isEqualTo("stale");
        }

        @Test
        @DisplayName("failing load without an entry propagates the error")
        void failingLoad_noEntry_propagates() {
            assertThatThrownBy(() -> cache.getOrLoad("k", () -> {
                throw new IllegalStateException("store down");
            }, Duration.ofSeconds(1)))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("store down");
            assertThat(cache.stats().size()).isZero();
        }
    }

    @Nested
    @DisplayName("invalidate")
    class Invalidate {

        @Test
        @DisplayName("pattern removes every key containing it")
        void pattern_removesMatchingKeys() {
            cache.getOrLoad("user_progress_1_all", () -> 1, Duration.ofMinutes(1));
            cache.getOrLoad("user_progress_1_abc", () -> 2, Duration.ofMinutes(1));
            cache.getOrLoad("user_xp_1", () -> 3, Duration.ofMinutes(1));

            int removed = cache.invalidate("user_progress_1");

            assertThat(removed).isEqualTo(2);
            assertThat(cache.stats().keys()).containsExactly("user_xp_1");
        }

        @Test
        @DisplayName("no pattern clears everything")
        void noPattern_clearsAll() {
            cache.getOrLoad("a", () -> 1, Duration.ofMinutes(1));
            cache.getOrLoad("b", () -> 2, Duration.ofMinutes(1));

            assertThat(cache.invalidate(null)).isEqualTo(2);
            assertThat(cache.stats().size()).isZero();
        }

        @Test
        @DisplayName("stats lists keys sorted")
        void stats_sortedKeys() {
            cache.getOrLoad("b", () -> 1, Duration.ofMinutes(1));
            cache.getOrLoad("a", () -> 2, Duration.ofMinutes(1));

            CacheStats stats = cache.stats();

            assertThat(stats.size()).isEqualTo(2);
            assertThat(stats.keys()).containsExactly("a", "b");
        }
    }

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
