package uk.gegc.learnpath.shared.cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Process-local read-through cache with per-key time-to-live.
 * <p>
 * An entry is served until {@code storedAt + ttl}. When a refresh fails and an
 * earlier entry exists, the earlier value is returned even if expired. Entries
 * are only removed through {@link #invalidate(String)} or {@link #invalidate()};
 * there is no size-based eviction.
 * <p>
 * Concurrent loads of the same key are not coalesced; the last write wins.
 */
@Slf4j
public class TtlCache {

    private final Clock clock;
    private final ConcurrentMap<String, CacheEntry> entries = new ConcurrentHashMap<>();

    public TtlCache(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @SuppressWarnings("unchecked")
    public <T> T getOrLoad(String key, Supplier<T> loader, Duration ttl) {
        Instant now = clock.instant();
        CacheEntry existing = entries.get(key);
        if (existing != null && !existing.isExpired(now)) {
            return (T) existing.value();
        }

        T loaded;
        try {
            loaded = loader.get();
        } catch (RuntimeException ex) {
            if (existing != null) {
                log.warn("Refresh failed for cache key '{}', serving stale value stored at {}: {}",
                        key, existing.storedAt(), ex.getMessage());
                return (T) existing.value();
            }
            throw ex;
        }

        entries.put(key, new CacheEntry(loaded, clock.instant(), ttl));
        return loaded;
    }

    /**
     * Removes every key containing {@code pattern}.
     *
     * @return number of removed entries
     */
    public int invalidate(String pattern) {
        if (pattern == null) {
            return invalidate();
        }
        int removed = 0;
        for (String key : entries.keySet()) {
            if (key.contains(pattern) && entries.remove(key) != null) {
                removed++;
            }
        }
        log.debug("Invalidated {} cache entries matching '{}'", removed, pattern);
        return removed;
    }

    public int invalidate() {
        int removed = entries.size();
        entries.clear();
        log.debug("Cleared cache ({} entries)", removed);
        return removed;
    }

    public CacheStats stats() {
        List<String> keys = entries.keySet().stream().sorted().toList();
        return new CacheStats(keys.size(), keys);
    }

    private record CacheEntry(Object value, Instant storedAt, Duration ttl) {

        boolean isExpired(Instant now) {
            return !now.isBefore(storedAt.plus(ttl));
        }
    }
}
