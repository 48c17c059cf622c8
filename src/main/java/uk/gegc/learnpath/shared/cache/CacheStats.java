package uk.gegc.learnpath.shared.cache;

import java.util.List;

public record CacheStats(int size, List<String> keys) {
}
