package uk.gegc.learnpath.features.content.application;

import uk.gegc.learnpath.features.content.domain.model.ContentKind;
import uk.gegc.learnpath.features.content.domain.model.ContentStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Outcome of one cascade run: per level, how many descendants were visited and
 * which of them were rewritten to the target status.
 */
public record CascadeResult(
        UUID rootId,
        ContentKind rootKind,
        ContentStatus targetStatus,
        Map<ContentKind, Integer> visited,
        Map<ContentKind, List<UUID>> updated
) {

    public CascadeResult {
        visited = copyOf(visited);
        updated = copyOf(updated);
    }

    private static <V> Map<ContentKind, V> copyOf(Map<ContentKind, V> source) {
        Map<ContentKind, V> copy = new EnumMap<>(ContentKind.class);
        if (source != null) {
            copy.putAll(source);
        }
        return Collections.unmodifiableMap(copy);
    }

    public int totalVisited() {
        return visited.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int totalUpdated() {
        return updated.values().stream().mapToInt(List::size).sum();
    }

    public int updatedCount(ContentKind kind) {
        return updated.getOrDefault(kind, List.of()).size();
    }
}
