package uk.gegc.learnpath.features.admin.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;
import uk.gegc.learnpath.shared.cache.CacheStats;
import uk.gegc.learnpath.shared.cache.TtlCache;

import java.util.Map;

@Tag(name = "Admin - Cache", description = "Inspect and clear the in-process read cache")
@RestController
@RequestMapping("/api/v1/admin/cache")
@RequiredArgsConstructor
@Slf4j
public class CacheController {

    private final TtlCache cache;

    @Operation(summary = "Cache statistics")
    @GetMapping
    @PreAuthorize("hasAuthority('cache:manage')")
    public ResponseEntity<CacheStats> stats() {
        return ResponseEntity.ok(cache.stats());
    }

    @Operation(summary = "Invalidate cache entries", description = "Removes keys containing the pattern, or every key when no pattern is given.")
    @DeleteMapping
    @PreAuthorize("hasAuthority('cache:manage')")
    public ResponseEntity<Map<String, Integer>> invalidate(
            @Parameter(description = "Substring of the keys to remove")
            @RequestParam(name = "pattern", required = false) String pattern
    ) {
        int removed = pattern == null || pattern.isBlank() ? cache.invalidate() : cache.invalidate(pattern);
        log.info("Cache invalidated by admin: pattern='{}', removed={}", pattern, removed);
        return ResponseEntity.ok(Map.of("removed", removed));
    }
}
