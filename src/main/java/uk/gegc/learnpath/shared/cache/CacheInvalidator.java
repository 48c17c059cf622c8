package uk.gegc.learnpath.shared.cache;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.List;

/**
 * Defers cache invalidation until the surrounding transaction commits, so a
 * concurrent reader cannot re-cache rows that are about to change.
 * Outside a transaction the keys are dropped immediately.
 */
@Component
@RequiredArgsConstructor
public class CacheInvalidator {

    private final TtlCache cache;

    public void invalidateAfterCommit(String... patterns) {
        List<String> keys = List.of(patterns);
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    keys.forEach(cache::invalidate);
                }
            });
        } else {
            keys.forEach(cache::invalidate);
        }
    }
}
