package io.clipboardstore.spi;

import java.util.List;
import java.util.Objects;

/**
 * Result of a retention trim.
 *
 * @param evicted        evicted entry ids, in eviction order (oldest first)
 * @param evictedForSize entries evicted by the byte budget
 * @param evictedForAge  entries evicted by the age budget
 * @param evictedForCount entries evicted by the count budget
 */
public record TrimOutcome(List<Long> evicted, int evictedForSize, int evictedForAge, int evictedForCount) {

    public TrimOutcome {
        Objects.requireNonNull(evicted, "evicted");
        evicted = List.copyOf(evicted);
        if (evictedForSize + evictedForAge + evictedForCount != evicted.size()) {
            throw new IllegalArgumentException("per-axis counts must add up to the evicted ids");
        }
    }

    public static TrimOutcome nothingEvicted() {
        return new TrimOutcome(List.of(), 0, 0, 0);
    }
}
