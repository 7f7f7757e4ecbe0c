package io.clipboardstore.fs;

import io.clipboardstore.core.RetentionPolicy;
import io.clipboardstore.spi.TrimOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Evicts the oldest entries of a clipboard until its {@link RetentionPolicy} budgets hold.
 *
 * <p>Axes run in a fixed order, each on the index left by the previous one:
 * <ol>
 *   <li>bytes: the root is measured once; the oldest entry is evicted and its size subtracted while
 *       the running total exceeds the budget</li>
 *   <li>age: the oldest entry is evicted while its modification time is before {@code now - maxAge}</li>
 *   <li>count: the oldest entry is evicted while more than {@code maxEntries} remain</li>
 * </ol>
 *
 * <p>The newest entry is never evicted, so every axis terminates.
 */
public final class RetentionManager {

    private static final Logger LOG = LoggerFactory.getLogger(RetentionManager.class);

    private final RetentionPolicy policy;
    private final Clock clock;

    public RetentionManager(RetentionPolicy policy) {
        this(policy, Clock.systemUTC());
    }

    public RetentionManager(RetentionPolicy policy, Clock clock) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (!policy.skippedTokens().isEmpty()) {
            LOG.debug("Ignoring unparsable retention tokens {}", policy.skippedTokens());
        }
    }

    public TrimOutcome trim(Clipboard clipboard) {
        Objects.requireNonNull(clipboard, "clipboard");
        if (policy.isUnbounded()) return TrimOutcome.nothingEvicted();

        EntryIndex index = clipboard.entryIndex();
        List<Long> evicted = new ArrayList<>();

        int forSize = 0;
        if (policy.maxBytes().isPresent()) {
            long budget = policy.maxBytes().getAsLong();
            long total = FileContents.directorySize(clipboard.root());
            while (total > budget && index.size() > 1) {
                long oldestSize = FileContents.directorySize(index.oldestPath());
                evicted.add(evict(index, "size"));
                total -= oldestSize;
                forSize++;
            }
        }

        int forAge = 0;
        Instant now = clock.instant();
        // an age reaching past Instant.MIN cannot be exceeded by any entry
        if (policy.maxAge().isPresent() && policy.maxAge().get().compareTo(Duration.between(Instant.MIN, now)) < 0) {
            Instant cutoff = now.minus(policy.maxAge().get());
            while (index.size() > 1 && lastModified(index.oldestPath(), now).isBefore(cutoff)) {
                evicted.add(evict(index, "age"));
                forAge++;
            }
        }

        int forCount = 0;
        if (policy.maxEntries().isPresent()) {
            long budget = policy.maxEntries().getAsLong();
            while (index.size() > budget) {
                evicted.add(evict(index, "count"));
                forCount++;
            }
        }

        return new TrimOutcome(evicted, forSize, forAge, forCount);
    }

    private static long evict(EntryIndex index, String axis) {
        long id = index.removeOldest();
        LOG.info("Evicted entry {} from {} ({} budget)", Long.toUnsignedString(id), index.dataDirectory(), axis);
        return id;
    }

    // unreadable times count as "now" so the age axis stops instead of evicting blindly
    private static Instant lastModified(Path entry, Instant now) {
        try {
            return Files.getLastModifiedTime(entry).toInstant();
        } catch (IOException | UnsupportedOperationException e) {
            LOG.debug("No modification time for {}: {}", entry, e.toString());
            return now;
        }
    }
}
