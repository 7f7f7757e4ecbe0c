package io.clipboardstore.spi;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Result of applying ignore rules to the active entry.
 *
 * @param patternsApplied number of valid regex patterns that were run
 * @param removed         top-level entry children deleted because their name matched
 * @param contentRewritten whether the raw payload was rewritten by regex substitution
 * @param redacted        whether the raw payload was emptied by a secret digest match
 */
public record IgnoreOutcome(int patternsApplied, List<Path> removed, boolean contentRewritten, boolean redacted) {

    public IgnoreOutcome {
        Objects.requireNonNull(removed, "removed");
        removed = List.copyOf(removed);
    }

    public static IgnoreOutcome untouched() {
        return new IgnoreOutcome(0, List.of(), false, false);
    }

    public boolean changed() {
        return contentRewritten || redacted || !removed.isEmpty();
    }
}
