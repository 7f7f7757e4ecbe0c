package io.clipboardstore.core;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Retention budgets for the history of one clipboard.
 *
 * <p>Parsed from a whitespace-separated string where the unit suffix of each token selects the axis
 * (case-insensitive):
 * <ul>
 *   <li>{@code b kb mb gb tb} - total size of the clipboard root, 1024-based multiples</li>
 *   <li>{@code s h d w m y} - maximum entry age (a month is 30 days, a year 365 days)</li>
 *   <li>no suffix - maximum number of entries</li>
 * </ul>
 *
 * <p>Example: {@code "10mb 2w 50"}. Tokens that cannot be parsed are skipped and reported through
 * {@link #skippedTokens()}; a later token on the same axis replaces an earlier one. A zero budget
 * leaves the axis unset.
 */
public final class RetentionPolicy {

    private static final Pattern TOKEN = Pattern.compile("^(\\d+(?:\\.\\d*)?|\\.\\d+)([a-z]*)$");
    private static final long KIB = 1024L;
    private static final long SECONDS_PER_DAY = 24L * 60 * 60;

    private static final RetentionPolicy NONE = new RetentionPolicy(0, 0, 0, List.of());

    private final long maxBytes;
    private final long maxAgeSeconds;
    private final long maxEntries;
    private final List<String> skippedTokens;

    private RetentionPolicy(long maxBytes, long maxAgeSeconds, long maxEntries, List<String> skippedTokens) {
        this.maxBytes = maxBytes;
        this.maxAgeSeconds = maxAgeSeconds;
        this.maxEntries = maxEntries;
        this.skippedTokens = Collections.unmodifiableList(skippedTokens);
    }

    public static RetentionPolicy none() {
        return NONE;
    }

    public static RetentionPolicy of(long maxBytes, Duration maxAge, long maxEntries) {
        if (maxBytes < 0) throw new IllegalArgumentException("maxBytes must be >= 0");
        if (maxEntries < 0) throw new IllegalArgumentException("maxEntries must be >= 0");
        long seconds = maxAge == null ? 0 : maxAge.getSeconds();
        if (seconds < 0) throw new IllegalArgumentException("maxAge must not be negative");
        return new RetentionPolicy(maxBytes, seconds, maxEntries, List.of());
    }

    public static RetentionPolicy parse(String budget) {
        if (budget == null || budget.isBlank()) return NONE;

        long bytes = 0;
        long seconds = 0;
        long entries = 0;
        List<String> skipped = new ArrayList<>();

        for (String token : budget.trim().split("\\s+")) {
            Matcher m = TOKEN.matcher(token.toLowerCase(Locale.ROOT));
            if (!m.matches()) {
                skipped.add(token);
                continue;
            }
            BigDecimal magnitude = new BigDecimal(m.group(1));
            try {
                switch (m.group(2)) {
                    case "" -> entries = scale(magnitude, 1);
                    case "b" -> bytes = scale(magnitude, 1);
                    case "kb" -> bytes = scale(magnitude, KIB);
                    case "mb" -> bytes = scale(magnitude, KIB * KIB);
                    case "gb" -> bytes = scale(magnitude, KIB * KIB * KIB);
                    case "tb" -> bytes = scale(magnitude, KIB * KIB * KIB * KIB);
                    case "s" -> seconds = scale(magnitude, 1);
                    case "h" -> seconds = scale(magnitude, 60L * 60);
                    case "d" -> seconds = scale(magnitude, SECONDS_PER_DAY);
                    case "w" -> seconds = scale(magnitude, 7 * SECONDS_PER_DAY);
                    case "m" -> seconds = scale(magnitude, 30 * SECONDS_PER_DAY);
                    case "y" -> seconds = scale(magnitude, 365 * SECONDS_PER_DAY);
                    default -> skipped.add(token);
                }
            } catch (ArithmeticException e) {
                // values beyond 64 bits
                skipped.add(token);
            }
        }
        return new RetentionPolicy(bytes, seconds, entries, skipped);
    }

    private static long scale(BigDecimal magnitude, long multiplier) {
        return magnitude.multiply(BigDecimal.valueOf(multiplier))
                .setScale(0, RoundingMode.DOWN)
                .longValueExact();
    }

    /**
     * Budget for the total recursive size of the clipboard root, if set.
     */
    public OptionalLong maxBytes() {
        return maxBytes > 0 ? OptionalLong.of(maxBytes) : OptionalLong.empty();
    }

    /**
     * Maximum age of the oldest entry, if set.
     */
    public Optional<Duration> maxAge() {
        return maxAgeSeconds > 0 ? Optional.of(Duration.ofSeconds(maxAgeSeconds)) : Optional.empty();
    }

    /**
     * Maximum number of entries, if set.
     */
    public OptionalLong maxEntries() {
        return maxEntries > 0 ? OptionalLong.of(maxEntries) : OptionalLong.empty();
    }

    public List<String> skippedTokens() {
        return skippedTokens;
    }

    public boolean isUnbounded() {
        return maxBytes == 0 && maxAgeSeconds == 0 && maxEntries == 0;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof RetentionPolicy)) return false;
        RetentionPolicy o = (RetentionPolicy) other;
        return maxBytes == o.maxBytes && maxAgeSeconds == o.maxAgeSeconds && maxEntries == o.maxEntries;
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxBytes, maxAgeSeconds, maxEntries);
    }

    @Override
    public String toString() {
        return "RetentionPolicy{maxBytes=" + maxBytes + ", maxAgeSeconds=" + maxAgeSeconds + ", maxEntries=" + maxEntries + "}";
    }
}
