package io.clipboardstore.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RetentionPolicyTest {

    @Test
    void testEmptyStringIsUnbounded() {
        assertTrue(RetentionPolicy.parse("").isUnbounded());
        assertTrue(RetentionPolicy.parse("   ").isUnbounded());
        assertTrue(RetentionPolicy.parse(null).isUnbounded());
    }

    @Test
    void testByteSuffixes() {
        assertEquals(500L, RetentionPolicy.parse("500b").maxBytes().getAsLong());
        assertEquals(1024L, RetentionPolicy.parse("1kb").maxBytes().getAsLong());
        assertEquals(1536L, RetentionPolicy.parse("1.5KB").maxBytes().getAsLong());
        assertEquals(2L * 1024 * 1024, RetentionPolicy.parse("2mb").maxBytes().getAsLong());
        assertEquals(1024L * 1024 * 1024, RetentionPolicy.parse("1Gb").maxBytes().getAsLong());
        assertEquals(1024L * 1024 * 1024 * 1024, RetentionPolicy.parse("1tb").maxBytes().getAsLong());
    }

    @Test
    void testAgeSuffixes() {
        assertEquals(Duration.ofSeconds(30), RetentionPolicy.parse("30s").maxAge().get());
        assertEquals(Duration.ofHours(2), RetentionPolicy.parse("2h").maxAge().get());
        assertEquals(Duration.ofHours(36), RetentionPolicy.parse("1.5d").maxAge().get());
        assertEquals(Duration.ofDays(14), RetentionPolicy.parse("2W").maxAge().get());
        assertEquals(Duration.ofDays(30), RetentionPolicy.parse("1m").maxAge().get());
        assertEquals(Duration.ofDays(365), RetentionPolicy.parse("1y").maxAge().get());
    }

    @Test
    void testBareNumberIsEntryCount() {
        RetentionPolicy policy = RetentionPolicy.parse("25");
        assertEquals(25L, policy.maxEntries().getAsLong());
        assertTrue(policy.maxBytes().isEmpty());
        assertTrue(policy.maxAge().isEmpty());
    }

    @Test
    void testCombinedTokens() {
        RetentionPolicy policy = RetentionPolicy.parse("10mb\t2w   50");
        assertEquals(10L * 1024 * 1024, policy.maxBytes().getAsLong());
        assertEquals(Duration.ofDays(14), policy.maxAge().get());
        assertEquals(50L, policy.maxEntries().getAsLong());
        assertTrue(policy.skippedTokens().isEmpty());
    }

    @Test
    void testUnparsableTokensAreSkipped() {
        RetentionPolicy policy = RetentionPolicy.parse("lots 5q 3");
        assertEquals(List.of("lots", "5q"), policy.skippedTokens());
        assertEquals(3L, policy.maxEntries().getAsLong());
    }

    @Test
    void testFractionalCountIsTruncated() {
        RetentionPolicy policy = RetentionPolicy.parse("2.5");
        assertEquals(2L, policy.maxEntries().getAsLong());
        assertTrue(policy.skippedTokens().isEmpty());
    }

    @Test
    void testAgeBeyondInstantRangeStillParses() {
        RetentionPolicy policy = RetentionPolicy.parse("2000000000y");
        assertEquals(Duration.ofSeconds(63_072_000_000_000_000L), policy.maxAge().get());
        assertTrue(policy.skippedTokens().isEmpty());
    }

    @Test
    void testLaterTokenOverridesSameAxis() {
        assertEquals(2048L, RetentionPolicy.parse("1kb 2kb").maxBytes().getAsLong());
    }

    @Test
    void testZeroLeavesAxisUnset() {
        RetentionPolicy policy = RetentionPolicy.parse("0 0kb");
        assertTrue(policy.isUnbounded());
    }

    @Test
    void testOverflowIsSkipped() {
        RetentionPolicy policy = RetentionPolicy.parse("99999999999tb");
        assertTrue(policy.maxBytes().isEmpty());
        assertEquals(List.of("99999999999tb"), policy.skippedTokens());
    }

    @Test
    void testOfRejectsNegativeBudgets() {
        assertThrows(IllegalArgumentException.class, () -> RetentionPolicy.of(-1, null, 0));
        assertThrows(IllegalArgumentException.class, () -> RetentionPolicy.of(0, Duration.ofSeconds(-5), 0));
    }

    @Test
    void testEntryNotFoundNamesRank() {
        ClipboardStoreException.EntryNotFound e = new ClipboardStoreException.EntryNotFound(7);
        assertEquals(7L, e.rank());
        assertTrue(e.getMessage().contains("7"));
        assertNotEquals(0, e.exitStatus());
    }
}
