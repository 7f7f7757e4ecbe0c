package io.clipboardstore.spi;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OutcomesTest {

    @Test
    void testTrimOutcomeCountsMustMatch() {
        assertThrows(IllegalArgumentException.class, () -> new TrimOutcome(List.of(1L, 2L), 1, 0, 0));
        TrimOutcome outcome = new TrimOutcome(List.of(1L, 2L), 1, 0, 1);
        assertEquals(List.of(1L, 2L), outcome.evicted());
    }

    @Test
    void testTrimOutcomeCopiesIds() {
        List<Long> ids = new ArrayList<>(List.of(3L));
        TrimOutcome outcome = new TrimOutcome(ids, 0, 0, 1);
        ids.add(4L);
        assertEquals(List.of(3L), outcome.evicted());
        assertThrows(UnsupportedOperationException.class, () -> outcome.evicted().add(5L));
    }

    @Test
    void testIgnoreOutcomeChanged() {
        assertFalse(IgnoreOutcome.untouched().changed());
        assertTrue(new IgnoreOutcome(1, List.of(Path.of("secret.txt")), false, false).changed());
        assertTrue(new IgnoreOutcome(0, List.of(), false, true).changed());
    }

    @Test
    void testLockOutcome() {
        LockOutcome reentered = new LockOutcome(LockOutcome.Status.REENTERED, 42L, 0);
        assertTrue(reentered.held());
        assertEquals(42L, reentered.previousHolder().getAsLong());

        LockOutcome timedOut = new LockOutcome(LockOutcome.Status.TIMED_OUT, 42L, 3);
        assertFalse(timedOut.held());
        assertEquals(3, timedOut.polls());

        assertTrue(new LockOutcome(LockOutcome.Status.ACQUIRED, null, 0).previousHolder().isEmpty());
        assertThrows(IllegalArgumentException.class, () -> new LockOutcome(LockOutcome.Status.ACQUIRED, null, -1));
    }
}
