package io.clipboardstore.spi;

import java.io.IOException;
import java.time.Duration;

/**
 * Cross-process mutual exclusion for one clipboard root.
 *
 * <p>Callers acquire before allocating entries or rewriting metadata and release when done.
 * Acquisition is re-entrant for callers in the holder's process group.
 */
public interface ClipboardLock {

    /**
     * Acquire the lock, waiting for as long as the current holder keeps running.
     */
    LockOutcome acquire() throws IOException, InterruptedException;

    /**
     * Acquire the lock, giving up once {@code maxWait} has been spent waiting.
     *
     * @return outcome with {@link LockOutcome.Status#TIMED_OUT} if the holder outlived the wait
     */
    LockOutcome acquire(Duration maxWait) throws IOException, InterruptedException;

    /**
     * Remove the lock record if it names the calling process.
     *
     * @return true if a record was removed
     */
    boolean release() throws IOException;

    /**
     * @return true if a lock record currently exists
     */
    boolean isLocked();
}
