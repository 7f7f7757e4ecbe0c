package io.clipboardstore.spi;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * Result of a lock acquisition.
 */
public final class LockOutcome {

    public enum Status {
        /** No competing record, or the holder removed it; our pid was written. */
        ACQUIRED,
        /** The record names a process in our group; nothing was written. */
        REENTERED,
        /** The holder exited or the record was corrupt; our pid replaced it. */
        TAKEN_OVER,
        /** The holder was still alive when the wait budget ran out; nothing was written. */
        TIMED_OUT
    }

    private final Status status;
    private final Long previousHolder;
    private final int polls;

    public LockOutcome(Status status, Long previousHolder, int polls) {
        this.status = Objects.requireNonNull(status, "status");
        if (polls < 0) throw new IllegalArgumentException("polls must be non-negative");
        this.previousHolder = previousHolder;
        this.polls = polls;
    }

    public Status status() {
        return status;
    }

    /**
     * Pid found in the record before acquisition, if it could be parsed.
     */
    public OptionalLong previousHolder() {
        return previousHolder == null ? OptionalLong.empty() : OptionalLong.of(previousHolder);
    }

    /**
     * Number of sleeps spent waiting for the previous holder.
     */
    public int polls() {
        return polls;
    }

    public boolean held() {
        return status != Status.TIMED_OUT;
    }

    @Override
    public String toString() {
        return "LockOutcome{status=" + status + ", previousHolder=" + previousHolder + ", polls=" + polls + "}";
    }
}
