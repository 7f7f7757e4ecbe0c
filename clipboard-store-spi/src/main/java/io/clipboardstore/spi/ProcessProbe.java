package io.clipboardstore.spi;

/**
 * Process facts needed by the clipboard lock.
 */
public interface ProcessProbe {

    /**
     * Id of the calling process, as written into lock records.
     */
    long currentPid();

    /**
     * @return true if a process with the given id is still running
     */
    boolean isAlive(long pid);

    /**
     * Whether {@code pid} belongs to the caller's process group.
     *
     * <p>Both ends of a shell pipeline share a group, so a pipeline that feeds the tool into itself
     * must not wait on its own lock record.
     */
    boolean sharesProcessGroup(long pid);
}
