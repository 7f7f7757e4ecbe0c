package io.clipboardstore.core;

/**
 * Base class for clipboard store exceptions.
 *
 * <p>The store never terminates the process itself. The command-line boundary catches these,
 * formats the message and exits with {@link #exitStatus()}.
 */
public abstract class ClipboardStoreException extends RuntimeException {

    /** Process exit status a command-line front end should use for store failures. */
    public static final int EXIT_FAILURE = 1;

    protected ClipboardStoreException(String message) {
        super(message);
    }

    protected ClipboardStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public int exitStatus() {
        return EXIT_FAILURE;
    }

    /**
     * Raised when a logical history rank is outside the entry index.
     */
    public static class EntryNotFound extends ClipboardStoreException {
        private final long rank;

        public EntryNotFound(long rank) {
            super("The history entry you chose (\"" + rank + "\") doesn't exist. Try choosing a different or newer one instead.");
            this.rank = rank;
        }

        public long rank() {
            return rank;
        }
    }

    /**
     * Raised when a clipboard name cannot be mapped to a directory below its namespace.
     */
    public static class InvalidClipboardName extends ClipboardStoreException {
        public InvalidClipboardName(String message) {
            super(message);
        }
    }

    /**
     * Raised when a mutating filesystem operation fails (root creation, allocation, eviction, rewrite).
     */
    public static class StorageFailure extends ClipboardStoreException {
        public StorageFailure(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
