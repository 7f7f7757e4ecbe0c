package io.clipboardstore.core;

/**
 * Clipboard storage protocol constants (directory names, well-known file names, version marker).
 *
 * <p>Every clipboard root has the same fixed subtree:
 * <pre>
 * root/
 *   data/{entryId}/      - one directory per history entry
 *     rawdata.clipboard  - present iff the entry holds a single raw payload
 *   metadata/            - see {@link MetadataFile}
 * </pre>
 */
public final class StorageProtocol {
    private StorageProtocol() {}

    // Directories below a clipboard root
    public static final String DATA_DIRECTORY = "data";
    public static final String METADATA_DIRECTORY = "metadata";

    // Raw payload of a single-item entry
    public static final String DATA_FILE_NAME = "rawdata.clipboard";

    /** Written to {@code metadata/version} on every open. */
    public static final String STORAGE_PROTOCOL_VERSION = "1";

    /** Id used for the implicit empty entry of a clipboard that has no entry directories yet. */
    public static final long SENTINEL_ENTRY_ID = 0L;

    /** Clipboards whose name ends with this suffix live in the persistent namespace. */
    public static final String PERSISTENT_SUFFIX = "_";

    public static final String DEFAULT_CLIPBOARD_NAME = "0";
}
