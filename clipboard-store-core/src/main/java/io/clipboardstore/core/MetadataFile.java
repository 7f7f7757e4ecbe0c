package io.clipboardstore.core;

/**
 * Fixed files below {@code metadata/} of a clipboard root.
 */
public enum MetadataFile {
    IGNORE("ignore"),
    IGNORE_SECRET("ignore_secret"),
    LOCK("lock"),
    NOTES("notes"),
    ORIGINAL_FILES("original_files"),
    SCRIPT("script"),
    SCRIPT_CONFIG("script_config"),
    VERSION("version");

    private final String fileName;

    MetadataFile(String fileName) {
        this.fileName = fileName;
    }

    public String fileName() {
        return fileName;
    }
}
