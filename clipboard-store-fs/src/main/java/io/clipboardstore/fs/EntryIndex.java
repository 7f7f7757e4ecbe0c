package io.clipboardstore.fs;

import io.clipboardstore.core.ClipboardStoreException;
import io.clipboardstore.core.StorageProtocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.stream.Stream;

/**
 * Newest-first list of the entry ids of one clipboard, taken from a single listing of {@code data/}.
 *
 * <p>Ranks are logical positions in this list (0 = newest), not id values. The list is a snapshot:
 * other processes may add or remove entry directories after the scan. Callers that need fresh state
 * scan again after acquiring the clipboard lock, and only allocate while holding it.
 */
public final class EntryIndex {

    private static final Logger LOG = LoggerFactory.getLogger(EntryIndex.class);

    private final Path dataDirectory;
    private final List<Long> ids;

    private EntryIndex(Path dataDirectory, List<Long> ids) {
        this.dataDirectory = dataDirectory;
        this.ids = ids;
    }

    /**
     * List {@code dataDirectory}, creating it if missing. Children whose names are not unsigned decimal
     * integers are ignored. An empty directory yields the single id {@link StorageProtocol#SENTINEL_ENTRY_ID}.
     */
    public static EntryIndex scan(Path dataDirectory) {
        Objects.requireNonNull(dataDirectory, "dataDirectory");
        List<Long> ids = new ArrayList<>();
        try {
            Files.createDirectories(dataDirectory);
            try (Stream<Path> children = Files.list(dataDirectory)) {
                children.forEach(child -> parseId(child.getFileName().toString()).ifPresent(id -> ids.add(id)));
            }
        } catch (IOException e) {
            throw new ClipboardStoreException.StorageFailure("Cannot index entries in " + dataDirectory, e);
        }
        if (ids.isEmpty()) ids.add(StorageProtocol.SENTINEL_ENTRY_ID);
        ids.sort((a, b) -> Long.compareUnsigned(b, a));
        LOG.debug("Indexed {} entries in {}", ids.size(), dataDirectory);
        return new EntryIndex(dataDirectory, ids);
    }

    private static OptionalLong parseId(String name) {
        if (name.isEmpty()) return OptionalLong.empty();
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c < '0' || c > '9') return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseUnsignedLong(name));
        } catch (NumberFormatException e) {
            // wider than 64 bits
            return OptionalLong.empty();
        }
    }

    /**
     * Entry id at a logical rank.
     *
     * @throws ClipboardStoreException.EntryNotFound if {@code rank} is outside the index
     */
    public long idAt(long rank) {
        if (rank < 0 || rank >= ids.size()) {
            throw new ClipboardStoreException.EntryNotFound(rank);
        }
        return ids.get((int) rank);
    }

    /**
     * Directory of the entry at a logical rank.
     *
     * @throws ClipboardStoreException.EntryNotFound if {@code rank} is outside the index
     */
    public Path pathOf(long rank) {
        return dataDirectory.resolve(Long.toUnsignedString(idAt(rank)));
    }

    /**
     * Allocate the next id (newest + 1), prepend it and create its directory.
     *
     * <p>Only call while holding the clipboard lock; two unlocked processes can allocate the same id.
     */
    public long allocate() {
        long next = newest() + 1;
        if (next == 0L) {
            throw new IllegalStateException("entry ids exhausted in " + dataDirectory);
        }
        Path entry = dataDirectory.resolve(Long.toUnsignedString(next));
        try {
            Files.createDirectories(entry);
        } catch (IOException e) {
            throw new ClipboardStoreException.StorageFailure("Cannot create entry " + entry, e);
        }
        ids.add(0, next);
        LOG.debug("Allocated entry {} in {}", Long.toUnsignedString(next), dataDirectory);
        return next;
    }

    /**
     * Delete the oldest entry directory and drop its id from the tail.
     *
     * @return the evicted id
     */
    long removeOldest() {
        if (ids.isEmpty()) throw new IllegalStateException("index is empty");
        Path oldest = pathOf(ids.size() - 1L);
        try {
            FileContents.deleteRecursively(oldest);
        } catch (IOException e) {
            throw new ClipboardStoreException.StorageFailure("Cannot evict entry " + oldest, e);
        }
        return ids.remove(ids.size() - 1);
    }

    public long newest() {
        return ids.get(0);
    }

    public long oldest() {
        return ids.get(ids.size() - 1);
    }

    Path oldestPath() {
        return pathOf(ids.size() - 1L);
    }

    public int size() {
        return ids.size();
    }

    /**
     * Newest-first view of the ids.
     */
    public List<Long> ids() {
        return Collections.unmodifiableList(ids);
    }

    public Path dataDirectory() {
        return dataDirectory;
    }

    @Override
    public String toString() {
        return "EntryIndex{" + dataDirectory + ", ids=" + ids + "}";
    }
}
