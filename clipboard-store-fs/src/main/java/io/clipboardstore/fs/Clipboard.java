package io.clipboardstore.fs;

import io.clipboardstore.core.ClipboardStoreException;
import io.clipboardstore.core.MetadataFile;
import io.clipboardstore.core.Namespace;
import io.clipboardstore.core.RetentionPolicy;
import io.clipboardstore.core.StorageProtocol;
import io.clipboardstore.spi.ClipboardLock;
import io.clipboardstore.spi.IgnoreOutcome;
import io.clipboardstore.spi.LockOutcome;
import io.clipboardstore.spi.Pause;
import io.clipboardstore.spi.ProcessProbe;
import io.clipboardstore.spi.TrimOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Handle over one clipboard root: its entry index, the active entry and the fixed metadata files.
 *
 * <p>Opening creates the root, {@code data/}, {@code metadata/} and the active entry directory if
 * missing, and rewrites {@code metadata/version}. Mutations (new entries, metadata rewrites) are only
 * safe across processes while {@link #getLock()} is held.
 */
public final class Clipboard {

    private static final Logger LOG = LoggerFactory.getLogger(Clipboard.class);

    private final String name;
    private final Namespace namespace;
    private final Path root;
    private final ClipboardLock lock;

    private EntryIndex entryIndex;
    private long activeRank;
    private Path entryDirectory;

    private Clipboard(String name, Namespace namespace, Path root, ClipboardLock lock, EntryIndex entryIndex, long activeRank) {
        this.name = name;
        this.namespace = namespace;
        this.root = root;
        this.lock = lock;
        this.entryIndex = entryIndex;
        this.activeRank = activeRank;
        this.entryDirectory = entryIndex.pathOf(activeRank);
    }

    public static Clipboard open(ClipboardPaths paths, String name, long rank) {
        return open(paths, name, rank, new ProcessHandleProbe(), Pause.threadSleep());
    }

    /**
     * Open {@code name} with the entry at {@code rank} active.
     *
     * @throws ClipboardStoreException.EntryNotFound if the history has no entry at {@code rank}
     */
    public static Clipboard open(ClipboardPaths paths, String name, long rank, ProcessProbe probe, Pause pause) {
        Objects.requireNonNull(paths, "paths");
        Namespace namespace = paths.namespaceOf(name);
        Path root = paths.baseOf(namespace).resolve(name);

        EntryIndex index = EntryIndex.scan(ClipboardPaths.dataDirectory(root));
        ClipboardLock lock = new PidFileLock(ClipboardPaths.metadataFile(root, MetadataFile.LOCK), probe, pause);
        Clipboard clipboard = new Clipboard(name, namespace, root, lock, index, rank);

        try {
            Files.createDirectories(clipboard.entryDirectory);
            Files.createDirectories(ClipboardPaths.metadataDirectory(root));
            FileContents.writeString(clipboard.metadataFile(MetadataFile.VERSION), StorageProtocol.STORAGE_PROTOCOL_VERSION);
        } catch (IOException e) {
            throw new ClipboardStoreException.StorageFailure("Cannot open clipboard " + root, e);
        }
        LOG.debug("Opened clipboard {} ({}) at rank {}", name, namespace, rank);
        return clipboard;
    }

    // --- Emptiness queries ---

    /**
     * @return true if the active entry holds a non-empty raw payload
     */
    public boolean holdsRawDataInCurrentEntry() {
        Path raw = rawPayload();
        if (!Files.exists(raw)) return false;
        return !FileContents.isEmpty(raw);
    }

    /**
     * @return true if the active entry holds a non-empty raw payload or any non-empty child
     */
    public boolean holdsDataInCurrentEntry() {
        if (FileContents.isEmpty(entryDirectory)) return false;
        if (holdsRawDataInCurrentEntry()) return true;
        try (Stream<Path> children = Files.list(entryDirectory)) {
            return children.anyMatch(child -> !FileContents.isEmpty(child));
        } catch (IOException e) {
            LOG.warn("Cannot list entry {}: {}", entryDirectory, e.toString());
            return false;
        }
    }

    /**
     * @return true if any entry in the history is non-empty
     */
    public boolean holdsData() {
        for (int rank = 0; rank < entryIndex.size(); rank++) {
            if (!FileContents.isEmpty(entryIndex.pathOf(rank))) return true;
        }
        return false;
    }

    /**
     * A clipboard is unused when its active entry is empty and it carries no notes or original-file mapping.
     */
    public boolean isUnused() {
        if (holdsDataInCurrentEntry()) return false;
        if (!FileContents.isEmpty(metadataFile(MetadataFile.NOTES))) return false;
        return FileContents.isEmpty(metadataFile(MetadataFile.ORIGINAL_FILES));
    }

    // --- Locking ---

    public LockOutcome getLock() throws IOException, InterruptedException {
        return lock.acquire();
    }

    public boolean releaseLock() throws IOException {
        return lock.release();
    }

    public ClipboardLock lock() {
        return lock;
    }

    // --- Entries ---

    /**
     * Allocate a new newest entry and re-resolve the active rank against the grown index.
     * Hold the lock while calling this.
     */
    public long makeNewEntry() {
        long id = entryIndex.allocate();
        entryDirectory = entryIndex.pathOf(activeRank);
        try {
            Files.createDirectories(entryDirectory);
        } catch (IOException e) {
            throw new ClipboardStoreException.StorageFailure("Cannot create entry " + entryDirectory, e);
        }
        return id;
    }

    /**
     * Switch the active entry without touching the index.
     */
    public void setEntry(long rank) {
        entryDirectory = entryIndex.pathOf(rank);
        activeRank = rank;
    }

    public Path entryPathFor(long rank) {
        return entryIndex.pathOf(rank);
    }

    /**
     * Replace the index snapshot with a fresh listing, keeping the active rank.
     *
     * @throws ClipboardStoreException.EntryNotFound if the active rank no longer exists
     */
    public void rescan() {
        EntryIndex fresh = EntryIndex.scan(ClipboardPaths.dataDirectory(root));
        Path active = fresh.pathOf(activeRank);
        entryIndex = fresh;
        entryDirectory = active;
    }

    // --- Passes ---

    public IgnoreOutcome applyIgnoreRules() {
        return new IgnoreEngine().apply(this);
    }

    public TrimOutcome trimHistoryEntries(RetentionPolicy policy) {
        return new RetentionManager(policy).trim(this);
    }

    // --- Notes ---

    public Optional<String> readNotes() {
        Path notes = metadataFile(MetadataFile.NOTES);
        if (!Files.exists(notes)) return Optional.empty();
        try {
            return Optional.of(FileContents.readString(notes));
        } catch (IOException e) {
            LOG.warn("Cannot read notes {}: {}", notes, e.toString());
            return Optional.empty();
        }
    }

    public void writeNotes(String notes) {
        Path file = metadataFile(MetadataFile.NOTES);
        try {
            FileContents.writeString(file, Objects.requireNonNull(notes, "notes"));
        } catch (IOException e) {
            throw new ClipboardStoreException.StorageFailure("Cannot write notes " + file, e);
        }
    }

    // --- Accessors ---

    public String name() {
        return name;
    }

    public Namespace namespace() {
        return namespace;
    }

    public boolean isPersistent() {
        return namespace == Namespace.PERSISTENT;
    }

    public Path root() {
        return root;
    }

    public EntryIndex entryIndex() {
        return entryIndex;
    }

    public long activeRank() {
        return activeRank;
    }

    public Path entryDirectory() {
        return entryDirectory;
    }

    public Path rawPayload() {
        return ClipboardPaths.rawPayload(entryDirectory);
    }

    public Path metadataFile(MetadataFile file) {
        return ClipboardPaths.metadataFile(root, file);
    }

    @Override
    public String toString() {
        return "Clipboard{" + name + ", " + namespace + ", rank=" + activeRank + "}";
    }
}
