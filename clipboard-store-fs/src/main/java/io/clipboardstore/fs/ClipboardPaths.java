package io.clipboardstore.fs;

import io.clipboardstore.core.ClipboardStoreException;
import io.clipboardstore.core.MetadataFile;
import io.clipboardstore.core.Namespace;
import io.clipboardstore.core.StorageProtocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Maps clipboard names to root directories and lays out the fixed subtree below a root.
 *
 * <p>Storage layout:
 * <pre>
 * {namespace base}/
 *   {clipboard name}/
 *     data/{entryId}/rawdata.clipboard
 *     metadata/{ignore, ignore_secret, lock, notes, original_files, script, script_config, version}
 * </pre>
 */
public final class ClipboardPaths {

    private static final Logger LOG = LoggerFactory.getLogger(ClipboardPaths.class);

    private final Path temporaryBase;
    private final Path persistentBase;
    private final Predicate<String> persistent;

    public ClipboardPaths(StoreSettings settings) {
        this(settings.temporaryBase(), settings.persistentBase(), persistencePredicate(settings.alwaysPersist()));
    }

    public ClipboardPaths(Path temporaryBase, Path persistentBase, Predicate<String> persistent) {
        this.temporaryBase = Objects.requireNonNull(temporaryBase, "temporaryBase");
        this.persistentBase = Objects.requireNonNull(persistentBase, "persistentBase");
        this.persistent = Objects.requireNonNull(persistent, "persistent");
    }

    /**
     * Default namespace predicate: every name when {@code alwaysPersist} is set, otherwise names
     * ending in {@link StorageProtocol#PERSISTENT_SUFFIX}.
     */
    public static Predicate<String> persistencePredicate(boolean alwaysPersist) {
        if (alwaysPersist) return name -> true;
        return name -> name.endsWith(StorageProtocol.PERSISTENT_SUFFIX);
    }

    public Namespace namespaceOf(String name) {
        return persistent.test(validate(name)) ? Namespace.PERSISTENT : Namespace.TEMPORARY;
    }

    public Path baseOf(Namespace namespace) {
        return namespace == Namespace.PERSISTENT ? persistentBase : temporaryBase;
    }

    public Path rootOf(String name) {
        return baseOf(namespaceOf(name)).resolve(name);
    }

    /**
     * Names of the clipboard roots that currently exist in a namespace, sorted.
     */
    public List<String> listClipboards(Namespace namespace) {
        Path base = baseOf(namespace);
        if (!Files.isDirectory(base)) return List.of();
        try (Stream<Path> children = Files.list(base)) {
            return children.filter(Files::isDirectory)
                    .map(p -> p.getFileName().toString())
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            LOG.warn("Cannot list clipboards in {}: {}", base, e.toString());
            return List.of();
        }
    }

    // --- Fixed subtree ---

    public static Path dataDirectory(Path root) {
        return root.resolve(StorageProtocol.DATA_DIRECTORY);
    }

    public static Path entryDirectory(Path root, long entryId) {
        return dataDirectory(root).resolve(Long.toUnsignedString(entryId));
    }

    public static Path rawPayload(Path entryDirectory) {
        return entryDirectory.resolve(StorageProtocol.DATA_FILE_NAME);
    }

    public static Path metadataDirectory(Path root) {
        return root.resolve(StorageProtocol.METADATA_DIRECTORY);
    }

    public static Path metadataFile(Path root, MetadataFile file) {
        return metadataDirectory(root).resolve(file.fileName());
    }

    private static String validate(String name) {
        Objects.requireNonNull(name, "name");
        if (name.isEmpty() || name.equals(".") || name.equals("..")) {
            throw new ClipboardStoreException.InvalidClipboardName("Clipboard name \"" + name + "\" is reserved");
        }
        if (name.indexOf('/') >= 0 || name.indexOf('\\') >= 0 || name.indexOf('\0') >= 0) {
            throw new ClipboardStoreException.InvalidClipboardName("Clipboard name \"" + name + "\" contains a path separator");
        }
        return name;
    }
}
