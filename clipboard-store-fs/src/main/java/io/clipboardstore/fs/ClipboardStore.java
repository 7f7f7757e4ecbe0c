package io.clipboardstore.fs;

import io.clipboardstore.core.Namespace;
import io.clipboardstore.core.StorageProtocol;
import io.clipboardstore.spi.Pause;
import io.clipboardstore.spi.ProcessProbe;
import io.clipboardstore.spi.TrimOutcome;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Entry point for callers: opens clipboards under the configured namespaces and trims them with the
 * configured retention budgets.
 *
 * <p>Typical mutation sequence:
 * <pre>{@code
 * Clipboard clipboard = store.open("0", 0);
 * clipboard.getLock();
 * try {
 *     clipboard.rescan();
 *     clipboard.makeNewEntry();
 *     // write the payload below clipboard.entryDirectory()
 *     clipboard.applyIgnoreRules();
 *     store.trim(clipboard);
 * } finally {
 *     clipboard.releaseLock();
 * }
 * }</pre>
 */
public final class ClipboardStore {

    private final ClipboardPaths paths;
    private final ProcessProbe probe;
    private final Pause pause;
    private final RetentionManager retention;

    public ClipboardStore(StoreSettings settings) {
        this(settings, new ProcessHandleProbe(), Pause.threadSleep(), Clock.systemUTC());
    }

    public ClipboardStore(StoreSettings settings, ProcessProbe probe, Pause pause, Clock clock) {
        Objects.requireNonNull(settings, "settings");
        this.paths = new ClipboardPaths(settings);
        this.probe = Objects.requireNonNull(probe, "probe");
        this.pause = Objects.requireNonNull(pause, "pause");
        this.retention = new RetentionManager(settings.retentionPolicy(), clock);
    }

    public Clipboard open(String name) {
        return open(name, 0);
    }

    public Clipboard open(String name, long rank) {
        return Clipboard.open(paths, name, rank, probe, pause);
    }

    public Clipboard openDefault() {
        return open(StorageProtocol.DEFAULT_CLIPBOARD_NAME);
    }

    public TrimOutcome trim(Clipboard clipboard) {
        return retention.trim(clipboard);
    }

    public List<String> clipboards(Namespace namespace) {
        return paths.listClipboards(namespace);
    }
}
