package io.clipboardstore.fs;

import io.clipboardstore.core.RetentionPolicy;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Store configuration taken from the environment.
 *
 * <ul>
 *   <li>{@code CLIPBOARD_TMPDIR} - base of the temporary namespace (default {@code <java.io.tmpdir>/Clipboard})</li>
 *   <li>{@code CLIPBOARD_PERSISTDIR} - base of the persistent namespace (default
 *       {@code $XDG_STATE_HOME/clipboard}, else {@code ~/.local/state/clipboard})</li>
 *   <li>{@code CLIPBOARD_HISTORY} - retention budget string, see {@link RetentionPolicy#parse(String)}</li>
 *   <li>{@code CLIPBOARD_ALWAYS_PERSIST} - when set, every clipboard is persistent</li>
 * </ul>
 */
public final class StoreSettings {

    public static final String ENV_TMPDIR = "CLIPBOARD_TMPDIR";
    public static final String ENV_PERSISTDIR = "CLIPBOARD_PERSISTDIR";
    public static final String ENV_HISTORY = "CLIPBOARD_HISTORY";
    public static final String ENV_ALWAYS_PERSIST = "CLIPBOARD_ALWAYS_PERSIST";
    private static final String ENV_XDG_STATE_HOME = "XDG_STATE_HOME";

    private final Path temporaryBase;
    private final Path persistentBase;
    private final String history;
    private final boolean alwaysPersist;

    public StoreSettings(Path temporaryBase, Path persistentBase, String history, boolean alwaysPersist) {
        this.temporaryBase = Objects.requireNonNull(temporaryBase, "temporaryBase");
        this.persistentBase = Objects.requireNonNull(persistentBase, "persistentBase");
        this.history = history == null ? "" : history.trim();
        this.alwaysPersist = alwaysPersist;
    }

    public static StoreSettings fromEnvironment() {
        return fromMap(System.getenv());
    }

    public static StoreSettings fromMap(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        Path tmp = nonBlank(env.get(ENV_TMPDIR))
                ? Path.of(env.get(ENV_TMPDIR))
                : Path.of(System.getProperty("java.io.tmpdir"), "Clipboard");

        Path persist;
        if (nonBlank(env.get(ENV_PERSISTDIR))) {
            persist = Path.of(env.get(ENV_PERSISTDIR));
        } else if (nonBlank(env.get(ENV_XDG_STATE_HOME))) {
            persist = Path.of(env.get(ENV_XDG_STATE_HOME), "clipboard");
        } else {
            persist = Path.of(System.getProperty("user.home"), ".local", "state", "clipboard");
        }

        return new StoreSettings(tmp, persist, env.get(ENV_HISTORY), env.containsKey(ENV_ALWAYS_PERSIST));
    }

    private static boolean nonBlank(String s) {
        return s != null && !s.isBlank();
    }

    public Path temporaryBase() {
        return temporaryBase;
    }

    public Path persistentBase() {
        return persistentBase;
    }

    /**
     * Raw retention string, empty when unset.
     */
    public String history() {
        return history;
    }

    public RetentionPolicy retentionPolicy() {
        return RetentionPolicy.parse(history);
    }

    public boolean alwaysPersist() {
        return alwaysPersist;
    }
}
