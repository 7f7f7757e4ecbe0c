package io.clipboardstore.fs;

import io.clipboardstore.spi.ProcessProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * {@link ProcessProbe} backed by {@link ProcessHandle} and, for process groups, {@code /proc/<pid>/stat}.
 *
 * <p>Where {@code /proc} is not available, two processes are only considered to share a group when
 * they are the same process.
 */
public final class ProcessHandleProbe implements ProcessProbe {

    private static final Logger LOG = LoggerFactory.getLogger(ProcessHandleProbe.class);
    private static final Path DEFAULT_PROC = Path.of("/proc");
    // state, ppid, pgrp follow the parenthesized command name
    private static final int PGRP_FIELD = 2;

    private final Path procRoot;
    private final long currentPid;

    public ProcessHandleProbe() {
        this(DEFAULT_PROC, ProcessHandle.current().pid());
    }

    ProcessHandleProbe(Path procRoot, long currentPid) {
        this.procRoot = Objects.requireNonNull(procRoot, "procRoot");
        this.currentPid = currentPid;
    }

    @Override
    public long currentPid() {
        return currentPid;
    }

    @Override
    public boolean isAlive(long pid) {
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }

    @Override
    public boolean sharesProcessGroup(long pid) {
        if (pid == currentPid) return true;
        OptionalLong ours = processGroupOf(currentPid);
        OptionalLong theirs = processGroupOf(pid);
        if (ours.isEmpty() || theirs.isEmpty()) return false;
        return ours.getAsLong() == theirs.getAsLong();
    }

    OptionalLong processGroupOf(long pid) {
        Path stat = procRoot.resolve(Long.toString(pid)).resolve("stat");
        if (!Files.isReadable(stat)) return OptionalLong.empty();
        try {
            String content = Files.readString(stat, StandardCharsets.US_ASCII);
            int close = content.lastIndexOf(')');
            if (close < 0) return OptionalLong.empty();
            String[] fields = content.substring(close + 1).trim().split("\\s+");
            if (fields.length <= PGRP_FIELD) return OptionalLong.empty();
            return OptionalLong.of(Long.parseLong(fields[PGRP_FIELD]));
        } catch (IOException | NumberFormatException e) {
            LOG.debug("No process group for pid {}: {}", pid, e.toString());
            return OptionalLong.empty();
        }
    }
}
