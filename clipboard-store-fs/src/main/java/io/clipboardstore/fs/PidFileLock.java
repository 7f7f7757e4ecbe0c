package io.clipboardstore.fs;

import io.clipboardstore.spi.ClipboardLock;
import io.clipboardstore.spi.LockOutcome;
import io.clipboardstore.spi.Pause;
import io.clipboardstore.spi.ProcessProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * {@link ClipboardLock} over a readable record holding the owner's decimal pid.
 *
 * <p>Acquisition:
 * <ol>
 *   <li>no record: write our pid</li>
 *   <li>record names a process in our group: already held, nothing written</li>
 *   <li>otherwise poll every {@link #POLL_INTERVAL} until the holder is gone or the record was removed,
 *       then write our pid</li>
 * </ol>
 *
 * <p>A record whose content is not a pid is treated as stale and replaced. Without a wait budget the
 * caller waits for as long as the holder runs.
 */
public final class PidFileLock implements ClipboardLock {

    private static final Logger LOG = LoggerFactory.getLogger(PidFileLock.class);

    public static final Duration POLL_INTERVAL = Duration.ofMillis(100);

    private final Path record;
    private final ProcessProbe probe;
    private final Pause pause;
    private final Duration pollInterval;

    public PidFileLock(Path record, ProcessProbe probe) {
        this(record, probe, Pause.threadSleep(), POLL_INTERVAL);
    }

    public PidFileLock(Path record, ProcessProbe probe, Pause pause) {
        this(record, probe, pause, POLL_INTERVAL);
    }

    public PidFileLock(Path record, ProcessProbe probe, Pause pause, Duration pollInterval) {
        this.record = Objects.requireNonNull(record, "record");
        this.probe = Objects.requireNonNull(probe, "probe");
        this.pause = Objects.requireNonNull(pause, "pause");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
    }

    @Override
    public LockOutcome acquire() throws IOException, InterruptedException {
        return acquireWithin(null);
    }

    @Override
    public LockOutcome acquire(Duration maxWait) throws IOException, InterruptedException {
        Objects.requireNonNull(maxWait, "maxWait");
        return acquireWithin(maxWait);
    }

    private LockOutcome acquireWithin(Duration maxWait) throws IOException, InterruptedException {
        Optional<String> content = readRecord();
        if (content.isEmpty()) {
            writeRecord();
            LOG.debug("Lock {} acquired by {}", record, probe.currentPid());
            return new LockOutcome(LockOutcome.Status.ACQUIRED, null, 0);
        }

        OptionalLong parsed = parsePid(content.get());
        if (parsed.isEmpty()) {
            LOG.warn("Lock record {} holds no pid ({} chars); replacing it", record, content.get().length());
            writeRecord();
            return new LockOutcome(LockOutcome.Status.TAKEN_OVER, null, 0);
        }

        long holder = parsed.getAsLong();
        if (probe.sharesProcessGroup(holder)) {
            LOG.debug("Lock {} held by {} in our process group", record, holder);
            return new LockOutcome(LockOutcome.Status.REENTERED, holder, 0);
        }

        int polls = 0;
        Duration waited = Duration.ZERO;
        while (true) {
            if (!probe.isAlive(holder)) {
                LOG.info("Lock holder {} of {} has exited; taking over", holder, record);
                writeRecord();
                return new LockOutcome(LockOutcome.Status.TAKEN_OVER, holder, polls);
            }
            if (!isLocked()) {
                writeRecord();
                LOG.debug("Lock {} released by {} after {} polls", record, holder, polls);
                return new LockOutcome(LockOutcome.Status.ACQUIRED, holder, polls);
            }
            if (maxWait != null && waited.compareTo(maxWait) >= 0) {
                LOG.debug("Gave up on lock {} held by {} after {}", record, holder, waited);
                return new LockOutcome(LockOutcome.Status.TIMED_OUT, holder, polls);
            }
            pause.sleep(pollInterval);
            polls++;
            waited = waited.plus(pollInterval);
        }
    }

    @Override
    public boolean release() throws IOException {
        Optional<String> content = readRecord();
        if (content.isEmpty()) return false;
        OptionalLong holder = parsePid(content.get());
        if (holder.isEmpty() || holder.getAsLong() != probe.currentPid()) return false;
        return Files.deleteIfExists(record);
    }

    @Override
    public boolean isLocked() {
        return Files.exists(record);
    }

    /**
     * Pid currently recorded, if the record exists and parses.
     */
    public OptionalLong holder() throws IOException {
        Optional<String> content = readRecord();
        return content.isEmpty() ? OptionalLong.empty() : parsePid(content.get());
    }

    private Optional<String> readRecord() throws IOException {
        try {
            return Optional.of(Files.readString(record, StandardCharsets.ISO_8859_1));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
    }

    static OptionalLong parsePid(String content) {
        String trimmed = content.trim();
        if (trimmed.isEmpty()) return OptionalLong.empty();
        try {
            long pid = Long.parseLong(trimmed);
            return pid > 0 ? OptionalLong.of(pid) : OptionalLong.empty();
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    // readers never observe a half-written pid
    private void writeRecord() throws IOException {
        Files.createDirectories(record.getParent());
        Path tmp = record.resolveSibling(record.getFileName() + "." + probe.currentPid() + ".tmp");
        Files.writeString(tmp, Long.toString(probe.currentPid()), StandardCharsets.US_ASCII);
        try {
            Files.move(tmp, record, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, record, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
