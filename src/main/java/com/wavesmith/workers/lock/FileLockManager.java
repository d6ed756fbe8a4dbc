package com.wavesmith.workers.lock;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wavesmith.core.cache.ContentHasher;
import com.wavesmith.core.metrics.WavesmithMetrics;
import com.wavesmith.core.persistence.PlanStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Exclusive, TTL-bounded locks stored as files under a locks directory.
 *
 * <p>A lock is taken by creating {@code <resource>.lock} with
 * {@link StandardOpenOption#CREATE_NEW}, so exactly one contender wins even
 * across processes. A lock past its TTL or older than the stale threshold is
 * considered abandoned: the first contender to rename it aside reclaims it.
 */
public class FileLockManager {

    private static final Logger log = LoggerFactory.getLogger(FileLockManager.class);

    private static final Pattern UNSAFE_CHARS = Pattern.compile("[^A-Za-z0-9._-]");
    private static final Duration POLL_INTERVAL = Duration.ofMillis(50);

    private final Path locksDir;
    private final Duration ttl;
    private final Duration staleThreshold;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final WavesmithMetrics metrics;

    public FileLockManager(Path locksDir, Duration ttl, Duration staleThreshold, Clock clock,
                           WavesmithMetrics metrics) {
        this.locksDir = locksDir;
        this.ttl = ttl;
        this.staleThreshold = staleThreshold;
        this.clock = clock;
        this.objectMapper = PlanStore.defaultMapper();
        this.metrics = metrics;
    }

    public FileLockManager(Path locksDir, Duration ttl, Duration staleThreshold) {
        this(locksDir, ttl, staleThreshold, Clock.systemUTC(), null);
    }

    /**
     * Takes the lock if it is free, already ours, or stale.
     *
     * @return true when {@code holderId} now holds the lock
     */
    public boolean tryAcquire(String resource, String holderId) {
        Path path = lockPath(resource);
        var record = new LockRecord(resource, holderId, clock.instant(), ttl.toMillis());
        try {
            Files.createDirectories(locksDir);
            if (create(path, record)) {
                log.debug("Lock on '{}' acquired by {}", resource, holderId);
                return true;
            }

            Optional<LockRecord> existing = read(path);
            if (existing.isEmpty()) {
                // released between our create and read
                return create(path, record);
            }
            LockRecord current = existing.get();
            if (current.holderId().equals(holderId)) {
                return true;
            }
            if (current.isStale(clock.instant(), staleThreshold) && reclaim(path, current)) {
                log.warn("Reclaimed stale lock on '{}' from {} (acquired {})",
                        resource, current.holderId(), current.acquiredAt());
                if (metrics != null) {
                    metrics.recordStaleLockReclaimed();
                }
                return create(path, record);
            }
            if (metrics != null) {
                metrics.recordLockContention(resource);
            }
            return false;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to acquire lock on " + resource, e);
        }
    }

    /**
     * Polls until the lock is acquired or {@code timeout} elapses.
     *
     * @throws LockAcquisitionTimeoutException if another holder kept the lock for the whole wait
     */
    public LockRecord acquire(String resource, String holderId, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            if (tryAcquire(resource, holderId)) {
                return holder(resource).orElseThrow(() ->
                        new IllegalStateException("Lock on '%s' vanished right after acquisition".formatted(resource)));
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                String current = holder(resource).map(LockRecord::holderId).orElse("unknown");
                throw new LockAcquisitionTimeoutException(resource, current, timeout);
            }
            Thread.sleep(Math.min(POLL_INTERVAL.toMillis(), Math.max(1, remaining / 1_000_000)));
        }
    }

    /**
     * Releases a lock held by {@code holderId}. The lock file is first renamed to
     * a tombstone and the holder checked there, so a lock that changed hands
     * after a stale reclaim is put back rather than deleted.
     *
     * @return false if the lock was not held by this holder
     */
    public boolean release(String resource, String holderId) {
        try {
            return releaseIfHeld(lockPath(resource), holderId);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to release lock on " + resource, e);
        }
    }

    /** Removes a lock regardless of its holder. Used when reaping a dead worker. */
    public boolean forceRelease(String resource) {
        boolean deleted = delete(lockPath(resource));
        if (deleted) {
            log.info("Force-released lock on '{}'", resource);
        }
        return deleted;
    }

    public boolean isStale(String resource) {
        return holder(resource).map(r -> r.isStale(clock.instant(), staleThreshold)).orElse(false);
    }

    public boolean isLocked(String resource) {
        return Files.exists(lockPath(resource));
    }

    public Optional<LockRecord> holder(String resource) {
        return read(lockPath(resource));
    }

    /** Releases every lock held by {@code holderId}. */
    public int releaseAll(String holderId) {
        if (!Files.isDirectory(locksDir)) {
            return 0;
        }
        int released = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(locksDir, "*.lock")) {
            for (Path path : stream) {
                Optional<LockRecord> record = read(path);
                if (record.isPresent() && record.get().holderId().equals(holderId) && releaseIfHeld(path, holderId)) {
                    released++;
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan " + locksDir, e);
        }
        return released;
    }

    Path lockPath(String resource) {
        String safe = UNSAFE_CHARS.matcher(resource).replaceAll("_");
        if (!safe.equals(resource)) {
            safe = safe + "-" + ContentHasher.sha256(resource).substring(0, 8);
        }
        return locksDir.resolve(safe + ".lock");
    }

    private boolean create(Path path, LockRecord record) throws IOException {
        try {
            Files.write(path, objectMapper.writeValueAsBytes(record),
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            return true;
        } catch (FileAlreadyExistsException e) {
            return false;
        }
    }

    /**
     * Renames the stale lock aside. Only one contender's rename can succeed.
     */
    private boolean reclaim(Path path, LockRecord stale) throws IOException {
        Optional<Path> aside = moveAside(path, "stale");
        if (aside.isEmpty()) {
            return false;
        }
        Optional<LockRecord> moved = read(aside.get());
        if (moved.isPresent() && !moved.get().equals(stale)) {
            // a fresh lock replaced the stale one before we moved it
            log.debug("Lock on '{}' changed hands during reclaim", stale.resource());
            restore(aside.get(), path);
            return false;
        }
        Files.deleteIfExists(aside.get());
        return true;
    }

    private boolean releaseIfHeld(Path path, String holderId) throws IOException {
        Optional<Path> tombstone = moveAside(path, "released");
        if (tombstone.isEmpty()) {
            return false;
        }
        Optional<LockRecord> moved = read(tombstone.get());
        if (moved.isEmpty() || !moved.get().holderId().equals(holderId)) {
            log.warn("{} tried to release lock {} held by {}", holderId, path.getFileName(),
                    moved.map(LockRecord::holderId).orElse("nobody"));
            restore(tombstone.get(), path);
            return false;
        }
        Files.deleteIfExists(tombstone.get());
        log.debug("Lock {} released by {}", path.getFileName(), holderId);
        return true;
    }

    /** Atomically renames {@code path} to a unique sibling, or empty if it is already gone. */
    private Optional<Path> moveAside(Path path, String suffix) throws IOException {
        Path aside = path.resolveSibling(path.getFileName() + "." + UUID.randomUUID() + "." + suffix);
        try {
            try {
                Files.move(path, aside, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(path, aside);
            }
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
        return Optional.of(aside);
    }

    /** Puts a moved lock back unless a newer lock took its place meanwhile. */
    private void restore(Path aside, Path path) throws IOException {
        try {
            Files.move(aside, path);
        } catch (FileAlreadyExistsException e) {
            log.debug("Lock {} was retaken before it could be restored", path.getFileName());
            Files.deleteIfExists(aside);
        }
    }

    private Optional<LockRecord> read(Path path) {
        try {
            byte[] bytes = Files.readAllBytes(path);
            if (bytes.length == 0) {
                return Optional.of(partialRecord(path));
            }
            return Optional.of(objectMapper.readValue(bytes, LockRecord.class));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Unreadable lock file {}: {}", path, e.getMessage());
            return Optional.of(partialRecord(path));
        }
    }

    /**
     * Stand-in for a lock file whose contents are not written yet, dated by the
     * file's modification time so it still goes stale eventually.
     */
    private LockRecord partialRecord(Path path) {
        Instant modified;
        try {
            modified = Files.getLastModifiedTime(path).toInstant();
        } catch (IOException e) {
            modified = clock.instant();
        }
        return new LockRecord(path.getFileName().toString(), "unknown", modified, ttl.toMillis());
    }

    private boolean delete(Path path) {
        try {
            return Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete lock " + path, e);
        }
    }
}
