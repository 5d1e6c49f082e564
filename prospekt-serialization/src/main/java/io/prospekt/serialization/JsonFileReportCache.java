package io.prospekt.serialization;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.prospekt.core.cache.CacheEntry;
import io.prospekt.core.cache.CacheIOException;
import io.prospekt.core.cache.ExpiryPolicy;
import io.prospekt.core.cache.ReportCache;
import io.prospekt.core.report.Report;
import io.prospekt.core.subject.Subject;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Logger;

/// Durable {@link ReportCache} backed by a single JSON file.
///
/// The whole cache is loaded into memory once at construction and every mutation writes
/// the full snapshot through to disk before returning. Lookups never touch the file.
///
/// ### Durability
/// Each write goes to a temporary file in the target directory which is then moved over
/// the cache file, atomically where the file system supports it. The temporary file is
/// forced to the device before the move, so a crash or power loss leaves either the old
/// or the new snapshot, never a truncated one.
///
/// ### Failure handling
/// - Missing file: starts empty
/// - Unreadable or corrupt file: starts empty and logs a warning; the next successful
///   write replaces the corrupt file
/// - Failed write: the in-memory index is rolled back and {@link CacheIOException} is
///   thrown
///
/// @implNote Thread-safe. Lookups share the read lock; mutations, including the disk
/// write, hold the write lock.
public final class JsonFileReportCache implements ReportCache {

    private static final Logger logger = Logger.getLogger(JsonFileReportCache.class.getName());

    private final Path file;
    private final ExpiryPolicy expiryPolicy;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final Map<String, CacheEntry> entries = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public JsonFileReportCache(Path file) {
        this(file, ExpiryPolicy.NEVER, Clock.systemUTC());
    }

    public JsonFileReportCache(Path file, ExpiryPolicy expiryPolicy, Clock clock) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.expiryPolicy = Objects.requireNonNull(expiryPolicy, "expiryPolicy must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.mapper = ReportSerializer.createMapper();
        load();
    }

    /// Returns the backing file.
    public Path getFile() {
        return file;
    }

    @Override
    public Optional<Report> lookup(Subject subject) {
        Objects.requireNonNull(subject, "subject must not be null");
        lock.readLock().lock();
        try {
            CacheEntry entry = entries.get(subject.key());
            if (entry == null || expiryPolicy.isExpired(entry, clock.instant())) {
                return Optional.empty();
            }
            return Optional.of(entry.report());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void insert(Subject subject, Report report) {
        Objects.requireNonNull(subject, "subject must not be null");
        Objects.requireNonNull(report, "report must not be null");
        lock.writeLock().lock();
        try {
            String key = subject.key();
            CacheEntry previous =
                    entries.put(key, new CacheEntry(key, report, clock.instant()));
            try {
                persist();
            } catch (CacheIOException e) {
                if (previous != null) {
                    entries.put(key, previous);
                } else {
                    entries.remove(key);
                }
                throw e;
            }
            logger.fine("Cached report for '" + key + "' in " + file);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean invalidate(Subject subject) {
        Objects.requireNonNull(subject, "subject must not be null");
        lock.writeLock().lock();
        try {
            CacheEntry removed = entries.remove(subject.key());
            if (removed == null) {
                return false;
            }
            try {
                persist();
            } catch (CacheIOException e) {
                entries.put(removed.key(), removed);
                throw e;
            }
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<CacheEntry> entries() {
        lock.readLock().lock();
        try {
            return live();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            Map<String, CacheEntry> snapshot = new HashMap<>(entries);
            entries.clear();
            try {
                persist();
            } catch (CacheIOException e) {
                entries.putAll(snapshot);
                throw e;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private List<CacheEntry> live() {
        return entries.values().stream()
                .filter(entry -> !expiryPolicy.isExpired(entry, clock.instant()))
                .sorted(Comparator.comparing(CacheEntry::key))
                .toList();
    }

    private void load() {
        if (!Files.exists(file)) {
            logger.fine("No cache file at " + file + ", starting empty");
            return;
        }
        try {
            CacheSnapshot snapshot = mapper.readValue(file.toFile(), CacheSnapshot.class);
            for (CacheEntry entry : snapshot.entries()) {
                entries.put(entry.key(), entry);
            }
            logger.info("Loaded " + entries.size() + " cached report(s) from " + file);
        } catch (IOException | RuntimeException e) {
            entries.clear();
            logger.warning(
                    "Ignoring unreadable cache file " + file + ": " + e.getMessage());
        }
    }

    // Caller holds the write lock.
    private void persist() {
        Path target = file.toAbsolutePath();
        Path directory = target.getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
            writeDurably(temp, mapper.writeValueAsBytes(CacheSnapshot.of(live())));
            try {
                Files.move(
                        temp,
                        target,
                        StandardCopyOption.ATOMIC_MOVE,
                        StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                logger.fine("Atomic move not supported for " + target + ", replacing in place");
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new CacheIOException("Failed to write cache file " + target, e);
        } finally {
            deleteQuietly(temp);
        }
    }

    /// Writes `content` to `path`, replacing its contents, and forces it to the device so
    /// the following move never publishes an empty file after a power loss.
    static void writeDurably(Path path, byte[] content) throws IOException {
        try (FileChannel channel =
                FileChannel.open(
                        path,
                        StandardOpenOption.CREATE,
                        StandardOpenOption.WRITE,
                        StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer buffer = ByteBuffer.wrap(content);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            logger.warning("Could not delete temporary cache file " + temp + ": " + e);
        }
    }
}
