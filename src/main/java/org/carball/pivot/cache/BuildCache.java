package org.carball.pivot.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.pivot.model.analysis.TargetLanguage;
import org.carball.pivot.model.synthesis.CacheEntry;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * Content-addressed store of compiled binaries.
 *
 * <p>Binaries live under {@code objects/<first two hash chars>/<hash>/}. Entries are
 * immutable and published only after their binary is in place. The index file is
 * rewritten through a temporary file and an atomic move, so a crash leaves either the old
 * or the new index on disk. Each rewrite merges the entries already on disk, so caches
 * opened on the same directory do not drop each other's entries.
 *
 * <p>The cache owns the {@link HashLockTable} that serializes builds per hash. Every
 * synthesis sharing this instance therefore compiles a given hash at most once.
 */
@Slf4j
public class BuildCache implements Closeable {

    static final String INDEX_FILE = "index.json";
    private static final String OBJECTS_DIR = "objects";

    // Index rewrites are serialized per cache directory across instances in this JVM
    private static final Map<Path, Object> INDEX_LOCKS = new ConcurrentHashMap<>();

    private final Path root;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    // Hashes this instance removed; not merged back from the on-disk index
    private final Set<String> removed = ConcurrentHashMap.newKeySet();
    private final HashLockTable locks = new HashLockTable();
    private final Object indexLock;

    private volatile boolean open;

    public BuildCache(Path root) {
        this(root, Clock.systemUTC());
    }

    public BuildCache(Path root, Clock clock) {
        this.root = root;
        this.clock = clock;
        this.indexLock = INDEX_LOCKS.computeIfAbsent(root.toAbsolutePath().normalize(), key -> new Object());

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Creates the cache directories and loads the index. An unreadable index is logged and
     * the cache starts empty.
     */
    public BuildCache open() throws IOException {
        Files.createDirectories(root.resolve(OBJECTS_DIR));

        Path index = root.resolve(INDEX_FILE);
        if (Files.exists(index)) {
            try {
                readIndex(index).forEach(entry -> entries.put(entry.hash(), entry));
                log.info("Opened build cache at {} with {} entries", root, entries.size());
            } catch (IOException e) {
                log.warn("Build cache index {} is unreadable, starting empty: {}", index, e.getMessage());
            }
        } else {
            log.info("Created build cache at {}", root);
        }

        open = true;
        return this;
    }

    public Path root() {
        return root;
    }

    /**
     * Locks a content hash for building. The lock is reentrant and must be released by
     * closing the handle.
     */
    public HashLockTable.Handle lock(String hash) {
        return locks.acquire(hash);
    }

    /**
     * Returns the entry for a hash if its binary is intact. A corrupt entry is removed and
     * reported as a miss.
     */
    public Optional<CacheEntry> lookup(String hash) {
        ensureOpen();
        CacheEntry entry = entries.get(hash);
        if (entry == null) {
            return Optional.empty();
        }

        Path binary = Path.of(entry.binaryPath());
        if (!Files.isRegularFile(binary) || !Files.isReadable(binary)) {
            log.warn("Build cache entry {} is corrupt (binary missing or unreadable: {}), removing it",
                    shortHash(hash), binary);
            evict(hash, entry);
            return Optional.empty();
        }

        log.debug("Cache hit for {}", shortHash(hash));
        return Optional.of(entry);
    }

    public boolean contains(String hash) {
        return lookup(hash).isPresent();
    }

    /**
     * Moves a freshly built binary into the store and publishes its entry.
     */
    public CacheEntry insert(String hash, Path builtBinary, TargetLanguage target,
                             String profileId, String toolchainVersion, String targetTriple) throws IOException {
        ensureOpen();
        Path directory = objectDirectory(hash);
        Files.createDirectories(directory);

        Path destination = directory.resolve(builtBinary.getFileName().toString());
        Path staging = directory.resolve(destination.getFileName() + ".tmp");
        Files.copy(builtBinary, staging, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
        moveAtomically(staging, destination);

        CacheEntry entry = new CacheEntry(
                hash,
                destination.toAbsolutePath().toString(),
                target,
                profileId,
                toolchainVersion,
                targetTriple,
                Files.size(destination),
                clock.instant());

        removed.remove(hash);
        entries.put(hash, entry);
        writeIndex();

        log.debug("Cached {} ({} bytes) for target {}", shortHash(hash), entry.sizeBytes(), target.getId());
        return entry;
    }

    /**
     * Removes entries created before {@code now - maxAge}.
     *
     * @return number of entries removed
     */
    public int collectGarbage(Duration maxAge) throws IOException {
        ensureOpen();
        Instant cutoff = clock.instant().minus(maxAge);

        List<String> stale = entries.values().stream()
                .filter(entry -> entry.createdAt().isBefore(cutoff))
                .map(CacheEntry::hash)
                .toList();

        for (String hash : stale) {
            try (HashLockTable.Handle ignored = locks.acquire(hash)) {
                removed.add(hash);
                entries.remove(hash);
                deleteDirectory(objectDirectory(hash));
            }
        }

        if (!stale.isEmpty()) {
            writeIndex();
            log.info("Removed {} stale cache entries older than {}", stale.size(), maxAge);
        }
        return stale.size();
    }

    public int size() {
        return entries.size();
    }

    public long totalSizeBytes() {
        return entries.values().stream().mapToLong(CacheEntry::sizeBytes).sum();
    }

    public List<CacheEntry> entries() {
        List<CacheEntry> snapshot = new ArrayList<>(entries.values());
        snapshot.sort(Comparator.comparing(CacheEntry::createdAt));
        return snapshot;
    }

    @Override
    public void close() throws IOException {
        if (open) {
            writeIndex();
            open = false;
            log.debug("Closed build cache at {}", root);
        }
    }

    /**
     * Removes {@code corrupt} only if it is still the published entry for its hash. A
     * rebuilt entry inserted in the meantime is left alone.
     */
    private void evict(String hash, CacheEntry corrupt) {
        try (HashLockTable.Handle ignored = locks.acquire(hash)) {
            AtomicBoolean evicted = new AtomicBoolean();
            entries.computeIfPresent(hash, (key, current) -> {
                if (current == corrupt) {
                    evicted.set(true);
                    return null;
                }
                return current;
            });
            if (!evicted.get()) {
                log.debug("Cache entry {} was rebuilt concurrently, keeping it", shortHash(hash));
                return;
            }

            removed.add(hash);
            deleteDirectory(objectDirectory(hash));
            writeIndex();
        } catch (IOException e) {
            log.warn("Failed to clean up cache entry {}: {}", shortHash(hash), e.getMessage());
        }
    }

    private void writeIndex() throws IOException {
        synchronized (indexLock) {
            Path index = root.resolve(INDEX_FILE);
            mergeIndex(index);

            Path temp = Files.createTempFile(root, INDEX_FILE, ".tmp");
            try {
                objectMapper.writeValue(temp.toFile(), entries());
                moveAtomically(temp, index);
            } finally {
                Files.deleteIfExists(temp);
            }
        }
    }

    // Picks up entries another cache instance published since this one was opened
    private void mergeIndex(Path index) {
        if (!Files.exists(index)) {
            return;
        }
        try {
            for (CacheEntry stored : readIndex(index)) {
                if (!removed.contains(stored.hash())) {
                    entries.putIfAbsent(stored.hash(), stored);
                }
            }
        } catch (IOException e) {
            log.warn("Could not merge build cache index {}: {}", index, e.getMessage());
        }
    }

    private List<CacheEntry> readIndex(Path index) throws IOException {
        return objectMapper.readValue(index.toFile(), new TypeReference<>() {
        });
    }

    private Path objectDirectory(String hash) {
        return root.resolve(OBJECTS_DIR).resolve(hash.substring(0, 2)).resolve(hash);
    }

    private void ensureOpen() {
        if (!open) {
            throw new IllegalStateException("Build cache at " + root + " is not open");
        }
    }

    private static void moveAtomically(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteDirectory(Path directory) throws IOException {
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }

    static String shortHash(String hash) {
        return hash.length() > 12 ? hash.substring(0, 12) : hash;
    }
}
