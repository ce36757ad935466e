package io.marketsync.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.marketsync.core.SeriesRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * One JSON file per fingerprint under a directory. Files are written to a temp name and moved into place,
 * so readers never see a half-written entry.
 */
public class FileDurableTier implements DurableTier {
    private static final Logger log = LoggerFactory.getLogger(FileDurableTier.class);
    private static final String SUFFIX = ".json";

    private final Path dir;
    private final ObjectMapper json;

    public FileDurableTier(Path dir) throws IOException {
        this.dir = dir;
        this.json = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        Files.createDirectories(dir);
    }

    public Path directory() { return dir; }

    @Override
    public Optional<CacheEntry> read(String fingerprint) throws IOException {
        Path file = fileFor(fingerprint);
        try (InputStream in = Files.newInputStream(file)) {
            return Optional.of(json.readValue(in, StoredEntry.class).toEntry());
        } catch (NoSuchFileException e) {
            return Optional.empty(); // never written, or removed by another worker
        } catch (JsonProcessingException e) {
            log.warn("discarding unreadable cache file {}: {}", file, e.getOriginalMessage());
            Files.deleteIfExists(file);
            return Optional.empty();
        }
    }

    @Override
    public void write(CacheEntry entry) throws IOException {
        Path target = fileFor(entry.fingerprint());
        Path tmp = Files.createTempFile(dir, entry.fingerprint(), ".tmp");
        try {
            json.writeValue(tmp.toFile(), StoredEntry.of(entry));
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    @Override
    public void delete(String fingerprint) throws IOException {
        Files.deleteIfExists(fileFor(fingerprint));
    }

    @Override
    public int compact(Instant now) throws IOException {
        int removed = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "*" + SUFFIX)) {
            for (Path f : files) {
                String name = f.getFileName().toString();
                Optional<CacheEntry> e = read(name.substring(0, name.length() - SUFFIX.length()));
                if (e.isEmpty()) {
                    removed++; // unreadable, already deleted by read
                } else if (e.get().isExpired(now)) {
                    Files.deleteIfExists(f);
                    removed++;
                }
            }
        }
        return removed;
    }

    @Override
    public void clear() throws IOException {
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "*" + SUFFIX)) {
            for (Path f : files) Files.deleteIfExists(f);
        }
    }

    private Path fileFor(String fingerprint) {
        return dir.resolve(fingerprint + SUFFIX);
    }

    record StoredEntry(String fingerprint, long createdAtMillis, long ttlMillis, List<SeriesRow> payload) {
        static StoredEntry of(CacheEntry e) {
            return new StoredEntry(e.fingerprint(), e.createdAt().toEpochMilli(), e.ttl().toMillis(), e.payload());
        }

        CacheEntry toEntry() {
            return new CacheEntry(fingerprint, payload, Instant.ofEpochMilli(createdAtMillis), Duration.ofMillis(ttlMillis), CacheTier.DURABLE);
        }
    }
}
