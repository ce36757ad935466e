package io.marketsync.cache;

import io.marketsync.core.SeriesRow;
import io.marketsync.testsupport.ScriptedSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class FileDurableTierTest {
    @TempDir
    Path dir;

    @Test
    void entries_survive_a_new_instance() throws Exception {
        List<SeriesRow> rows = ScriptedSource.rows("MSFT", LocalDate.of(2024, 5, 1), 2);
        Instant created = Instant.parse("2024-05-03T12:00:00Z");
        new FileDurableTier(dir).write(new CacheEntry("abc", rows, created, Duration.ofDays(7), CacheTier.DURABLE));

        Optional<CacheEntry> read = new FileDurableTier(dir).read("abc");
        assertTrue(read.isPresent());
        assertEquals(rows, read.get().payload());
        assertEquals(created, read.get().createdAt());
        assertEquals(Duration.ofDays(7), read.get().ttl());
        assertEquals(CacheTier.DURABLE, read.get().tier());
    }

    @Test
    void corrupt_file_is_discarded() throws Exception {
        FileDurableTier tier = new FileDurableTier(dir);
        Files.writeString(dir.resolve("bad.json"), "{not json");

        assertTrue(tier.read("bad").isEmpty());
        assertFalse(Files.exists(dir.resolve("bad.json")));
    }

    @Test
    void missing_file_reads_as_absent() throws Exception {
        FileDurableTier tier = new FileDurableTier(dir);
        tier.write(new CacheEntry("gone", List.of(), Instant.now(), Duration.ofHours(1), CacheTier.DURABLE));
        Files.delete(dir.resolve("gone.json"));

        assertTrue(tier.read("gone").isEmpty());
        assertTrue(tier.read("never-written").isEmpty());
    }

    @Test
    void clear_empties_directory() throws Exception {
        FileDurableTier tier = new FileDurableTier(dir);
        tier.write(new CacheEntry("a", List.of(), Instant.now(), Duration.ofHours(1), CacheTier.DURABLE));
        tier.write(new CacheEntry("b", List.of(), Instant.now(), Duration.ofHours(1), CacheTier.DURABLE));
        tier.clear();
        try (var files = Files.list(dir)) {
            assertEquals(0, files.count());
        }
    }
}
