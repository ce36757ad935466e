package io.marketsync.financial;

import io.marketsync.core.DataSource;
import io.marketsync.core.SeriesRow;
import io.marketsync.error.FetchException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

public class MarketSyncMainTest {
    @TempDir
    Path dir;

    private final String db = "jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    /** Five daily bars ending today; "BAD" fails without retry. */
    private static final DataSource FAKE = (subjectId, category, start, end) -> {
        if (subjectId.equals("BAD")) throw new FetchException("unknown symbol " + subjectId);
        List<SeriesRow> rows = new ArrayList<>();
        LocalDate today = LocalDate.now();
        for (int i = 4; i >= 0; i--) rows.add(new SeriesRow(subjectId, today.minusDays(i), Map.of("close", 10.0 + i)));
        return rows;
    };

    private int run(String... args) {
        MarketSyncMain main = new MarketSyncMain();
        main.overrides = binder -> binder.bind(DataSource.class).toInstance(FAKE);
        main.out = new PrintStream(out, true, StandardCharsets.UTF_8);
        main.err = main.out;
        return new CommandLine(main).execute(args);
    }

    private String output() { return out.toString(StandardCharsets.UTF_8); }

    @Test
    void syncs_then_finds_everything_current() throws Exception {
        String cache = dir.resolve("cache").toString();
        assertEquals(0, run("--ticker", "AAA,BBB", "--db", db, "--cache-dir", cache, "--workers", "2"));
        assertTrue(output().contains("2 attempted, 2 succeeded, 0 failed, 0 skipped via cache"), output());

        JdbcPriceStore store = new JdbcPriceStore(db, "daily_bars");
        assertEquals(5, store.countRows("AAA"));
        assertEquals(5, store.countRows("BBB"));

        assertEquals(0, run("--ticker", "AAA,BBB", "--db", db, "--cache-dir", cache));
        assertTrue(output().contains("0 attempted"), output());
    }

    @Test
    void failed_ticker_exits_with_one_and_is_logged() throws Exception {
        Path failures = dir.resolve("failed.jsonl");
        int code = run("-t", "AAA", "-t", "BAD", "--db", db, "--cache-dir", dir.resolve("cache").toString(),
                "--failure-log", failures.toString(), "--calendar", "nyse");

        assertEquals(1, code);
        assertTrue(output().contains("failed: [BAD]"), output());
        assertTrue(Files.readString(failures).contains("\"subject\":\"BAD\""));
    }

    @Test
    void unreachable_database_exits_with_two() {
        int code = run("-t", "AAA", "--db", "jdbc:nosuchdriver:x", "--cache-dir", dir.resolve("cache").toString());

        assertEquals(2, code);
        assertTrue(output().contains("Sync could not start"), output());
        assertTrue(output().contains("daily_bars"), output());
        assertFalse(output().contains("attempted"), output());
    }

    @Test
    void volatile_cache_leaves_no_files() {
        Path cache = dir.resolve("cache");
        assertEquals(0, run("-t", "AAA", "--db", db, "--cache-dir", cache.toString(), "--volatile-cache"));
        assertFalse(Files.exists(cache));
    }

    @Test
    void bad_arguments_exit_with_two() {
        assertEquals(2, run("-t", "AAA", "--db", db, "--workers", "0"));
        assertEquals(2, run("-t", "AAA", "--db", db, "--calendar", "lunar"));
        assertEquals(2, run("--db", db));
    }
}
