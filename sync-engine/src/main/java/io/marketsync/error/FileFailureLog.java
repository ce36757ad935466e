package io.marketsync.error;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.marketsync.sync.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;

/**
 * Appends one JSON line per failed subject.
 */
public class FileFailureLog implements FailureLog {
    private static final Logger log = LoggerFactory.getLogger(FileFailureLog.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    private final Path file;
    private final Clock clock;

    public FileFailureLog(Path file) throws IOException { this(file, Clock.systemUTC()); }

    public FileFailureLog(Path file, Clock clock) throws IOException {
        this.file = file;
        this.clock = clock;
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        if (!Files.exists(file)) {
            Files.writeString(file, "", StandardCharsets.UTF_8, StandardOpenOption.CREATE);
        }
    }

    @Override
    public synchronized void record(WorkItem item, Exception error) {
        ObjectNode line = JSON.createObjectNode()
                .put("ts", clock.instant().toString())
                .put("subject", item.subjectId())
                .put("priority", item.priority().name())
                .put("rangeStart", String.valueOf(item.rangeStart()))
                .put("rangeEnd", String.valueOf(item.rangeEnd()))
                .put("attempts", item.attemptCount())
                .put("errorType", error.getClass().getSimpleName())
                .put("error", String.valueOf(error.getMessage()));
        try {
            Files.writeString(file, line.toString() + System.lineSeparator(), StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.warn("could not append failure of {} to {}: {}", item.subjectId(), file, e.toString());
        }
    }

    public Path file() { return file; }
}
