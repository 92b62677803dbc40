package com.kiln.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link LedgerStore} backed by {@code <projectRoot>/ledger/events.jsonl}: one complete JSON object per line.
 * A line that does not parse (e.g. truncated by a crash mid-write) is logged and skipped on replay.
 */
public final class JsonLinesLedgerStore implements LedgerStore {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesLedgerStore.class);

    public static final String LEDGER_DIR = "ledger";
    public static final String EVENTS_FILE = "events.jsonl";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path eventsFile;
    private final Object writeLock = new Object();

    public JsonLinesLedgerStore(Path projectRoot) {
        this.eventsFile = projectRoot.resolve(LEDGER_DIR).resolve(EVENTS_FILE);
    }

    public Path getEventsFile() {
        return eventsFile;
    }

    @Override
    public void append(LedgerEvent event) {
        String line;
        try {
            line = MAPPER.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Ledger event is not serializable: " + event, e);
        }
        synchronized (writeLock) {
            try {
                Files.createDirectories(eventsFile.getParent());
                try (BufferedWriter w = Files.newBufferedWriter(eventsFile, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                    w.write(line);
                    w.write('\n');
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to append ledger event to " + eventsFile, e);
            }
        }
    }

    @Override
    public List<LedgerEvent> readAll() {
        List<LedgerEvent> events = new ArrayList<>();
        if (!Files.exists(eventsFile)) {
            return events;
        }
        synchronized (writeLock) {
            try (BufferedReader r = Files.newBufferedReader(eventsFile, StandardCharsets.UTF_8)) {
                String line;
                int lineNo = 0;
                while ((line = r.readLine()) != null) {
                    lineNo++;
                    if (line.isBlank()) continue;
                    try {
                        events.add(MAPPER.readValue(line, LedgerEvent.class));
                    } catch (JsonProcessingException e) {
                        log.warn("Skipping unreadable ledger line | file={} | line={} | error={}", eventsFile, lineNo, e.getOriginalMessage());
                    }
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read ledger " + eventsFile, e);
            }
        }
        return events;
    }
}
