package org.calista.arasaka.tot.durable;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.arasaka.io.FileIO;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * CallJournal: append-only record of committed call outcomes of one search.
 *
 * <p>
 * Формат: JSONL, первой строкой {"_schema":"tot-journal-v1"}, далее один {@link JournalEntry} на строку.
 * Запись с fsync (FileIO.appendLine), commit возвращается только после того, как строка на диске.
 * </p>
 *
 * <p>
 * Загрузка: недописанная последняя строка (crash во время append) отбрасывается с warning,
 * любая другая битая строка означает потерю целостности и даёт {@link SubstrateException}.
 * </p>
 */
public final class CallJournal {

    private static final Logger log = LogManager.getLogger(CallJournal.class);

    public static final String SCHEMA = "tot-journal-v1";
    private static final String SCHEMA_LINE = "{\"_schema\":\"" + SCHEMA + "\"}";

    private final FileIO io;
    private final ObjectMapper mapper;
    private final Path file;

    private final Map<String, JournalEntry> committed = new LinkedHashMap<>();
    private boolean headerWritten;

    private CallJournal(FileIO io, ObjectMapper mapper, Path file) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.file = Objects.requireNonNull(file, "file");
    }

    /**
     * Opens the journal, loading every committed entry. Missing file = empty journal.
     */
    public static CallJournal open(FileIO io, ObjectMapper mapper, Path file) {
        CallJournal j = new CallJournal(io, mapper, file);
        j.load();
        return j;
    }

    public Path file() {
        return file;
    }

    public synchronized JournalEntry lookup(CallKey key) {
        return committed.get(key.id());
    }

    public synchronized boolean contains(CallKey key) {
        return committed.containsKey(key.id());
    }

    public synchronized int size() {
        return committed.size();
    }

    /**
     * Durably appends {@code entry}. First commit for a key wins; a second one is ignored.
     *
     * @throws SubstrateException if the line cannot be written
     */
    public synchronized void commit(JournalEntry entry) {
        Objects.requireNonNull(entry, "entry");
        if (committed.containsKey(entry.key)) {
            log.warn("journal: duplicate commit ignored key={}", entry.key);
            return;
        }
        try {
            if (!headerWritten) {
                io.appendJsonl(file, SCHEMA_LINE);
                headerWritten = true;
            }
            io.appendJsonl(file, mapper.writeValueAsString(entry));
        } catch (IOException e) {
            throw new SubstrateException("journal append failed: " + file, e);
        }
        committed.put(entry.key, entry);
        log.debug("journal: commit key={} ok={} attempts={}", entry.key, entry.ok, entry.attempts);
    }

    private void load() {
        FileIO.JsonlSnapshot snap;
        try {
            snap = io.readJsonlSnapshot(file);
        } catch (IOException e) {
            throw new SubstrateException("journal unreadable: " + file, e);
        }

        List<String> lines = snap.records;
        boolean tornSkipped = false;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            boolean torn = i == lines.size() - 1 && !snap.lastRecordComplete;

            if (line.contains("\"_schema\"")) {
                if (torn) {
                    tornSkipped = true;
                    continue;
                }
                checkSchema(line);
                headerWritten = true;
                continue;
            }

            JournalEntry e;
            try {
                e = mapper.readValue(line, JournalEntry.class);
            } catch (IOException parseErr) {
                if (torn) {
                    log.warn("journal: skip torn last record file={} ({} chars)", file, line.length());
                    tornSkipped = true;
                    continue;
                }
                throw new SubstrateException("journal corrupt at record " + (i + 1) + ": " + file, parseErr);
            }
            if (e == null || e.key == null || e.kind == null) {
                throw new SubstrateException("journal record " + (i + 1) + " has no key: " + file);
            }
            committed.putIfAbsent(e.key, e);
        }

        if (!snap.lastRecordComplete) {
            repairTail(lines, tornSkipped);
        }
        if (!committed.isEmpty()) {
            log.info("journal: loaded {} committed calls from {}", committed.size(), file);
        }
    }

    private void checkSchema(String line) {
        try {
            String v = mapper.readTree(line).path("_schema").asText("");
            if (!SCHEMA.equals(v)) {
                throw new SubstrateException("journal schema mismatch: expected " + SCHEMA + ", got '" + v + "': " + file);
            }
        } catch (IOException e) {
            throw new SubstrateException("journal header unreadable: " + file, e);
        }
    }

    /**
     * Rewrites the file so later appends start on a clean line: the torn record is dropped,
     * a complete record that only lost its newline is kept.
     */
    private void repairTail(List<String> lines, boolean dropLast) {
        StringBuilder sb = new StringBuilder();
        if (!headerWritten && !committed.isEmpty()) {
            sb.append(SCHEMA_LINE).append('\n');
            headerWritten = true;
        }
        int keep = dropLast ? lines.size() - 1 : lines.size();
        for (int i = 0; i < keep; i++) {
            String l = lines.get(i);
            if (!l.contains("\"_schema\"") || headerWritten) sb.append(l).append('\n');
        }
        try {
            io.writeString(file, sb.toString());
        } catch (IOException e) {
            throw new SubstrateException("journal tail repair failed: " + file, e);
        }
    }
}
