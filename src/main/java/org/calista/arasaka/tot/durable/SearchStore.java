package org.calista.arasaka.tot.durable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.arasaka.io.FileIO;
import org.calista.arasaka.tot.model.SearchOutcome;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Directory layout of durable searches.
 *
 * <pre>
 * baseDir/searchesDir/&lt;id&gt;/checkpoint.json   in-flight
 * baseDir/searchesDir/&lt;id&gt;/journal.jsonl
 * baseDir/archiveDir/&lt;id&gt;/outcome.json      finished (plus the two files above)
 * </pre>
 *
 * A search is in flight while its directory sits under searchesDir. Archiving writes
 * outcome.json first and then moves the directory, so a crash in between leaves a search
 * that resumes into its stored outcome.
 */
public final class SearchStore {

    private static final Logger log = LogManager.getLogger(SearchStore.class);

    public static final String CHECKPOINT_FILE = "checkpoint.json";
    public static final String JOURNAL_FILE = "journal.jsonl";
    public static final String OUTCOME_FILE = "outcome.json";

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,127}");

    private final FileIO io;
    private final ObjectMapper mapper;
    private final Path searchesDir;
    private final Path archiveDir;

    public SearchStore(FileIO io, ObjectMapper mapper, String searchesDir, String archiveDir) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.searchesDir = io.resolve(searchesDir);
        this.archiveDir = io.resolve(archiveDir);
        try {
            io.createDirectories(this.searchesDir);
            io.createDirectories(this.archiveDir);
        } catch (IOException e) {
            throw new SubstrateException("cannot create store directories under " + io.baseDir(), e);
        }
    }

    public static void checkSearchId(String searchId) {
        if (searchId == null || !SAFE_ID.matcher(searchId).matches()) {
            throw new IllegalArgumentException("invalid search id: " + searchId);
        }
    }

    public Path searchDir(String searchId) {
        checkSearchId(searchId);
        return searchesDir.resolve(searchId);
    }

    public Path archiveDir(String searchId) {
        checkSearchId(searchId);
        return archiveDir.resolve(searchId);
    }

    public boolean isInFlight(String searchId) {
        return io.exists(searchDir(searchId).resolve(CHECKPOINT_FILE));
    }

    public boolean isArchived(String searchId) {
        return io.exists(archiveDir(searchId).resolve(OUTCOME_FILE));
    }

    public CheckpointStore checkpoints(String searchId) {
        return new CheckpointStore(io, mapper, searchDir(searchId).resolve(CHECKPOINT_FILE));
    }

    /** Read-only view of the last checkpoint of an archived search. */
    public CheckpointStore archivedCheckpoints(String searchId) {
        return new CheckpointStore(io, mapper, archiveDir(searchId).resolve(CHECKPOINT_FILE));
    }

    public CallJournal journal(String searchId) {
        return CallJournal.open(io, mapper, searchDir(searchId).resolve(JOURNAL_FILE));
    }

    /** Ids of searches with a checkpoint and no archive entry, sorted. */
    public List<String> inFlightIds() {
        List<Path> dirs;
        try {
            dirs = io.listDirectories(searchesDir);
        } catch (IOException e) {
            throw new SubstrateException("cannot list " + searchesDir, e);
        }
        ArrayList<String> out = new ArrayList<>();
        for (Path d : dirs) {
            String id = d.getFileName().toString();
            if (!SAFE_ID.matcher(id).matches()) continue;
            if (io.exists(d.resolve(CHECKPOINT_FILE))) out.add(id);
        }
        return out;
    }

    /** Outcome of a search left between "outcome written" and "moved to archive". */
    public Optional<SearchOutcome> pendingOutcome(String searchId) {
        return readOutcome(searchDir(searchId).resolve(OUTCOME_FILE));
    }

    public Optional<SearchOutcome> archivedOutcome(String searchId) {
        return readOutcome(archiveDir(searchId).resolve(OUTCOME_FILE));
    }

    /**
     * Writes outcome.json and moves the search directory into the archive.
     *
     * @throws SubstrateException on any I/O failure
     */
    public void archive(SearchOutcome outcome) {
        Objects.requireNonNull(outcome, "outcome");
        String id = outcome.searchId;
        Path src = searchDir(id);
        Path dst = archiveDir(id);
        try {
            io.writeString(src.resolve(OUTCOME_FILE), mapper.writeValueAsString(outcome));
            if (io.exists(dst)) {
                throw new SubstrateException("archive entry already exists: " + dst);
            }
            io.moveDirectory(src, dst);
        } catch (JsonProcessingException e) {
            throw new SubstrateException("outcome serialization failed: " + id, e);
        } catch (IOException e) {
            throw new SubstrateException("archive failed: " + id, e);
        }
        log.info("store: archived search={} status={}", id, outcome.status);
    }

    private Optional<SearchOutcome> readOutcome(Path file) {
        try {
            Optional<String> raw = io.readStringIfExists(file);
            if (raw.isEmpty()) return Optional.empty();
            return Optional.of(mapper.readValue(raw.get(), SearchOutcome.class));
        } catch (IOException e) {
            throw new SubstrateException("outcome unreadable: " + file, e);
        }
    }
}
