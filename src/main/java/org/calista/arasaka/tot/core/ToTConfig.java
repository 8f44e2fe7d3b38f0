package org.calista.arasaka.tot.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.arasaka.io.FileIO;
import org.calista.arasaka.tot.durable.CallPolicy;
import org.calista.arasaka.tot.model.SearchConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * ToTConfig: POJO конфиг процесса:
 * - дефолты в полях
 * - loadOrCreate() создаёт файл, если его нет
 * - validate() нормализует значения (clamp), а не падает
 *
 * Параметры отдельного поиска (SearchConfig) строго валидируются при submit; здесь только дефолты.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ToTConfig {

    private static final Logger log = LoggerFactory.getLogger(ToTConfig.class);

    public String baseDir = "data";
    public Store store = new Store();
    public Search search = new Search();
    public Calls calls = new Calls();
    public Pool pool = new Pool();
    public Collaborators collaborators = new Collaborators();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Store {
        public String searchesDir = "searches";
        public String archiveDir = "archive";
        /** fsync journal appends and checkpoint writes. */
        public boolean fsyncOnCommit = true;
    }

    /** Defaults for submissions without their own SearchConfig. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Search {
        public int maxDepth = SearchConfig.DEFAULT_MAX_DEPTH;
        public int branchesPerNode = SearchConfig.DEFAULT_BRANCHES_PER_NODE;
        public int beamWidth = SearchConfig.DEFAULT_BEAM_WIDTH;
        public double minScoreThreshold = SearchConfig.DEFAULT_MIN_SCORE_THRESHOLD;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Calls {
        public int maxAttempts = 4;
        public long initialIntervalMs = 2000;
        public double backoffMultiplier = 2.0;
        public long maxIntervalMs = 30_000;
        public long timeoutMs = 120_000;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Pool {
        /** Max concurrent collaborator attempts. 0 => auto. */
        public int parallelism = 0;
        public String threadNamePrefix = "tot-call-";
        public long shutdownTimeoutMs = 2500;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Collaborators {
        /** "scripted": generator/evaluator answers come from {@link #scriptFile}. */
        public String kind = "scripted";
        /** Relative to baseDir. */
        public String scriptFile = "collaborators.json";
    }

    // -------------------- Load / Create --------------------

    /**
     * Загружает конфиг. Если файла нет (или он пустой), создаёт дефолтный и пишет на диск.
     */
    public static ToTConfig loadOrCreate(FileIO io, Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        String json;
        try {
            json = io.readString(configFile);
        } catch (NoSuchFileException e) {
            ToTConfig created = new ToTConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.info("Config file not found. Created default config at {}", configFile);
            return created;
        }

        if (json == null || json.isBlank()) {
            ToTConfig created = new ToTConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.warn("Config file {} is empty. Recreated defaults.", configFile);
            return created;
        }

        ToTConfig cfg = mapper.readValue(json, ToTConfig.class);
        if (cfg == null) cfg = new ToTConfig();

        cfg.validate();
        return cfg;
    }

    public static void save(FileIO io, Path configFile, ObjectMapper mapper, ToTConfig cfg) throws IOException {
        Objects.requireNonNull(cfg, "cfg");
        cfg.validate();
        writePretty(io, configFile, mapper, cfg);
    }

    private static void writePretty(FileIO io, Path configFile, ObjectMapper mapper, ToTConfig cfg) throws IOException {
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
        io.writeString(configFile, out + System.lineSeparator());
    }

    // -------------------- Validation / Normalization --------------------

    public void validate() {
        if (baseDir == null || baseDir.isBlank()) baseDir = "data";

        if (store == null) store = new Store();
        if (store.searchesDir == null || store.searchesDir.isBlank()) store.searchesDir = "searches";
        if (store.archiveDir == null || store.archiveDir.isBlank()) store.archiveDir = "archive";
        if (store.archiveDir.equals(store.searchesDir)) {
            log.warn("store.archiveDir equals store.searchesDir ({}); using 'archive'", store.searchesDir);
            store.archiveDir = store.searchesDir.equals("archive") ? "archive-done" : "archive";
        }

        if (search == null) search = new Search();
        if (search.maxDepth < 1) search.maxDepth = 1;
        if (search.branchesPerNode < 1) search.branchesPerNode = 1;
        if (search.beamWidth < 1) search.beamWidth = 1;
        if (!Double.isFinite(search.minScoreThreshold)) search.minScoreThreshold = SearchConfig.DEFAULT_MIN_SCORE_THRESHOLD;
        if (search.minScoreThreshold < 0.0) search.minScoreThreshold = 0.0;
        if (search.minScoreThreshold > 1.0) search.minScoreThreshold = 1.0;

        if (calls == null) calls = new Calls();
        if (calls.maxAttempts < 1) calls.maxAttempts = 1;
        if (calls.initialIntervalMs < 1) calls.initialIntervalMs = 1;
        if (!Double.isFinite(calls.backoffMultiplier) || calls.backoffMultiplier < 1.0) calls.backoffMultiplier = 1.0;
        if (calls.maxIntervalMs < calls.initialIntervalMs) calls.maxIntervalMs = calls.initialIntervalMs;
        if (calls.timeoutMs < 1) calls.timeoutMs = 1;

        if (pool == null) pool = new Pool();
        if (pool.parallelism < 0) pool.parallelism = 0;
        if (pool.threadNamePrefix == null || pool.threadNamePrefix.isBlank()) pool.threadNamePrefix = "tot-call-";
        if (pool.shutdownTimeoutMs < 250) pool.shutdownTimeoutMs = 250;

        if (collaborators == null) collaborators = new Collaborators();
        if (collaborators.kind == null || collaborators.kind.isBlank()) collaborators.kind = "scripted";
        collaborators.kind = collaborators.kind.trim().toLowerCase(Locale.ROOT);
        if (collaborators.scriptFile == null || collaborators.scriptFile.isBlank()) {
            collaborators.scriptFile = "collaborators.json";
        }
    }

    // -------------------- Views --------------------

    public SearchConfig toSearchConfig() {
        return SearchConfig.of(search.maxDepth, search.branchesPerNode, search.beamWidth, search.minScoreThreshold);
    }

    public CallPolicy toCallPolicy() {
        return new CallPolicy(
                calls.maxAttempts,
                Duration.ofMillis(calls.initialIntervalMs),
                calls.backoffMultiplier,
                Duration.ofMillis(calls.maxIntervalMs),
                Duration.ofMillis(calls.timeoutMs)
        );
    }
}
