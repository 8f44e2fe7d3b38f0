package org.calista.arasaka.tot.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.arasaka.io.FileIO;
import org.calista.arasaka.tot.durable.SearchStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Objects;

/**
 * ToTKernel: instance-owned runtime container.
 *
 * Lifecycle:
 *   1) build(configFile) -> loadOrCreate config + FileIO(baseDir) + SearchStore
 *   2) compose           -> ToTComposer builds collaborators and TreeOfThoughts
 *   3) close()           -> nothing owned beyond files today
 *
 * No statics singletons: lifecycle is explicit.
 */
public final class ToTKernel implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ToTKernel.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final ToTConfig cfg;
    private final SearchStore store;

    private ToTKernel(FileIO io, ObjectMapper mapper, ToTConfig cfg, SearchStore store) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.store = Objects.requireNonNull(store, "store");
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private Charset charset = StandardCharsets.UTF_8;

        /**
         * Root directory where config lives.
         * Config is read BEFORE baseDir is known (baseDir is inside config).
         */
        private Path configRoot = Path.of(".");

        private ObjectMapper mapper;

        public Builder charset(Charset charset) {
            this.charset = Objects.requireNonNull(charset, "charset");
            return this;
        }

        public Builder configRoot(Path configRoot) {
            this.configRoot = Objects.requireNonNull(configRoot, "configRoot");
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        public ToTKernel build(Path configFile) throws IOException {
            Objects.requireNonNull(configFile, "configFile");

            ObjectMapper om = (this.mapper != null) ? this.mapper : defaultMapper();

            // Config IO (outside baseDir)
            FileIO external = new FileIO(configRoot, charset, true);
            Path cfgPath = configFile.isAbsolute() ? configFile : configRoot.resolve(configFile);
            ToTConfig cfg = ToTConfig.loadOrCreate(external, cfgPath, om);

            // relative baseDir is resolved against configRoot, not the working directory
            Path base = Path.of(cfg.baseDir);
            if (!base.isAbsolute()) base = configRoot.resolve(base);

            FileIO io = new FileIO(base, FileIO.Options.builder()
                    .charset(charset)
                    .atomicWrites(true)
                    .fsyncOnCommit(cfg.store.fsyncOnCommit)
                    .build());
            io.ensureBaseDir();

            SearchStore store = new SearchStore(io, om, cfg.store.searchesDir, cfg.store.archiveDir);

            ToTKernel k = new ToTKernel(io, om, cfg, store);
            k.logCreated(cfgPath);
            return k;
        }

        static ObjectMapper defaultMapper() {
            ObjectMapper om = new ObjectMapper();
            om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            return om;
        }
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public FileIO io() { return io; }
    public ObjectMapper mapper() { return mapper; }
    public ToTConfig config() { return cfg; }
    public SearchStore store() { return store; }

    @Override
    public void close() {
        log.debug("ToTKernel closed: baseDir={}", io.baseDir());
    }

    private void logCreated(Path cfgPath) {
        if (!log.isInfoEnabled()) return;
        log.info("ToTKernel created: config={}, baseDir={}, inFlight={}",
                cfgPath, io.baseDir(), store.inFlightIds().size());
    }
}
