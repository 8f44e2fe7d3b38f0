package org.calista.arasaka.tot.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.arasaka.io.FileIO;
import org.calista.arasaka.tot.durable.CallPolicy;
import org.calista.arasaka.tot.model.SearchConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ToTConfigTest {

    @TempDir
    Path dir;

    private final ObjectMapper mapper = ToTKernel.Builder.defaultMapper();

    @Test
    void missingFileIsCreatedWithDefaults() throws Exception {
        FileIO io = new FileIO(dir);
        Path file = dir.resolve("tot.json");

        ToTConfig cfg = ToTConfig.loadOrCreate(io, file, mapper);

        assertTrue(Files.exists(file));
        assertEquals("data", cfg.baseDir);
        assertEquals(SearchConfig.defaults(), cfg.toSearchConfig());
        assertEquals("scripted", cfg.collaborators.kind);
    }

    @Test
    void outOfRangeValuesAreClamped() throws Exception {
        FileIO io = new FileIO(dir);
        Path file = dir.resolve("tot.json");
        Files.writeString(file, "{"
                + "\"search\":{\"maxDepth\":0,\"beamWidth\":-2,\"minScoreThreshold\":3.0},"
                + "\"calls\":{\"maxAttempts\":0,\"backoffMultiplier\":0.2,\"initialIntervalMs\":50,\"maxIntervalMs\":10},"
                + "\"store\":{\"searchesDir\":\"same\",\"archiveDir\":\"same\"},"
                + "\"collaborators\":{\"kind\":\" Scripted \"},"
                + "\"somethingNew\":true}");

        ToTConfig cfg = ToTConfig.loadOrCreate(io, file, mapper);

        SearchConfig sc = cfg.toSearchConfig();
        assertEquals(1, sc.maxDepth);
        assertEquals(1, sc.beamWidth);
        assertEquals(1.0, sc.minScoreThreshold);

        CallPolicy p = cfg.toCallPolicy();
        assertEquals(1, p.maxAttempts);
        assertEquals(1.0, p.backoffMultiplier);
        assertEquals(Duration.ofMillis(50), p.maxInterval);

        assertNotEquals(cfg.store.searchesDir, cfg.store.archiveDir);
        assertEquals("scripted", cfg.collaborators.kind);
    }

    @Test
    void saveThenLoadKeepsValues() throws Exception {
        FileIO io = new FileIO(dir);
        Path file = dir.resolve("tot.json");
        ToTConfig cfg = new ToTConfig();
        cfg.search.beamWidth = 5;
        cfg.calls.timeoutMs = 1234;

        ToTConfig.save(io, file, mapper, cfg);
        ToTConfig back = ToTConfig.loadOrCreate(io, file, mapper);

        assertEquals(5, back.search.beamWidth);
        assertEquals(Duration.ofMillis(1234), back.toCallPolicy().timeout);
    }
}
