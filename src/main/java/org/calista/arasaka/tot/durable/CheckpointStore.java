package org.calista.arasaka.tot.durable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.arasaka.io.FileIO;
import org.calista.arasaka.tot.model.SearchState;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * CheckpointStore: persist/load the {@link SearchState} of one search.
 *
 * <p>
 * Формат: один JSON документ {@code checkpoint.json}.
 * Пишем атомарно через FileIO (tmp + move + fsync): после crash на диске либо старый, либо новый checkpoint.
 * </p>
 */
public final class CheckpointStore {

    private final FileIO io;
    private final ObjectMapper mapper;
    private final Path file;

    public CheckpointStore(FileIO io, ObjectMapper mapper, Path file) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.file = Objects.requireNonNull(file, "file");
    }

    public Path file() {
        return file;
    }

    /**
     * @throws SubstrateException if the checkpoint cannot be made durable
     */
    public void save(SearchState state) {
        Objects.requireNonNull(state, "state");
        String json;
        try {
            json = mapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new SubstrateException("checkpoint serialization failed: " + state.searchId, e);
        }
        try {
            io.writeString(file, json);
        } catch (IOException e) {
            throw new SubstrateException("checkpoint write failed: " + file, e);
        }
    }

    /**
     * @return last durable state, empty when no checkpoint was ever written
     * @throws SubstrateException if the file exists but cannot be read back
     */
    public Optional<SearchState> load() {
        Optional<String> raw;
        try {
            raw = io.readStringIfExists(file);
        } catch (IOException e) {
            throw new SubstrateException("checkpoint unreadable: " + file, e);
        }
        if (raw.isEmpty()) return Optional.empty();

        try {
            SearchState s = mapper.readValue(raw.get(), SearchState.class);
            if (s == null || s.searchId == null || s.config == null) {
                throw new SubstrateException("checkpoint incomplete: " + file);
            }
            return Optional.of(s);
        } catch (IOException e) {
            throw new SubstrateException("checkpoint corrupt: " + file, e);
        }
    }
}
