package com.plughub.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.Objects;

/**
 * {@link PluginRepository} kept in one JSON document. Every mutation rewrites the file through a
 * temporary sibling and an atomic rename, so readers never see a half-written file.
 */
public final class JsonFilePluginRepository extends InMemoryPluginRepository {

    private static final Logger log = LoggerFactory.getLogger(JsonFilePluginRepository.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Path file;

    private JsonFilePluginRepository(Path file, Clock clock, RepositoryState initial) {
        super(clock, initial);
        this.file = file;
    }

    /**
     * Opens the repository, reading {@code file} if it exists; the file is created on the first write.
     *
     * @throws RepositoryException if the file exists but cannot be read or parsed
     */
    public static JsonFilePluginRepository open(Path file) {
        return open(file, Clock.systemUTC());
    }

    public static JsonFilePluginRepository open(Path file, Clock clock) {
        Objects.requireNonNull(file, "file");
        RepositoryState state = read(file);
        log.info("Plugin repository opened: {} ({} plugins)", file, state.plugins.size());
        return new JsonFilePluginRepository(file, clock, state);
    }

    public Path getFile() {
        return file;
    }

    @Override
    void persist(RepositoryState state) {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            MAPPER.writeValue(tmp.toFile(), state);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new RepositoryException("Cannot write plugin repository " + file + ": " + e.getMessage(), e);
        }
    }

    private static RepositoryState read(Path file) {
        if (!Files.exists(file)) {
            return new RepositoryState();
        }
        try {
            RepositoryState state = MAPPER.readValue(file.toFile(), RepositoryState.class);
            return state != null ? state : new RepositoryState();
        } catch (IOException e) {
            throw new RepositoryException("Cannot read plugin repository " + file + ": " + e.getMessage(), e);
        }
    }
}
