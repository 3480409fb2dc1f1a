package io.turnstile.core.observability;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Writes one pretty-printed JSON file per export, named after the export time.
 */
public final class FileMetricsStore implements MetricsStore {
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss")
        .withZone(ZoneOffset.UTC);

    private final Path directory;
    private final ObjectMapper mapper;

    public FileMetricsStore(Path directory) {
        this.directory = directory;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public synchronized Path save(MetricsSnapshot snapshot) throws IOException {
        Files.createDirectories(directory);
        Path path = directory.resolve("metrics-" + FILE_STAMP.format(snapshot.exportedAt()) + ".json");
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        return path;
    }

    @Override
    public synchronized MetricsSnapshot load(Path path) throws IOException {
        return mapper.readValue(Files.readString(path), MetricsSnapshot.class);
    }
}
