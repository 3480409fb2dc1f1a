package io.turnstile.core.observability;

import java.io.IOException;
import java.nio.file.Path;

public interface MetricsStore {
    /**
     * Persists the snapshot and returns where it was written.
     */
    Path save(MetricsSnapshot snapshot) throws IOException;

    MetricsSnapshot load(Path path) throws IOException;
}
