package io.turnstile.core.observability;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileMetricsStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldWriteSnapshotThatLoadsBack() throws Exception {
        Instant now = Instant.parse("2026-03-01T12:34:56Z");
        ProtocolMonitor monitor = new ProtocolMonitor(Clock.fixed(now, ZoneOffset.UTC));
        monitor.record(new TurnRecord(
            "s-1", now, 0, 1, List.of("analyze_product"), false, "", 42,
            TurnOutcome.COMPLETED, ProtocolClassification.VIOLATED, null));
        FileMetricsStore store = new FileMetricsStore(tempDir.resolve("metrics"));

        Path path = store.save(monitor.exportMetrics());

        assertThat(path.getFileName().toString()).isEqualTo("metrics-20260301-123456.json");
        assertThat(Files.readString(path)).contains("\"exportedAt\" : \"2026-03-01T12:34:56Z\"");
        MetricsSnapshot loaded = store.load(path);
        assertThat(loaded.exportedAt()).isEqualTo(now);
        assertThat(loaded.sessions().get("s-1").violationCount()).isEqualTo(1);
        assertThat(loaded.turns()).singleElement()
            .satisfies(turn -> assertThat(turn.classification()).isEqualTo(ProtocolClassification.VIOLATED));
        assertThat(loaded.summary().totalToolInvocations()).isEqualTo(1);
        try (Stream<Path> files = Files.list(tempDir.resolve("metrics"))) {
            assertThat(files).hasSize(1);
        }
    }
}
