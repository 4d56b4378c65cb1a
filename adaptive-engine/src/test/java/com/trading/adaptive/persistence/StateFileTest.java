package com.trading.adaptive.persistence;

import com.trading.adaptive.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("StateFile Tests")
class StateFileTest {

    record Sample(String name, Map<String, Double> values, Instant updated) {
    }

    @TempDir
    Path dir;

    private MutableClock clock;
    private StateFile<Sample> file;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-02T10:00:00Z");
        file = new StateFile<>(dir, "sample_state", 1, Sample.class, clock);
    }

    @Test
    @DisplayName("Should read back what was written")
    void shouldRoundTrip() {
        Sample sample = new Sample("risk", Map.of("BTC/USD", 1.25), clock.instant());

        file.write(sample);

        assertThat(file.read()).contains(sample);
        assertThat(file.path()).isEqualTo(dir.resolve("sample_state.json"));
        assertThat(Files.exists(dir.resolve("sample_state.json.tmp"))).isFalse();
    }

    @Test
    @DisplayName("Should wrap state in a versioned envelope")
    void shouldWriteEnvelope() throws IOException {
        file.write(new Sample("risk", Map.of(), clock.instant()));

        String json = Files.readString(file.path());
        assertThat(json).contains("\"schemaVersion\" : 1");
        assertThat(json).contains("\"savedAt\" : \"2026-03-02T10:00:00Z\"");
    }

    @Test
    @DisplayName("Should create a missing directory on write")
    void shouldCreateDirectory() {
        var nested = new StateFile<>(dir.resolve("a").resolve("b"), "nested", 1, Sample.class, clock);

        nested.write(new Sample("x", Map.of(), null));

        assertThat(nested.read()).isPresent();
    }

    @Test
    @DisplayName("Should treat a missing file as no state")
    void shouldHandleMissingFile() {
        assertThat(file.read()).isEmpty();
    }

    @Test
    @DisplayName("Should treat a corrupt file as no state")
    void shouldHandleCorruptFile() throws IOException {
        Files.writeString(file.path(), "{ not json");

        assertThat(file.read()).isEmpty();
    }

    @Test
    @DisplayName("Should ignore state written under another schema version")
    void shouldRejectOtherVersion() {
        new StateFile<>(dir, "sample_state", 2, Sample.class, clock)
            .write(new Sample("future", Map.of(), null));

        assertThat(file.read()).isEmpty();
    }

    @Test
    @DisplayName("Should replace the previous state on rewrite")
    void shouldReplace() {
        file.write(new Sample("first", Map.of(), null));
        file.write(new Sample("second", Map.of(), null));

        assertThat(file.read()).map(Sample::name).contains("second");
    }
}
