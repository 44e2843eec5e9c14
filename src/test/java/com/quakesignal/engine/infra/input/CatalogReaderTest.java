package com.quakesignal.engine.infra.input;

import com.quakesignal.engine.domain.exception.InvalidConfigurationException;
import com.quakesignal.engine.domain.model.CatalogEvent;
import com.quakesignal.engine.domain.service.run.RunProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CatalogReaderTest {

    private final CatalogReader reader = new CatalogReader();

    @Test
    void catalogIsOrderedByOriginTimeThenEventId(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("catalog.json");
        Files.writeString(file, """
                [
                  {"event_id": "E2", "time": "2023-01-02T00:00:00Z", "lat": 35.0, "lon": 139.0, "mag": 5.1},
                  {"event_id": "E1b", "time": "2023-01-01T00:00:00Z", "lat": 35.0, "lon": 139.0},
                  {"event_id": "E1a", "time": "2023-01-01T00:00:00Z", "lat": 36.0, "lon": 140.0, "depth_km": 12.5}
                ]
                """);

        List<CatalogEvent> events = reader.read(file);

        assertThat(events).extracting(CatalogEvent::eventId).containsExactly("E1a", "E1b", "E2");
        assertThat(events.get(0).depthKm()).isEqualTo(12.5);
        assertThat(events.get(1).mag()).isNull();
        assertThat(events.get(2).mag()).isEqualTo(5.1);
    }

    @Test
    void duplicateEventIdsAreRejected() {
        RunProperties.EventSpec first = spec("E1", "2023-01-01T00:00:00Z");
        RunProperties.EventSpec second = spec("E1", "2023-01-02T00:00:00Z");

        assertThatThrownBy(() -> reader.toCatalog(List.of(first, second)))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("E1");
    }

    @Test
    void unparseableOriginTimeIsAConfigurationError() {
        assertThatThrownBy(() -> reader.toCatalog(List.of(spec("E1", "yesterday"))))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("ISO-8601");
    }

    private static RunProperties.EventSpec spec(String id, String time) {
        RunProperties.EventSpec spec = new RunProperties.EventSpec();
        spec.setEventId(id);
        spec.setTime(time);
        spec.setLat(35.0);
        spec.setLon(139.0);
        return spec;
    }
}
