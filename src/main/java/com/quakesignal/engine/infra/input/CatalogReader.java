package com.quakesignal.engine.infra.input;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quakesignal.engine.domain.exception.InvalidConfigurationException;
import com.quakesignal.engine.domain.model.CatalogEvent;
import com.quakesignal.engine.domain.service.run.RunProperties;
import com.quakesignal.engine.infra.artifact.ArtifactJson;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Slf4j
@Component
public class CatalogReader {

    public static final Comparator<CatalogEvent> CATALOG_ORDER = Comparator
            .comparing(CatalogEvent::originTime)
            .thenComparing(CatalogEvent::eventId);

    private final ObjectMapper mapper = ArtifactJson.mapper();

    public List<CatalogEvent> read(Path file) {
        try {
            List<RunProperties.EventSpec> specs = mapper.readValue(file.toFile(),
                    new TypeReference<List<RunProperties.EventSpec>>() {
                    });
            List<CatalogEvent> events = toCatalog(specs);
            log.info("[Input] 카탈로그 로드 완료: file={}, events={}", file, events.size());
            return events;
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read catalog " + file, e);
        }
    }

    public List<CatalogEvent> toCatalog(List<RunProperties.EventSpec> specs) {
        List<CatalogEvent> events = new ArrayList<>(specs.size());
        Set<String> seen = new HashSet<>();
        for (RunProperties.EventSpec spec : specs) {
            CatalogEvent event = spec.toEvent();
            if (!seen.add(event.eventId())) {
                throw new InvalidConfigurationException("duplicate event_id in catalog: " + event.eventId());
            }
            events.add(event);
        }
        events.sort(CATALOG_ORDER);
        return events;
    }
}
