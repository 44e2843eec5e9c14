package com.quakesignal.engine.domain.model;

import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.SortedMap;
import java.util.stream.Collectors;

@Getter
@Builder
public class LinkedDataset {

    private final CatalogEvent event;
    private final List<LinkedStation> stations;
    private final SortedMap<SeriesKey, AlignedSeries> series;
    private final List<AlignedRow> rows;
    private final LinkSummary summary;

    public boolean isEmpty() {
        return stations.isEmpty() || series.isEmpty();
    }

    public List<AlignedSeries> seriesFor(String stationId, SourceType source) {
        return series.values().stream()
                .filter(s -> s.getKey().stationId().equals(stationId) && s.getKey().source() == source)
                .collect(Collectors.toList());
    }
}
