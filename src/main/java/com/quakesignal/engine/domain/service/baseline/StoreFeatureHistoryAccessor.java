package com.quakesignal.engine.domain.service.baseline;

import com.quakesignal.engine.domain.model.AlignedSeries;
import com.quakesignal.engine.domain.model.SourceType;
import com.quakesignal.engine.domain.service.feature.FeatureExtractor;
import com.quakesignal.engine.domain.service.link.EventLinker;
import com.quakesignal.engine.infra.store.StandardizedStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class StoreFeatureHistoryAccessor implements FeatureHistoryAccessor {

    static final String HISTORY_EVENT_ID = "history";

    private final StandardizedStore store;
    private final EventLinker linker;
    private final FeatureExtractor extractor;

    @Override
    public Map<String, Double> features(String stationId, SourceType source, long fromMs, long toMs) {
        List<AlignedSeries> series = linker.alignWindow(stationId, source, fromMs, toMs, store);
        if (series.isEmpty()) return Map.of();
        return extractor.extract(HISTORY_EVENT_ID, stationId, source, series).asMap();
    }
}
