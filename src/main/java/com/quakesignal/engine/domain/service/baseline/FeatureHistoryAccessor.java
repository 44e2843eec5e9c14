package com.quakesignal.engine.domain.service.baseline;

import com.quakesignal.engine.domain.model.SourceType;

import java.util.Map;

public interface FeatureHistoryAccessor {

    Map<String, Double> features(String stationId, SourceType source, long fromMs, long toMs);
}
