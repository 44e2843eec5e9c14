package com.quakesignal.engine.domain.service.baseline;

import com.quakesignal.engine.domain.model.CanonicalRecord;
import com.quakesignal.engine.domain.model.SeriesKey;

import java.util.List;

public interface HistoryAccessor {

    List<CanonicalRecord> fetch(SeriesKey key, long fromMs, long toMs);
}
