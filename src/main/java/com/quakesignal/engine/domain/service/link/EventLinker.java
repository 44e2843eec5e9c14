package com.quakesignal.engine.domain.service.link;

import com.quakesignal.engine.domain.model.AlignedPoint;
import com.quakesignal.engine.domain.model.AlignedRow;
import com.quakesignal.engine.domain.model.AlignedSeries;
import com.quakesignal.engine.domain.model.CanonicalRecord;
import com.quakesignal.engine.domain.model.CatalogEvent;
import com.quakesignal.engine.domain.model.LinkState;
import com.quakesignal.engine.domain.model.LinkSummary;
import com.quakesignal.engine.domain.model.LinkedDataset;
import com.quakesignal.engine.domain.model.LinkedStation;
import com.quakesignal.engine.domain.model.SeriesKey;
import com.quakesignal.engine.domain.model.SourceType;
import com.quakesignal.engine.domain.model.Station;
import com.quakesignal.engine.domain.model.StationMatch;
import com.quakesignal.engine.domain.service.align.AlignProperties;
import com.quakesignal.engine.domain.service.align.GridSpec;
import com.quakesignal.engine.domain.service.align.SourcePolicy;
import com.quakesignal.engine.domain.service.align.TimeAligner;
import com.quakesignal.engine.domain.service.feature.WaveformWindowReducer;
import com.quakesignal.engine.domain.service.signal.SamplingIntervals;
import com.quakesignal.engine.domain.service.spatial.SpatialIndex;
import com.quakesignal.engine.domain.service.spatial.StationHit;
import com.quakesignal.engine.domain.service.run.RunContext;
import com.quakesignal.engine.infra.store.StandardizedStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

@Slf4j
@Service
@RequiredArgsConstructor
public class EventLinker {

    private final LinkProperties linkProperties;
    private final AlignProperties alignProperties;
    private final TimeAligner aligner;
    private final WaveformWindowReducer reducer;

    public LinkedDataset link(CatalogEvent event, StandardizedStore store, SpatialIndex index, RunContext context) {
        LinkState state = LinkState.PENDING;
        List<String> notes = new ArrayList<>();

        List<StationHit> hits = index.query(event.lat(), event.lon(), linkProperties.getRadiusKm());
        state = advance(event, state);

        long t0 = event.originTimeMs();
        long windowStart = t0 - linkProperties.beforeMs();
        long windowEnd = t0 + linkProperties.afterMs();
        GridSpec grid = GridSpec.covering(windowStart, windowEnd, alignProperties.gridStepMs());
        state = advance(event, state);

        if (hits.isEmpty()) {
            notes.add(String.format(Locale.ROOT, "no stations within %.1f km of epicenter (%.4f, %.4f)",
                    linkProperties.getRadiusKm(), event.lat(), event.lon()));
            log.info("[Link] 공간 후보 없음: event={}, radiusKm={}", event.eventId(), linkProperties.getRadiusKm());
        }

        List<LinkedStation> stations = new ArrayList<>(hits.size());
        SortedMap<SeriesKey, AlignedSeries> series = new TreeMap<>();
        for (StationHit hit : hits) {
            Station station = hit.station();
            Set<SourceType> present = EnumSet.noneOf(SourceType.class);
            StationMatch match = null;
            for (SourceType source : SourceType.values()) {
                List<CanonicalRecord> records = store.query(source, station.stationId(), windowStart, windowEnd);
                if (records.isEmpty()) continue;
                present.add(source);
                if (match == null) {
                    match = records.get(0).getQualityFlags().getStationMatch();
                }
                alignSource(records, grid, alignProperties.policyFor(source), series, notes);
            }
            stations.add(LinkedStation.builder()
                    .stationId(station.stationId())
                    .lat(station.lat())
                    .lon(station.lon())
                    .elevM(station.elevM())
                    .distanceKm(hit.distanceKm())
                    .stationMatch(match != null ? match : StationMatch.EXACT)
                    .sources(List.copyOf(present))
                    .build());
        }
        if (!hits.isEmpty() && series.isEmpty()) {
            notes.add(String.format(Locale.ROOT, "no standardized records overlap window [%s, %s] for %d candidate station(s)",
                    Instant.ofEpochMilli(windowStart), Instant.ofEpochMilli(windowEnd), hits.size()));
            log.info("[Link] 시간 구간 내 데이터 없음: event={}, candidates={}", event.eventId(), hits.size());
        }
        state = advance(event, state);

        List<AlignedRow> rows = new ArrayList<>();
        for (AlignedSeries aligned : series.values()) {
            for (AlignedPoint point : aligned.getPoints()) {
                rows.add(AlignedRow.of(aligned.getKey(), aligned.getMethod(), point));
            }
        }
        LinkSummary summary = summarize(event, grid, windowStart, windowEnd, stations, series, rows, notes, context);
        state = advance(event, state);
        state = advance(event, state);

        log.info("[Link] 이벤트 연결 완료: event={}, state={}, stations={}, series={}, rows={}, joinCoverage={}",
                event.eventId(), state, stations.size(), series.size(), rows.size(),
                String.format(Locale.ROOT, "%.3f", summary.getJoinCoverage()));
        return LinkedDataset.builder()
                .event(event)
                .stations(Collections.unmodifiableList(stations))
                .series(Collections.unmodifiableSortedMap(series))
                .rows(Collections.unmodifiableList(rows))
                .summary(summary)
                .build();
    }

    public List<AlignedSeries> alignWindow(String stationId, SourceType source, long windowStart, long windowEnd,
                                           StandardizedStore store) {
        List<CanonicalRecord> records = store.query(source, stationId, windowStart, windowEnd);
        if (records.isEmpty()) return List.of();
        GridSpec grid = GridSpec.covering(windowStart, windowEnd, alignProperties.gridStepMs());
        SortedMap<SeriesKey, AlignedSeries> series = new TreeMap<>();
        alignSource(records, grid, alignProperties.policyFor(source), series, new ArrayList<>());
        return new ArrayList<>(series.values());
    }

    private void alignSource(List<CanonicalRecord> records, GridSpec grid, SourcePolicy policy,
                             SortedMap<SeriesKey, AlignedSeries> out, List<String> notes) {
        SortedMap<SeriesKey, List<CanonicalRecord>> byChannel = new TreeMap<>();
        for (CanonicalRecord record : records) {
            byChannel.computeIfAbsent(record.seriesKey(), k -> new ArrayList<>()).add(record);
        }

        SortedMap<SeriesKey, List<CanonicalRecord>> alignable = new TreeMap<>();
        for (Map.Entry<SeriesKey, List<CanonicalRecord>> entry : byChannel.entrySet()) {
            SeriesKey key = entry.getKey();
            List<CanonicalRecord> channel = entry.getValue();
            long[] ts = channel.stream().mapToLong(CanonicalRecord::getTsMs).toArray();
            long nativeInterval = SamplingIntervals.medianIntervalMs(ts);
            if (!aligner.isRawWaveform(key, nativeInterval, policy)) {
                alignable.putIfAbsent(key, channel);
                continue;
            }
            List<CanonicalRecord> derived = reducer.reduce(channel, grid.stepMs());
            notes.add(String.format(Locale.ROOT, "%s reduced from %d ms samples to %d ms windows",
                    key, nativeInterval, grid.stepMs()));
            for (CanonicalRecord record : derived) {
                SeriesKey derivedKey = record.seriesKey();
                if (byChannel.containsKey(derivedKey)) continue;
                alignable.computeIfAbsent(derivedKey, k -> new ArrayList<>()).add(record);
            }
        }

        for (Map.Entry<SeriesKey, List<CanonicalRecord>> entry : alignable.entrySet()) {
            out.put(entry.getKey(), aligner.align(entry.getKey(), entry.getValue(), grid, policy));
        }
    }

    private LinkSummary summarize(CatalogEvent event, GridSpec grid, long windowStart, long windowEnd,
                                  List<LinkedStation> stations, SortedMap<SeriesKey, AlignedSeries> series,
                                  List<AlignedRow> rows, List<String> notes, RunContext context) {
        int present = (int) rows.stream().filter(r -> !r.isMissing()).count();
        double coverage = rows.isEmpty() ? 0.0 : (double) present / rows.size();

        return LinkSummary.builder()
                .eventId(event.eventId())
                .state(LinkState.DONE)
                .windowStartMs(windowStart)
                .windowEndMs(windowEnd)
                .gridStepMs(grid.stepMs())
                .gridSize(grid.size())
                .stationCount(stations.size())
                .seriesCount(series.size())
                .rowCount(rows.size())
                .presentRows(present)
                .coverage(coverage)
                .missingRate(1.0 - coverage)
                .joinCoverage(joinCoverage(grid, series))
                .notes(List.copyOf(notes))
                .parameters(parameters(grid))
                .paramsHash(context.paramsHash())
                .build();
    }

    double joinCoverage(GridSpec grid, SortedMap<SeriesKey, AlignedSeries> series) {
        int size = grid.size();
        if (size == 0) return 0.0;
        List<Set<SourceType>> sourcesAt = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            sourcesAt.add(EnumSet.noneOf(SourceType.class));
        }
        for (AlignedSeries aligned : series.values()) {
            List<AlignedPoint> points = aligned.getPoints();
            for (int i = 0; i < points.size() && i < size; i++) {
                if (points.get(i).isPresent()) {
                    sourcesAt.get(i).add(aligned.getKey().source());
                }
            }
        }
        long joined = sourcesAt.stream().filter(s -> s.size() >= 2).count();
        return (double) joined / size;
    }

    private SortedMap<String, Object> parameters(GridSpec grid) {
        SortedMap<String, Object> params = new TreeMap<>();
        params.put("window_before_hours", linkProperties.getWindowBeforeHours());
        params.put("window_after_hours", linkProperties.getWindowAfterHours());
        params.put("radius_km", linkProperties.getRadiusKm());
        params.put("grid_step_ms", grid.stepMs());
        params.put("grid_start_ms", grid.startMs());
        params.put("grid_end_ms", grid.endMs());
        params.put("reindex_tolerance_ms", alignProperties.getReindexToleranceMs());
        params.put("raw_waveform_interval_ms", alignProperties.getRawWaveformIntervalMs());
        return Collections.unmodifiableSortedMap(params);
    }

    private LinkState advance(CatalogEvent event, LinkState state) {
        LinkState next = state.next();
        log.debug("[Link] 상태 전이: event={}, {} → {}", event.eventId(), state, next);
        return next;
    }
}
