package com.quakesignal.engine.domain.service.baseline;

import com.quakesignal.engine.domain.model.BaselineMethod;
import com.quakesignal.engine.domain.model.BaselineWindow;
import com.quakesignal.engine.domain.model.CanonicalRecord;
import com.quakesignal.engine.domain.model.SeriesKey;
import com.quakesignal.engine.domain.model.SourceType;
import com.quakesignal.engine.domain.service.link.LinkProperties;
import com.quakesignal.engine.domain.service.signal.RobustStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

@Slf4j
@Component
@RequiredArgsConstructor
public class BaselineSelector {

    static final long MS_PER_HOUR = 3_600_000L;
    static final long MS_PER_DAY = 24 * MS_PER_HOUR;

    private final BaselineProperties properties;
    private final LinkProperties linkProperties;

    public BaselineWindow select(SeriesKey key, long t0Ms, HistoryAccessor history) {
        return prepare(key, t0Ms, history).windowAt(t0Ms);
    }

    // same-hour fallback is keyed by the UTC hour of each scored timestamp
    public SeriesBaseline prepare(SeriesKey key, long t0Ms, HistoryAccessor history) {
        long primaryFrom = t0Ms - (linkProperties.getWindowBeforeHours() + properties.getExtraHours()) * MS_PER_HOUR;
        long primaryTo = t0Ms - properties.getGapHours() * MS_PER_HOUR;

        double[] primary = finiteValues(history.fetch(key, primaryFrom, primaryTo));
        if (primary.length >= properties.getMinSamples()) {
            BaselineWindow window = window(key.stationId(), key.source(), key.channel(), primary,
                    BaselineMethod.PRIMARY, false, null, primaryFrom, primaryTo);
            return new SeriesBaseline(key, t0Ms, history, primary.length, window);
        }
        return new SeriesBaseline(key, t0Ms, history, primary.length, null);
    }

    // valuesByDayOffset: days each history window precedes the event window
    public BaselineWindow selectFeature(String stationId, SourceType source, String featureName,
                                        long t0Ms, Map<Integer, Double> valuesByDayOffset) {
        int minWindows = properties.getFeatureMinWindows();
        int primaryDays = (int) (properties.getExtraHours() / 24);
        long primaryTo = t0Ms - properties.getGapHours() * MS_PER_HOUR;

        double[] primary = valuesByDayOffset.entrySet().stream()
                .filter(e -> e.getKey() <= primaryDays && Double.isFinite(e.getValue()))
                .mapToDouble(Map.Entry::getValue)
                .toArray();
        long primaryFrom = t0Ms - (linkProperties.getWindowBeforeHours() + properties.getExtraHours()) * MS_PER_HOUR;
        if (primary.length >= minWindows) {
            return window(stationId, source, featureName, primary, BaselineMethod.PRIMARY, false, null,
                    primaryFrom, primaryTo);
        }

        double[] history = valuesByDayOffset.values().stream()
                .filter(Double::isFinite)
                .mapToDouble(Double::doubleValue)
                .toArray();
        int furthest = valuesByDayOffset.keySet().stream().mapToInt(Integer::intValue).max().orElse(0);
        long historyFrom = t0Ms - linkProperties.getWindowBeforeHours() * MS_PER_HOUR - furthest * MS_PER_DAY;
        if (history.length >= minWindows) {
            String reason = String.format(Locale.ROOT,
                    "primary range has %d windows (< %d); used %d daily-shifted windows",
                    primary.length, minWindows, history.length);
            return window(stationId, source, featureName, history, BaselineMethod.SAME_HOUR_HISTORY, true, reason,
                    historyFrom, primaryTo);
        }
        String reason = String.format(Locale.ROOT,
                "history has %d windows (< %d); used quantiles of all %d windows",
                history.length, minWindows, history.length);
        return globalWindow(stationId, source, featureName, history, reason, primaryTo);
    }

    private BaselineWindow window(String stationId, SourceType source, String featureName, double[] samples,
                                  BaselineMethod method, boolean degraded, String reason, long fromMs, long toMs) {
        double median = RobustStats.median(samples);
        double scale = RobustStats.MAD_TO_SIGMA * RobustStats.mad(samples, median);
        if (!(scale > 0)) {
            scale = RobustStats.populationStd(samples);
        }
        return BaselineWindow.builder()
                .stationId(stationId)
                .source(source)
                .featureName(featureName)
                .samples(samples)
                .method(method)
                .degraded(degraded)
                .reason(reason)
                .fromMs(fromMs)
                .toMs(toMs)
                .median(median)
                .mean(RobustStats.mean(samples))
                .scale(scale)
                .build();
    }

    private BaselineWindow globalWindow(String stationId, SourceType source, String featureName, double[] samples,
                                        String reason, long toMs) {
        double median = RobustStats.median(samples);
        double scale = RobustStats.iqrScale(samples);
        if (!(scale > 0) && samples.length > 0) {
            scale = RobustStats.populationStd(samples);
        }
        return BaselineWindow.builder()
                .stationId(stationId)
                .source(source)
                .featureName(featureName)
                .samples(samples)
                .method(BaselineMethod.GLOBAL_QUANTILE)
                .degraded(true)
                .reason(reason)
                .fromMs(null)
                .toMs(toMs)
                .median(median)
                .mean(RobustStats.mean(samples))
                .scale(scale)
                .build();
    }

    private static double[] finiteValues(List<CanonicalRecord> records) {
        return records.stream()
                .filter(CanonicalRecord::hasFiniteValue)
                .mapToDouble(CanonicalRecord::getValue)
                .toArray();
    }

    static int hourOfDay(long tsMs) {
        return Instant.ofEpochMilli(tsMs).atZone(ZoneOffset.UTC).getHour();
    }

    public final class SeriesBaseline {

        private final SeriesKey key;
        private final long t0Ms;
        private final HistoryAccessor history;
        private final int primaryCount;
        private final BaselineWindow primary;
        private final Map<Integer, BaselineWindow> byHour = new TreeMap<>();
        private double[][] sameHourValues;
        private double[] globalValues;

        private SeriesBaseline(SeriesKey key, long t0Ms, HistoryAccessor history, int primaryCount,
                               BaselineWindow primary) {
            this.key = key;
            this.t0Ms = t0Ms;
            this.history = history;
            this.primaryCount = primaryCount;
            this.primary = primary;
        }

        public BaselineWindow windowAt(long tsMs) {
            if (primary != null) return primary;
            return byHour.computeIfAbsent(hourOfDay(tsMs), this::fallback);
        }

        public List<BaselineWindow> windows() {
            return primary != null ? List.of(primary) : new ArrayList<>(byHour.values());
        }

        private BaselineWindow fallback(int hour) {
            int minSamples = properties.getMinSamples();
            long primaryTo = t0Ms - properties.getGapHours() * MS_PER_HOUR;
            long historyFrom = t0Ms - properties.getHistoryDays() * MS_PER_DAY;
            double[] sameHour = sameHourValues(historyFrom, primaryTo)[hour];
            if (sameHour.length >= minSamples) {
                String reason = String.format(Locale.ROOT,
                        "primary window has %d samples (< %d); used %d samples from hour %02d UTC",
                        primaryCount, minSamples, sameHour.length, hour);
                log.debug("[Baseline] 기준 구간 하향: series={}, method=same-hour-history, reason={}", key, reason);
                return window(key.stationId(), key.source(), key.channel(), sameHour,
                        BaselineMethod.SAME_HOUR_HISTORY, true, reason, historyFrom, primaryTo);
            }

            double[] global = globalValues(primaryTo);
            String reason = String.format(Locale.ROOT,
                    "primary window has %d samples and hour %02d UTC history has %d (< %d); used %d all-time samples",
                    primaryCount, hour, sameHour.length, minSamples, global.length);
            log.debug("[Baseline] 기준 구간 하향: series={}, method=global-quantile, reason={}", key, reason);
            return globalWindow(key.stationId(), key.source(), key.channel(), global, reason, primaryTo);
        }

        private double[][] sameHourValues(long historyFrom, long primaryTo) {
            if (sameHourValues == null) {
                List<List<Double>> buckets = new ArrayList<>(24);
                for (int h = 0; h < 24; h++) {
                    buckets.add(new ArrayList<>());
                }
                for (CanonicalRecord r : history.fetch(key, historyFrom, primaryTo)) {
                    if (r.hasFiniteValue()) {
                        buckets.get(hourOfDay(r.getTsMs())).add(r.getValue());
                    }
                }
                sameHourValues = new double[24][];
                for (int h = 0; h < 24; h++) {
                    sameHourValues[h] = buckets.get(h).stream().mapToDouble(Double::doubleValue).toArray();
                }
            }
            return sameHourValues;
        }

        private double[] globalValues(long primaryTo) {
            if (globalValues == null) {
                globalValues = finiteValues(history.fetch(key, Long.MIN_VALUE / 2, primaryTo));
                if (globalValues.length == 0) {
                    log.warn("[Baseline] 기준 데이터 없음: series={}, t0={}", key, Instant.ofEpochMilli(t0Ms));
                }
            }
            return globalValues;
        }
    }
}
