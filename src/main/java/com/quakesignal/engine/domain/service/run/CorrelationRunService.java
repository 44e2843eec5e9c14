package com.quakesignal.engine.domain.service.run;

import com.quakesignal.engine.domain.exception.InvalidConfigurationException;
import com.quakesignal.engine.domain.exception.SpatialIndexInvariantException;
import com.quakesignal.engine.domain.model.CanonicalRecord;
import com.quakesignal.engine.domain.model.CatalogEvent;
import com.quakesignal.engine.domain.model.EventRunResult;
import com.quakesignal.engine.domain.model.FeatureSet;
import com.quakesignal.engine.domain.model.FilterEffect;
import com.quakesignal.engine.domain.model.LinkedDataset;
import com.quakesignal.engine.domain.model.LinkedStation;
import com.quakesignal.engine.domain.model.PartitionKey;
import com.quakesignal.engine.domain.model.QualityReport;
import com.quakesignal.engine.domain.model.QualityResult;
import com.quakesignal.engine.domain.model.RunReport;
import com.quakesignal.engine.domain.model.SeriesKey;
import com.quakesignal.engine.domain.model.SourceType;
import com.quakesignal.engine.domain.model.Station;
import com.quakesignal.engine.domain.model.UnitType;
import com.quakesignal.engine.domain.service.align.AlignProperties;
import com.quakesignal.engine.domain.service.baseline.BaselineProperties;
import com.quakesignal.engine.domain.service.baseline.BaselineScorer;
import com.quakesignal.engine.domain.service.baseline.StoreFeatureHistoryAccessor;
import com.quakesignal.engine.domain.service.baseline.StoreHistoryAccessor;
import com.quakesignal.engine.domain.service.feature.FeatureExtractor;
import com.quakesignal.engine.domain.service.feature.FeatureProperties;
import com.quakesignal.engine.domain.service.link.EventLinker;
import com.quakesignal.engine.domain.service.link.LinkProperties;
import com.quakesignal.engine.domain.service.quality.QualityPipeline;
import com.quakesignal.engine.domain.service.quality.QualityProperties;
import com.quakesignal.engine.domain.service.spatial.SpatialIndex;
import com.quakesignal.engine.domain.service.spatial.StationRegistry;
import com.quakesignal.engine.infra.artifact.EventArtifactWriter;
import com.quakesignal.engine.infra.artifact.RunReportWriter;
import com.quakesignal.engine.infra.disruptor.PartitionWriteGateway;
import com.quakesignal.engine.infra.input.CatalogReader;
import com.quakesignal.engine.infra.input.JsonLinesRecordReader;
import com.quakesignal.engine.infra.store.StandardizedStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class CorrelationRunService {

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger(0);

    private final RunProperties runProperties;
    private final QualityProperties qualityProperties;
    private final AlignProperties alignProperties;
    private final LinkProperties linkProperties;
    private final FeatureProperties featureProperties;
    private final BaselineProperties baselineProperties;

    private final ParamsHasher paramsHasher;
    private final RunManifestService manifest;
    private final QualityPipeline qualityPipeline;
    private final EventLinker eventLinker;
    private final FeatureExtractor featureExtractor;
    private final BaselineScorer baselineScorer;
    private final StoreHistoryAccessor historyAccessor;
    private final StoreFeatureHistoryAccessor featureHistoryAccessor;
    private final StandardizedStore store;
    private final PartitionWriteGateway writeGateway;
    private final JsonLinesRecordReader recordReader;
    private final CatalogReader catalogReader;
    private final EventArtifactWriter artifactWriter;
    private final RunReportWriter reportWriter;
    private final MeterRegistry meterRegistry;

    private Counter seriesProcessed;
    private Counter seriesFailed;
    private Counter partitionsSkipped;
    private Timer eventDuration;

    @PostConstruct
    void initMetrics() {
        seriesProcessed = Counter.builder("engine.series.processed")
                .description("Series passed through the quality pipeline")
                .register(meterRegistry);
        seriesFailed = Counter.builder("engine.series.failed")
                .description("Series whose quality processing raised an unexpected error")
                .register(meterRegistry);
        partitionsSkipped = Counter.builder("engine.partitions.skipped")
                .description("Partitions skipped because the manifest already holds them")
                .register(meterRegistry);
        eventDuration = Timer.builder("engine.event.duration")
                .description("Link, feature and scoring time per event")
                .register(meterRegistry);
    }

    public void validateConfiguration() {
        qualityProperties.validate();
        alignProperties.validate();
        linkProperties.validate();
        featureProperties.validate();
        baselineProperties.validate();
        runProperties.validate();
    }

    public RunReport runConfigured() {
        validateConfiguration();
        if (runProperties.getRecordsFile() == null) {
            throw new InvalidConfigurationException("run.records-file is required");
        }

        List<CanonicalRecord> records = new ArrayList<>();
        JsonLinesRecordReader.ReadStats stats = recordReader.read(Path.of(runProperties.getRecordsFile()), records::add);

        List<CatalogEvent> catalog = new ArrayList<>(catalogReader.toCatalog(runProperties.getEvents()));
        if (runProperties.getCatalogFile() != null) {
            catalog.addAll(catalogReader.read(Path.of(runProperties.getCatalogFile())));
            catalog.sort(CatalogReader.CATALOG_ORDER);
        }
        List<Station> stations = runProperties.getStations().stream()
                .map(RunProperties.StationSpec::toStation)
                .collect(Collectors.toList());

        RunReport report = run(records, catalog, stations, Path.of(runProperties.getOutputDir()));
        if (stats.skippedLines() > 0) {
            log.warn("[Run] 파싱 불가로 건너뛴 입력 라인: {}", stats.skippedLines());
        }
        return report;
    }

    public RunReport run(Collection<CanonicalRecord> records, List<CatalogEvent> catalog,
                         List<Station> stations, Path outputDir) {
        validateConfiguration();
        RunContext context = RunContext.of(paramsHasher.snapshot(), manifest);
        boolean resume = runProperties.isResume() && store.isDurable();
        log.info("[Run] 실행 시작: records={}, events={}, paramsHash={}, resume={}",
                records.size(), catalog.size(), context.shortHash(), resume);

        SortedMap<SeriesKey, List<CanonicalRecord>> bySeries = new TreeMap<>();
        long rejected = 0;
        for (CanonicalRecord record : records) {
            if (record == null || record.getSource() == null || record.getStationId() == null
                    || record.getChannel() == null) {
                rejected++;
                continue;
            }
            bySeries.computeIfAbsent(record.seriesKey(), k -> new ArrayList<>()).add(record);
        }

        StationRegistry registry = stations.isEmpty()
                ? StationRegistry.fromRecords(records.stream()
                        .filter(r -> r != null && r.getStationId() != null)
                        .collect(Collectors.toList()))
                : StationRegistry.of(stations);

        ExecutorService pool = Executors.newFixedThreadPool(runProperties.getWorkerThreads(), r -> {
            Thread t = new Thread(r, "correlation-worker-" + THREAD_COUNTER.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            StandardizeOutcome standardized = standardize(bySeries, registry, context, resume, pool);
            SpatialIndex index = SpatialIndex.build(registry, linkProperties.isVerifySpatialQueries());
            List<EventRunResult> events = processEvents(catalog, index, context, resume, outputDir, pool);

            RunReport report = RunReport.builder()
                    .paramsHash(context.paramsHash())
                    .inputRecords(records.size())
                    .rejectedRecords(rejected)
                    .seriesProcessed(standardized.reports().size())
                    .seriesFailed(standardized.failedSeries())
                    .partitionsWritten(standardized.partitionsPublished())
                    .partitionsSkipped(standardized.partitionsSkipped())
                    .stationCount(registry.size())
                    .qualityReports(standardized.reports())
                    .events(events)
                    .build();
            writeReports(outputDir, context, report, standardized.keys());
            reportWriter.write(outputDir, RunReportWriter.DQ_RAW_BRONZE, rawReport(context, bySeries));
            reportWriter.write(outputDir, RunReportWriter.FILTER_EFFECT,
                    filterEffectReport(context, standardized.filterEffects()));

            log.info("[Run] 실행 완료: series={}, partitions={} (skipped {}), events linked={} skipped={} failed={}",
                    report.getSeriesProcessed(), report.getPartitionsWritten(), report.getPartitionsSkipped(),
                    report.eventsWithStatus(EventRunResult.Status.LINKED),
                    report.eventsWithStatus(EventRunResult.Status.SKIPPED),
                    report.eventsWithStatus(EventRunResult.Status.FAILED));
            return report;
        } finally {
            pool.shutdownNow();
        }
    }

    private record StandardizeOutcome(List<SeriesKey> keys, List<QualityReport> reports,
                                      List<FilterEffect> filterEffects, int failedSeries,
                                      int partitionsPublished, int partitionsSkipped) {
    }

    private record GroupOutcome(List<SeriesKey> keys, List<QualityReport> reports, List<FilterEffect> filterEffects,
                                int failedSeries, int published, int skipped) {
    }

    private StandardizeOutcome standardize(SortedMap<SeriesKey, List<CanonicalRecord>> bySeries,
                                           StationRegistry registry, RunContext context,
                                           boolean resume, ExecutorService pool) {
        Map<String, SortedMap<SeriesKey, List<CanonicalRecord>>> byStation = new TreeMap<>();
        bySeries.forEach((key, series) -> byStation
                .computeIfAbsent(key.source().key() + "/" + key.stationId(), k -> new TreeMap<>())
                .put(key, series));

        Set<String> completed = resume
                ? context.manifest().completedKeys(UnitType.PARTITION, context.paramsHash())
                : Set.of();

        List<CompletableFuture<GroupOutcome>> futures = byStation.values().stream()
                .map(group -> CompletableFuture.supplyAsync(
                        () -> standardizeStation(group, registry, context, completed), pool))
                .collect(Collectors.toList());
        List<GroupOutcome> outcomes = joinAll(futures);

        try {
            writeGateway.awaitDrained(Duration.ofSeconds(runProperties.getFlushTimeoutSeconds()));
        } catch (TimeoutException e) {
            throw new IllegalStateException("standardized partitions were not flushed", e);
        }
        if (writeGateway.failureCount() > 0) {
            log.warn("[Run] 파티션 기록 실패 누적: {}건 (매니페스트 미기록, 재실행 시 재처리)", writeGateway.failureCount());
        }

        List<SeriesKey> keys = new ArrayList<>();
        List<QualityReport> reports = new ArrayList<>();
        List<FilterEffect> filterEffects = new ArrayList<>();
        int failed = 0;
        int published = 0;
        int skipped = 0;
        for (GroupOutcome outcome : outcomes) {
            keys.addAll(outcome.keys());
            reports.addAll(outcome.reports());
            filterEffects.addAll(outcome.filterEffects());
            failed += outcome.failedSeries();
            published += outcome.published();
            skipped += outcome.skipped();
        }
        log.info("[Run] 표준화 완료: series={}, failed={}, partitions published={}, skipped={}",
                reports.size(), failed, published, skipped);
        return new StandardizeOutcome(keys, reports, filterEffects, failed, published, skipped);
    }

    private GroupOutcome standardizeStation(SortedMap<SeriesKey, List<CanonicalRecord>> group,
                                            StationRegistry registry, RunContext context, Set<String> completed) {
        Set<PartitionKey> rawPartitions = new TreeSet<>();
        group.values().forEach(series -> series.forEach(r -> rawPartitions.add(PartitionKey.of(r))));
        if (!completed.isEmpty() && rawPartitions.stream().allMatch(p -> completed.contains(p.asPath()))) {
            partitionsSkipped.increment(rawPartitions.size());
            log.debug("[Run] 완료된 스테이션 건너뜀: station={}, partitions={}",
                    group.firstKey().stationId(), rawPartitions.size());
            return new GroupOutcome(List.of(), List.of(), List.of(), 0, 0, rawPartitions.size());
        }

        List<SeriesKey> keys = new ArrayList<>();
        List<QualityReport> reports = new ArrayList<>();
        List<FilterEffect> filterEffects = new ArrayList<>();
        SortedMap<PartitionKey, List<CanonicalRecord>> partitions = new TreeMap<>();
        int failed = 0;
        for (Map.Entry<SeriesKey, List<CanonicalRecord>> entry : group.entrySet()) {
            try {
                QualityResult result = qualityPipeline.process(entry.getKey(), entry.getValue(),
                        registry, context.paramsHash());
                keys.add(entry.getKey());
                reports.add(result.report());
                if (result.filterEffect() != null) {
                    filterEffects.add(result.filterEffect());
                }
                for (CanonicalRecord record : result.records()) {
                    partitions.computeIfAbsent(PartitionKey.of(record), k -> new ArrayList<>()).add(record);
                }
                seriesProcessed.increment();
            } catch (InvalidConfigurationException e) {
                throw e;
            } catch (RuntimeException e) {
                failed++;
                seriesFailed.increment();
                log.error("[Run] 시리즈 품질 처리 실패: series={}", entry.getKey(), e);
            }
        }

        int published = 0;
        int skipped = 0;
        for (Map.Entry<PartitionKey, List<CanonicalRecord>> entry : partitions.entrySet()) {
            if (completed.contains(entry.getKey().asPath())) {
                skipped++;
                partitionsSkipped.increment();
                continue;
            }
            writeGateway.publish(entry.getKey(), entry.getValue(), context.paramsHash());
            published++;
        }
        return new GroupOutcome(keys, reports, filterEffects, failed, published, skipped);
    }

    private List<EventRunResult> processEvents(List<CatalogEvent> catalog, SpatialIndex index, RunContext context,
                                               boolean resume, Path outputDir, ExecutorService pool) {
        Set<String> completed = resume
                ? context.manifest().completedKeys(UnitType.EVENT, context.paramsHash())
                : Set.of();
        List<CompletableFuture<EventRunResult>> futures = catalog.stream()
                .map(event -> CompletableFuture.supplyAsync(() -> completed.contains(event.eventId())
                        ? skipped(event)
                        : processEvent(event, index, context, outputDir), pool))
                .collect(Collectors.toList());
        return joinAll(futures);
    }

    EventRunResult processEvent(CatalogEvent event, SpatialIndex index, RunContext context, Path outputDir) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            EventRunResult result = linkAndScore(event, index, context, outputDir);
            sample.stop(eventDuration);
            meterRegistry.counter("engine.events", "status", "linked").increment();
            return result;
        } catch (InvalidConfigurationException | SpatialIndexInvariantException e) {
            throw e;
        } catch (RuntimeException e) {
            meterRegistry.counter("engine.events", "status", "failed").increment();
            log.error("[Run] 이벤트 처리 실패, 다음 이벤트 계속: event={}", event.eventId(), e);
            return EventRunResult.builder()
                    .eventId(event.eventId())
                    .status(EventRunResult.Status.FAILED)
                    .error(e.getClass().getSimpleName() + ": " + e.getMessage())
                    .build();
        }
    }

    private EventRunResult linkAndScore(CatalogEvent event, SpatialIndex index, RunContext context, Path outputDir) {
        LinkedDataset dataset = eventLinker.link(event, store, index, context);
        artifactWriter.writeLinked(outputDir, dataset);

        List<FeatureSet> featureSets = new ArrayList<>();
        for (LinkedStation station : dataset.getStations()) {
            for (SourceType source : station.getSources()) {
                if (dataset.seriesFor(station.getStationId(), source).isEmpty()) continue;
                featureSets.add(featureExtractor.extract(dataset, station.getStationId(), source));
            }
        }
        BaselineScorer.EventScores scores = baselineScorer.scoreEvent(dataset, historyAccessor, context.paramsHash())
                .plus(baselineScorer.scoreFeatures(dataset, featureSets, featureHistoryAccessor, context.paramsHash()));
        artifactWriter.writeFeatures(outputDir, event.eventId(), featureSets, scores.baselines(), scores.scores());

        context.manifest().markComplete(UnitType.EVENT, event.eventId(), context.paramsHash(),
                dataset.getRows().size());

        int featureCount = featureSets.stream().mapToInt(set -> set.getFeatures().size()).sum();
        return EventRunResult.builder()
                .eventId(event.eventId())
                .status(EventRunResult.Status.LINKED)
                .stationHits(dataset.getStations().size())
                .alignedRows(dataset.getRows().size())
                .joinCoverage(dataset.getSummary().getJoinCoverage())
                .featureCount(featureCount)
                .anomalyRows(scores.anomalyRows())
                .anomalyRate(scores.anomalyRate())
                .build();
    }

    private EventRunResult skipped(CatalogEvent event) {
        meterRegistry.counter("engine.events", "status", "skipped").increment();
        log.info("[Run] 완료된 이벤트 건너뜀: event={}", event.eventId());
        return EventRunResult.builder()
                .eventId(event.eventId())
                .status(EventRunResult.Status.SKIPPED)
                .build();
    }

    private void writeReports(Path outputDir, RunContext context, RunReport report, List<SeriesKey> keys) {
        reportWriter.write(outputDir, RunReportWriter.CONFIG_SNAPSHOT, configSnapshot(context));
        reportWriter.write(outputDir, RunReportWriter.DQ_STANDARD, standardReport(report, keys));
        reportWriter.write(outputDir, RunReportWriter.DQ_LINKED, linkedReport(report));
        reportWriter.write(outputDir, RunReportWriter.DQ_FEATURES, featuresReport(report));
    }

    private SortedMap<String, Object> rawReport(RunContext context, SortedMap<SeriesKey, List<CanonicalRecord>> bySeries) {
        SortedMap<String, SourceStats> bySource = new TreeMap<>();
        bySeries.forEach((key, series) -> {
            SourceStats stats = bySource.computeIfAbsent(key.source().key(), k -> new SourceStats());
            series.forEach(record -> stats.add(key, record));
        });
        SortedMap<String, Object> sources = new TreeMap<>();
        bySource.forEach((source, stats) -> sources.put(source, stats.toMap()));

        SortedMap<String, Object> out = new TreeMap<>();
        out.put("params_hash", context.paramsHash());
        out.put("sources", sources);
        return out;
    }

    private SortedMap<String, Object> filterEffectReport(RunContext context, List<FilterEffect> effects) {
        SortedMap<String, FilterEffect> series = new TreeMap<>();
        effects.forEach(effect -> series.put(effect.getSeriesKey().toString(), effect));

        SortedMap<String, Object> out = new TreeMap<>();
        out.put("params_hash", context.paramsHash());
        out.put("enabled", !series.isEmpty());
        out.put("series", series);
        return out;
    }

    private SortedMap<String, Object> configSnapshot(RunContext context) {
        SortedMap<String, Object> out = new TreeMap<>(context.configSnapshot());
        out.put("params_hash", context.paramsHash());
        return out;
    }

    private SortedMap<String, Object> standardReport(RunReport report, List<SeriesKey> keys) {
        SortedMap<String, SourceStats> bySource = new TreeMap<>();
        for (int i = 0; i < keys.size(); i++) {
            SeriesKey key = keys.get(i);
            bySource.computeIfAbsent(key.source().key(), k -> new SourceStats()).add(key, report.getQualityReports().get(i));
        }
        SortedMap<String, Object> sources = new TreeMap<>();
        bySource.forEach((source, stats) -> sources.put(source, stats.toMap()));

        List<QualityReport> series = new ArrayList<>(report.getQualityReports());
        series.sort(Comparator.comparing(QualityReport::getSeriesKey));

        SortedMap<String, Object> out = new TreeMap<>();
        out.put("params_hash", report.getParamsHash());
        out.put("input_records", report.getInputRecords());
        out.put("rejected_records", report.getRejectedRecords());
        out.put("series_failed", report.getSeriesFailed());
        out.put("partitions_written", report.getPartitionsWritten());
        out.put("partitions_skipped", report.getPartitionsSkipped());
        out.put("sources", sources);
        out.put("series", series);
        return out;
    }

    private SortedMap<String, Object> linkedReport(RunReport report) {
        List<Map<String, Object>> events = report.getEvents().stream()
                .map(e -> {
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put("event_id", e.getEventId());
                    row.put("status", e.getStatus());
                    row.put("station_hits", e.getStationHits());
                    row.put("aligned_rows", e.getAlignedRows());
                    row.put("join_coverage", e.getJoinCoverage());
                    row.put("error", e.getError());
                    return row;
                })
                .collect(Collectors.toList());
        SortedMap<String, Object> out = new TreeMap<>();
        out.put("params_hash", report.getParamsHash());
        out.put("events", events);
        return out;
    }

    private SortedMap<String, Object> featuresReport(RunReport report) {
        List<Map<String, Object>> events = report.getEvents().stream()
                .filter(e -> e.getStatus() == EventRunResult.Status.LINKED)
                .map(e -> {
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put("event_id", e.getEventId());
                    row.put("feature_count", e.getFeatureCount());
                    row.put("anomaly_rows", e.getAnomalyRows());
                    row.put("anomaly_rate", e.getAnomalyRate());
                    return row;
                })
                .collect(Collectors.toList());
        SortedMap<String, Object> out = new TreeMap<>();
        out.put("params_hash", report.getParamsHash());
        out.put("events", events);
        return out;
    }

    private static final class SourceStats {
        private long rows;
        private double missing;
        private Long tsMin;
        private Long tsMax;
        private final Set<String> stations = new TreeSet<>();
        private final Set<String> channels = new TreeSet<>();

        void add(SeriesKey key, CanonicalRecord record) {
            rows++;
            if (!record.hasFiniteValue()) {
                missing++;
            }
            stations.add(key.stationId());
            channels.add(key.channel());
            tsMin = tsMin == null ? record.getTsMs() : Math.min(tsMin, record.getTsMs());
            tsMax = tsMax == null ? record.getTsMs() : Math.max(tsMax, record.getTsMs());
        }

        void add(SeriesKey key, QualityReport report) {
            rows += report.getOutputRows();
            missing += report.getMissingRate() * report.getOutputRows();
            stations.add(key.stationId());
            channels.add(key.channel());
            if (report.getTsMin() != null) {
                tsMin = tsMin == null ? report.getTsMin() : Math.min(tsMin, report.getTsMin());
            }
            if (report.getTsMax() != null) {
                tsMax = tsMax == null ? report.getTsMax() : Math.max(tsMax, report.getTsMax());
            }
        }

        Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("rows", rows);
            map.put("ts_min", tsMin);
            map.put("ts_max", tsMax);
            map.put("station_count", stations.size());
            map.put("channel_count", channels.size());
            map.put("channels", List.copyOf(channels));
            map.put("missing_rate", rows == 0 ? 0.0 : missing / rows);
            return map;
        }
    }

    private static <T> List<T> joinAll(List<CompletableFuture<T>> futures) {
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
        List<T> results = new ArrayList<>(futures.size());
        futures.forEach(f -> results.add(f.join()));
        return Collections.unmodifiableList(results);
    }
}
