package com.quakesignal.engine.infra.input;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.quakesignal.engine.domain.model.CanonicalRecord;
import com.quakesignal.engine.domain.model.QualityFlags;
import com.quakesignal.engine.infra.artifact.ArtifactJson;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;

@Slf4j
@Component
public class JsonLinesRecordReader {

    private static final int MAX_WARNINGS = 20;

    private final ObjectMapper mapper = ArtifactJson.mapper();

    public record ReadStats(long lines, long records, long skippedLines) {
    }

    public ReadStats read(Path file, Consumer<CanonicalRecord> sink) {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            ReadStats stats = read(reader, sink);
            log.info("[Input] 레코드 입력 완료: file={}, lines={}, records={}, skipped={}",
                    file, stats.lines(), stats.records(), stats.skippedLines());
            return stats;
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read records from " + file, e);
        }
    }

    public ReadStats read(Reader source, Consumer<CanonicalRecord> sink) throws IOException {
        BufferedReader reader = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);
        long lines = 0;
        long records = 0;
        long skipped = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            lines++;
            if (line.isBlank()) continue;
            try {
                sink.accept(parse(line));
                records++;
            } catch (JsonProcessingException | IllegalArgumentException e) {
                skipped++;
                if (skipped <= MAX_WARNINGS) {
                    log.warn("[Input] 파싱 불가 라인 건너뜀: line={}, reason={}", lines, e.getMessage());
                }
            }
        }
        return new ReadStats(lines, records, skipped);
    }

    CanonicalRecord parse(String line) throws JsonProcessingException {
        JsonNode node = mapper.readTree(line);
        if (!(node instanceof ObjectNode object)) {
            throw new IllegalArgumentException("line is not a JSON object");
        }
        JsonNode value = object.get("value");
        if (value == null || value.isNull()) {
            object.put("value", Double.NaN);
        } else if (!value.isNumber()) {
            throw new IllegalArgumentException("value is not numeric: " + value);
        }
        CanonicalRecord record = mapper.treeToValue(object, CanonicalRecord.class);
        if (record.getSource() == null || record.getStationId() == null || record.getChannel() == null) {
            throw new IllegalArgumentException("record lacks source, station_id or channel");
        }
        if (record.getQualityFlags() == null) {
            record = record.toBuilder().qualityFlags(QualityFlags.ok()).build();
        }
        return record;
    }
}
