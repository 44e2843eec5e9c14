package com.quakesignal.engine.domain.service.run;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quakesignal.engine.domain.service.align.AlignProperties;
import com.quakesignal.engine.domain.service.baseline.BaselineProperties;
import com.quakesignal.engine.domain.service.feature.FeatureProperties;
import com.quakesignal.engine.domain.service.link.LinkProperties;
import com.quakesignal.engine.domain.service.quality.QualityProperties;
import com.quakesignal.engine.infra.artifact.ArtifactJson;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

@Component
@RequiredArgsConstructor
public class ParamsHasher {

    private static final ObjectMapper MAPPER = ArtifactJson.mapper();

    private final QualityProperties qualityProperties;
    private final AlignProperties alignProperties;
    private final LinkProperties linkProperties;
    private final FeatureProperties featureProperties;
    private final BaselineProperties baselineProperties;

    public SortedMap<String, Object> snapshot() {
        SortedMap<String, Object> snapshot = new TreeMap<>();
        snapshot.put("quality", toTree(qualityProperties));
        snapshot.put("align", toTree(alignProperties));
        snapshot.put("link", toTree(linkProperties));
        snapshot.put("feature", toTree(featureProperties));
        snapshot.put("baseline", toTree(baselineProperties));
        return snapshot;
    }

    public static String hash(Map<String, Object> snapshot) {
        try {
            byte[] canonical = MAPPER.writeValueAsString(snapshot).getBytes(StandardCharsets.UTF_8);
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(canonical));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("config snapshot is not serializable", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    private static Map<String, Object> toTree(Object properties) {
        return MAPPER.convertValue(properties, new TypeReference<TreeMap<String, Object>>() {
        });
    }
}
