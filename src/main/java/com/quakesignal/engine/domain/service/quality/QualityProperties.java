package com.quakesignal.engine.domain.service.quality;

import com.quakesignal.engine.domain.exception.InvalidConfigurationException;
import com.quakesignal.engine.domain.model.SourceType;
import com.quakesignal.engine.domain.service.quality.denoise.DenoiseMethod;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "quality")
public class QualityProperties {

    private List<Double> sentinelValues = new ArrayList<>(List.of(88888.0, 99999.0));
    private double sentinelFloor = 88888.0;
    private String procVersion = "quake-signal-engine/0.1.0";

    private Outlier outlier = new Outlier();
    private Impute impute = new Impute();
    private Map<String, Denoise> denoise = defaultDenoise();
    private Map<String, String> defaultUnits = defaultUnits();
    private Map<String, String> unitAliases = defaultUnitAliases();

    @Getter
    @Setter
    public static class Outlier {
        private OutlierMethod method = OutlierMethod.MAD;
        private double threshold = 6.0;
        private OutlierAction action = OutlierAction.SET_NAN;
    }

    @Getter
    @Setter
    public static class Impute {
        private long maxGapSeconds = 300;
        private ImputeMethod method = ImputeMethod.LINEAR;
        private boolean materializeGaps = true;
        private double gapFactor = 1.5;
        private int maxInsertedRows = 100_000;
    }

    @Getter
    @Setter
    public static class Denoise {
        private DenoiseMethod method = DenoiseMethod.NONE;
        private Map<String, Double> params = new LinkedHashMap<>();

        public Denoise() {
        }

        Denoise(DenoiseMethod method) {
            this.method = method;
        }
    }

    public Denoise denoiseFor(SourceType source) {
        Denoise configured = denoise.get(source.key());
        return configured != null ? configured : new Denoise();
    }

    public String defaultUnitFor(SourceType source) {
        return defaultUnits.get(source.key());
    }

    public String resolveUnitAlias(String units) {
        if (units == null) return null;
        String trimmed = units.trim();
        if (trimmed.isEmpty()) return null;
        String alias = unitAliases.get(trimmed.toLowerCase(Locale.ROOT));
        return alias != null ? alias : trimmed;
    }

    public long maxGapMs() {
        return impute.getMaxGapSeconds() * 1000L;
    }

    public void validate() {
        if (!(outlier.getThreshold() > 0) || !Double.isFinite(outlier.getThreshold())) {
            throw new InvalidConfigurationException("quality.outlier.threshold must be positive: " + outlier.getThreshold());
        }
        if (impute.getMaxGapSeconds() < 0) {
            throw new InvalidConfigurationException("quality.impute.max-gap-seconds must not be negative");
        }
        if (!(impute.getGapFactor() > 1.0)) {
            throw new InvalidConfigurationException("quality.impute.gap-factor must be greater than 1");
        }
        if (!(sentinelFloor > 0)) {
            throw new InvalidConfigurationException("quality.sentinel-floor must be positive");
        }
        for (String key : denoise.keySet()) {
            if (SourceType.fromKeyOrNull(key) == null) {
                throw new InvalidConfigurationException("quality.denoise has unknown source: " + key);
            }
        }
    }

    private static Map<String, Denoise> defaultDenoise() {
        Map<String, Denoise> map = new LinkedHashMap<>();
        map.put(SourceType.GEOMAG.key(), new Denoise(DenoiseMethod.KALMAN));
        map.put(SourceType.AEF.key(), new Denoise(DenoiseMethod.ROBUST_SMOOTH));
        map.put(SourceType.VLF.key(), new Denoise(DenoiseMethod.ROLLING_MEDIAN));
        map.put(SourceType.SEISMIC.key(), new Denoise(DenoiseMethod.SEISMIC_BANDPASS));
        return map;
    }

    private static Map<String, String> defaultUnits() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put(SourceType.GEOMAG.key(), "nT");
        map.put(SourceType.AEF.key(), "V/m");
        map.put(SourceType.VLF.key(), "dB");
        map.put(SourceType.SEISMIC.key(), "counts");
        return map;
    }

    private static Map<String, String> defaultUnitAliases() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("nt", "nT");
        map.put("nanotesla", "nT");
        map.put("v/m", "V/m");
        map.put("volt/m", "V/m");
        map.put("db", "dB");
        map.put("count", "counts");
        map.put("counts", "counts");
        return map;
    }
}
