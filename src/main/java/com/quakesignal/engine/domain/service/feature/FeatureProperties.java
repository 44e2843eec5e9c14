package com.quakesignal.engine.domain.service.feature;

import com.quakesignal.engine.domain.exception.InvalidConfigurationException;
import com.quakesignal.engine.domain.model.SourceType;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "feature")
public class FeatureProperties {

    private double maxNanFraction = 0.5;
    private double abruptChangeThreshold = 10.0;
    private int shortWindowPoints = 10;
    private StaLta staLta = new StaLta();
    private Map<String, Band> bands = defaultBands();

    @Getter
    @Setter
    public static class StaLta {
        private int staPoints = 3;
        private int ltaPoints = 30;
        private double triggerOn = 3.0;
        private double triggerOff = 1.5;
    }

    @Getter
    @Setter
    public static class Band {
        private double lowHz;
        private double highHz;

        public Band() {
        }

        Band(double lowHz, double highHz) {
            this.lowHz = lowHz;
            this.highHz = highHz;
        }
    }

    public Band bandFor(SourceType source) {
        Band band = bands.get(source.key());
        return band != null ? band : new Band(0.0, Double.MAX_VALUE);
    }

    public void validate() {
        if (!(maxNanFraction >= 0.0 && maxNanFraction <= 1.0)) {
            throw new InvalidConfigurationException("feature.max-nan-fraction must be within [0, 1]: " + maxNanFraction);
        }
        if (shortWindowPoints < 2) {
            throw new InvalidConfigurationException("feature.short-window-points must be >= 2");
        }
        if (staLta.getStaPoints() < 1 || staLta.getLtaPoints() <= staLta.getStaPoints()) {
            throw new InvalidConfigurationException("feature.sta-lta requires 1 <= sta-points < lta-points");
        }
        if (!(staLta.getTriggerOn() > staLta.getTriggerOff()) || !(staLta.getTriggerOff() > 0)) {
            throw new InvalidConfigurationException("feature.sta-lta requires trigger-on > trigger-off > 0");
        }
        for (Map.Entry<String, Band> entry : bands.entrySet()) {
            Band band = entry.getValue();
            if (band.getLowHz() < 0 || band.getHighHz() <= band.getLowHz()) {
                throw new InvalidConfigurationException("feature.bands." + entry.getKey() + " must satisfy 0 <= low < high");
            }
        }
    }

    private static Map<String, Band> defaultBands() {
        Map<String, Band> map = new LinkedHashMap<>();
        map.put(SourceType.VLF.key(), new Band(0.0005, 0.005));
        map.put(SourceType.AEF.key(), new Band(0.0005, 0.005));
        return map;
    }
}
