package com.quakesignal.engine.domain.service.link;

import com.quakesignal.engine.domain.exception.InvalidConfigurationException;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "link")
public class LinkProperties {

    private static final long MS_PER_HOUR = 3_600_000L;

    private long windowBeforeHours = 72;
    private long windowAfterHours = 24;
    private double radiusKm = 100.0;
    private boolean verifySpatialQueries = false;

    public long beforeMs() {
        return windowBeforeHours * MS_PER_HOUR;
    }

    public long afterMs() {
        return windowAfterHours * MS_PER_HOUR;
    }

    public void validate() {
        if (!(radiusKm > 0) || !Double.isFinite(radiusKm)) {
            throw new InvalidConfigurationException("link.radius-km must be positive: " + radiusKm);
        }
        if (windowBeforeHours < 0 || windowAfterHours < 0) {
            throw new InvalidConfigurationException("link window is inverted: before=" + windowBeforeHours
                    + "h, after=" + windowAfterHours + "h");
        }
        if (windowBeforeHours + windowAfterHours <= 0) {
            throw new InvalidConfigurationException("link window is empty");
        }
    }
}
