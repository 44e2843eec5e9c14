package com.quakesignal.engine.domain.service.run;

import com.quakesignal.engine.domain.exception.InvalidConfigurationException;
import com.quakesignal.engine.domain.model.CatalogEvent;
import com.quakesignal.engine.domain.model.Station;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "run")
public class RunProperties {

    private boolean enabled = false;
    private String outputDir = "outputs";
    private String recordsFile;
    private String catalogFile;
    private int workerThreads = 4;
    private int partitionQueueCapacity = 1024;
    private long flushTimeoutSeconds = 600;
    private boolean resume = true;
    private List<EventSpec> events = new ArrayList<>();
    private List<StationSpec> stations = new ArrayList<>();

    @Getter
    @Setter
    public static class EventSpec {
        private String eventId;
        private String time;
        private double lat;
        private double lon;
        private Double depthKm;
        private Double mag;

        public CatalogEvent toEvent() {
            if (time == null) {
                throw new InvalidConfigurationException("run.events[" + eventId + "].time is required");
            }
            try {
                return new CatalogEvent(eventId, Instant.parse(time), lat, lon, depthKm, mag);
            } catch (DateTimeParseException e) {
                throw new InvalidConfigurationException("run.events[" + eventId + "].time is not an ISO-8601 instant: " + time);
            } catch (IllegalArgumentException e) {
                throw new InvalidConfigurationException("run.events[" + eventId + "] is invalid: " + e.getMessage());
            }
        }
    }

    @Getter
    @Setter
    public static class StationSpec {
        private String stationId;
        private double lat;
        private double lon;
        private Double elevM;

        public Station toStation() {
            return new Station(stationId, lat, lon, elevM);
        }
    }

    public void validate() {
        if (workerThreads < 1) {
            throw new InvalidConfigurationException("run.worker-threads must be >= 1");
        }
        if (partitionQueueCapacity < 1 || Integer.bitCount(partitionQueueCapacity) != 1) {
            throw new InvalidConfigurationException("run.partition-queue-capacity must be a power of two: "
                    + partitionQueueCapacity);
        }
        if (flushTimeoutSeconds < 1) {
            throw new InvalidConfigurationException("run.flush-timeout-seconds must be >= 1");
        }
        for (EventSpec event : events) {
            event.toEvent();
        }
    }
}
