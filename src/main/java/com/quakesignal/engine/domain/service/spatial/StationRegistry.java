package com.quakesignal.engine.domain.service.spatial;

import com.quakesignal.engine.domain.model.CanonicalRecord;
import com.quakesignal.engine.domain.model.Station;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class StationRegistry {

    private final List<Station> stations;
    private final Map<String, Integer> indexById;

    private StationRegistry(List<Station> stations) {
        this.stations = Collections.unmodifiableList(stations);
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < stations.size(); i++) {
            index.put(stations.get(i).stationId(), i);
        }
        this.indexById = Collections.unmodifiableMap(index);
    }

    public static StationRegistry of(Collection<Station> input) {
        Map<String, Station> unique = new LinkedHashMap<>();
        for (Station station : input) {
            unique.putIfAbsent(station.stationId(), normalize(station));
        }
        List<Station> sorted = new ArrayList<>(unique.values());
        sorted.sort(Comparator.comparing(Station::stationId));
        return new StationRegistry(sorted);
    }

    public static StationRegistry fromRecords(Iterable<CanonicalRecord> records) {
        Map<String, Station> firstSeen = new LinkedHashMap<>();
        for (CanonicalRecord record : records) {
            if (record.getStationId() == null || firstSeen.containsKey(record.getStationId())) continue;
            if (!record.hasCoordinates() || !GeoDistance.isValidLatitude(record.getLat())) continue;
            Double elev = record.getElev() != null && Double.isFinite(record.getElev()) ? record.getElev() : null;
            firstSeen.put(record.getStationId(),
                    new Station(record.getStationId(), record.getLat(), record.getLon(), elev));
        }
        return of(firstSeen.values());
    }

    public static StationRegistry empty() {
        return new StationRegistry(new ArrayList<>());
    }

    private static Station normalize(Station station) {
        return new Station(station.stationId(), station.lat(),
                GeoDistance.normalizeLongitude(station.lon()), station.elevM());
    }

    public int size() {
        return stations.size();
    }

    public boolean isEmpty() {
        return stations.isEmpty();
    }

    public Station get(int index) {
        return stations.get(index);
    }

    public int indexOf(String stationId) {
        Integer index = indexById.get(stationId);
        return index != null ? index : -1;
    }

    public Optional<Station> find(String stationId) {
        int index = indexOf(stationId);
        return index >= 0 ? Optional.of(stations.get(index)) : Optional.empty();
    }

    public List<Station> all() {
        return stations;
    }
}
