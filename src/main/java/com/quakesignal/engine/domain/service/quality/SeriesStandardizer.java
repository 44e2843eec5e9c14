package com.quakesignal.engine.domain.service.quality;

import com.quakesignal.engine.domain.model.CanonicalRecord;
import com.quakesignal.engine.domain.model.QualityFlags;
import com.quakesignal.engine.domain.model.Station;
import com.quakesignal.engine.domain.model.StationMatch;
import com.quakesignal.engine.domain.service.spatial.GeoDistance;
import com.quakesignal.engine.domain.service.spatial.StationRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class SeriesStandardizer {

    static final String UNKNOWN_UNITS = "unknown";

    private final QualityProperties properties;

    public List<CanonicalRecord> apply(List<CanonicalRecord> records, StationRegistry registry, String paramsHash) {
        List<CanonicalRecord> out = new ArrayList<>(records.size());
        for (CanonicalRecord record : records) {
            out.add(standardize(record, registry, paramsHash));
        }
        return out;
    }

    private CanonicalRecord standardize(CanonicalRecord record, StationRegistry registry, String paramsHash) {
        Double lat = record.getLat();
        Double lon = record.getLon();
        Double elev = record.getElev() != null && Double.isFinite(record.getElev()) ? record.getElev() : null;
        boolean hasCoordinates = record.hasCoordinates() && GeoDistance.isValidLatitude(lat);
        if (hasCoordinates) {
            lon = GeoDistance.normalizeLongitude(lon);
        } else {
            lat = null;
            lon = null;
        }

        StationMatch match;
        Optional<Station> registered = registry != null ? registry.find(record.getStationId()) : Optional.empty();
        if (registered.isPresent() && hasCoordinates) {
            match = StationMatch.EXACT;
        } else if (registered.isPresent()) {
            Station station = registered.get();
            lat = station.lat();
            lon = station.lon();
            elev = elev != null ? elev : station.elevM();
            match = StationMatch.DOWNGRADE;
        } else {
            match = StationMatch.UNMATCHED;
        }

        QualityFlags flags = record.getQualityFlags().toBuilder()
                .stationMatch(match)
                .build();
        return record.toBuilder()
                .units(resolveUnits(record))
                .lat(lat)
                .lon(lon)
                .elev(elev)
                .qualityFlags(flags)
                .procVersion(properties.getProcVersion())
                .paramsHash(paramsHash)
                .build();
    }

    private String resolveUnits(CanonicalRecord record) {
        String units = properties.resolveUnitAlias(record.getUnits());
        if (units != null) return units;
        String fallback = properties.defaultUnitFor(record.getSource());
        return fallback != null ? fallback : UNKNOWN_UNITS;
    }
}
