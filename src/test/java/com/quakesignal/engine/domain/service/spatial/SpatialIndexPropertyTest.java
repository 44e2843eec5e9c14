package com.quakesignal.engine.domain.service.spatial;

import com.quakesignal.engine.domain.model.Station;
import net.jqwik.api.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for the station spatial index.
 */
class SpatialIndexPropertyTest {

    /**
     * Property: The index returns exactly the stations a brute-force Haversine scan returns.
     */
    @Property(tries = 100)
    void queryMatchesBruteForce(@ForAll("stations") List<Station> stations,
                                @ForAll("latitudes") Double lat,
                                @ForAll("longitudes") Double lon,
                                @ForAll("radii") Double radiusKm) {
        SpatialIndex index = SpatialIndex.build(StationRegistry.of(stations));

        Set<Integer> actual = index.query(lat, lon, radiusKm).stream()
                .map(StationHit::index).collect(Collectors.toSet());
        Set<Integer> expected = index.bruteForce(lat, lon, radiusKm).stream()
                .map(StationHit::index).collect(Collectors.toSet());

        assertThat(actual).isEqualTo(expected);
    }

    /**
     * Property: Every hit lies within the radius and hits are sorted by distance.
     */
    @Property(tries = 100)
    void hitsAreWithinRadiusAndSorted(@ForAll("stations") List<Station> stations,
                                      @ForAll("latitudes") Double lat,
                                      @ForAll("longitudes") Double lon,
                                      @ForAll("radii") Double radiusKm) {
        List<StationHit> hits = SpatialIndex.build(StationRegistry.of(stations)).query(lat, lon, radiusKm);

        for (int i = 0; i < hits.size(); i++) {
            assertThat(hits.get(i).distanceKm()).isLessThanOrEqualTo(radiusKm);
            if (i > 0) {
                assertThat(hits.get(i).distanceKm()).isGreaterThanOrEqualTo(hits.get(i - 1).distanceKm());
            }
        }
    }

    @Provide
    Arbitrary<List<Station>> stations() {
        Arbitrary<double[]> coordinates = Combinators.combine(latitudes(), longitudes())
                .as((lat, lon) -> new double[]{lat, lon});
        return coordinates.list().ofMaxSize(200).map(coords -> {
            List<Station> out = new ArrayList<>(coords.size());
            for (int i = 0; i < coords.size(); i++) {
                out.add(new Station(String.format("ST%03d", i), coords.get(i)[0], coords.get(i)[1], null));
            }
            return out;
        });
    }

    @Provide
    Arbitrary<Double> latitudes() {
        return Arbitraries.frequencyOf(
                Tuple.of(8, Arbitraries.doubles().between(-90.0, 90.0)),
                Tuple.of(1, Arbitraries.doubles().between(85.0, 90.0)),
                Tuple.of(1, Arbitraries.doubles().between(-90.0, -85.0)));
    }

    @Provide
    Arbitrary<Double> longitudes() {
        return Arbitraries.frequencyOf(
                Tuple.of(8, Arbitraries.doubles().between(-180.0, 180.0)),
                Tuple.of(1, Arbitraries.doubles().between(175.0, 180.0)),
                Tuple.of(1, Arbitraries.doubles().between(-180.0, -175.0)));
    }

    @Provide
    Arbitrary<Double> radii() {
        return Arbitraries.doubles().between(0.5, 3000.0);
    }
}
