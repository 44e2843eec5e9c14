package com.quakesignal.engine.domain.service.spatial;

import com.quakesignal.engine.domain.exception.InvalidConfigurationException;
import com.quakesignal.engine.domain.exception.SpatialIndexInvariantException;
import com.quakesignal.engine.domain.model.Station;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
public final class SpatialIndex {

    static final int NODE_CAPACITY = 8;
    static final int MAX_DEPTH = 20;
    private static final double BOX_EPSILON_DEG = 1e-9;

    private final StationRegistry registry;
    private final Node root;
    private final boolean verifyQueries;

    private SpatialIndex(StationRegistry registry, boolean verifyQueries) {
        this.registry = registry;
        this.verifyQueries = verifyQueries;
        this.root = new Node(-90.0, 90.0, -180.0, 180.0, 0);
        for (int i = 0; i < registry.size(); i++) {
            root.insert(i, registry);
        }
        int indexed = root.count();
        if (indexed != registry.size()) {
            throw new SpatialIndexInvariantException(
                    "spatial index holds " + indexed + " stations, registry has " + registry.size());
        }
    }

    public static SpatialIndex build(StationRegistry registry) {
        return build(registry, false);
    }

    public static SpatialIndex build(StationRegistry registry, boolean verifyQueries) {
        SpatialIndex index = new SpatialIndex(registry, verifyQueries);
        log.info("[Spatial] 인덱스 구축 완료: stations={}, verify={}", registry.size(), verifyQueries);
        return index;
    }

    public StationRegistry registry() {
        return registry;
    }

    public List<StationHit> query(double centerLat, double centerLon, double radiusKm) {
        if (!(radiusKm > 0) || !Double.isFinite(radiusKm)) {
            throw new InvalidConfigurationException("radius must be positive: " + radiusKm);
        }
        if (!GeoDistance.isValidLatitude(centerLat) || !Double.isFinite(centerLon)) {
            throw new IllegalArgumentException("invalid query center: " + centerLat + "," + centerLon);
        }
        double lon = GeoDistance.normalizeLongitude(centerLon);

        List<Integer> candidates = new ArrayList<>();
        for (double[] box : boundingBoxes(centerLat, lon, radiusKm)) {
            root.collect(box[0], box[1], box[2], box[3], candidates, registry);
        }

        List<StationHit> hits = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();
        for (int index : candidates) {
            if (!seen.add(index)) continue;
            Station station = registry.get(index);
            double distance = GeoDistance.haversineKm(centerLat, lon, station.lat(), station.lon());
            if (distance <= radiusKm) {
                hits.add(new StationHit(index, station, distance));
            }
        }
        hits.sort(StationHit.BY_DISTANCE);

        if (verifyQueries) {
            verifyAgainstBruteForce(centerLat, lon, radiusKm, hits);
        }
        return hits;
    }

    public Set<String> queryIds(double centerLat, double centerLon, double radiusKm) {
        return query(centerLat, centerLon, radiusKm).stream()
                .map(StationHit::stationId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    List<StationHit> bruteForce(double centerLat, double centerLon, double radiusKm) {
        List<StationHit> hits = new ArrayList<>();
        for (int i = 0; i < registry.size(); i++) {
            Station station = registry.get(i);
            double distance = GeoDistance.haversineKm(centerLat, centerLon, station.lat(), station.lon());
            if (distance <= radiusKm) {
                hits.add(new StationHit(i, station, distance));
            }
        }
        hits.sort(StationHit.BY_DISTANCE);
        return hits;
    }

    private void verifyAgainstBruteForce(double lat, double lon, double radiusKm, List<StationHit> hits) {
        Set<Integer> expected = bruteForce(lat, lon, radiusKm).stream()
                .map(StationHit::index)
                .collect(Collectors.toSet());
        Set<Integer> actual = hits.stream().map(StationHit::index).collect(Collectors.toSet());
        if (!expected.equals(actual)) {
            throw new SpatialIndexInvariantException(String.format(Locale.ROOT,
                    "spatial query mismatch at (%.6f, %.6f) r=%.3fkm: index=%d, brute-force=%d",
                    lat, lon, radiusKm, actual.size(), expected.size()));
        }
    }

    static List<double[]> boundingBoxes(double lat, double lon, double radiusKm) {
        double angular = radiusKm / GeoDistance.EARTH_RADIUS_KM;
        List<double[]> boxes = new ArrayList<>(2);
        if (angular >= Math.PI) {
            boxes.add(new double[]{-90.0, 90.0, -180.0, 180.0});
            return boxes;
        }

        double dLat = Math.toDegrees(angular);
        double minLat = lat - dLat - BOX_EPSILON_DEG;
        double maxLat = lat + dLat + BOX_EPSILON_DEG;
        if (minLat <= -90.0 || maxLat >= 90.0) {
            boxes.add(new double[]{Math.max(-90.0, minLat), Math.min(90.0, maxLat), -180.0, 180.0});
            return boxes;
        }

        double ratio = Math.sin(angular) / Math.cos(Math.toRadians(lat));
        if (ratio >= 1.0) {
            boxes.add(new double[]{minLat, maxLat, -180.0, 180.0});
            return boxes;
        }
        double dLon = Math.toDegrees(Math.asin(ratio)) + BOX_EPSILON_DEG;
        double minLon = lon - dLon;
        double maxLon = lon + dLon;
        if (minLon < -180.0) {
            boxes.add(new double[]{minLat, maxLat, minLon + 360.0, 180.0});
            boxes.add(new double[]{minLat, maxLat, -180.0, maxLon});
        } else if (maxLon > 180.0) {
            boxes.add(new double[]{minLat, maxLat, minLon, 180.0});
            boxes.add(new double[]{minLat, maxLat, -180.0, maxLon - 360.0});
        } else {
            boxes.add(new double[]{minLat, maxLat, minLon, maxLon});
        }
        return boxes;
    }

    private static final class Node {

        private final double minLat;
        private final double maxLat;
        private final double minLon;
        private final double maxLon;
        private final int depth;
        private List<Integer> entries = new ArrayList<>();
        private Node[] children;

        Node(double minLat, double maxLat, double minLon, double maxLon, int depth) {
            this.minLat = minLat;
            this.maxLat = maxLat;
            this.minLon = minLon;
            this.maxLon = maxLon;
            this.depth = depth;
        }

        void insert(int index, StationRegistry registry) {
            if (children != null) {
                childFor(registry.get(index)).insert(index, registry);
                return;
            }
            entries.add(index);
            if (entries.size() > NODE_CAPACITY && depth < MAX_DEPTH) {
                split(registry);
            }
        }

        private void split(StationRegistry registry) {
            double midLat = (minLat + maxLat) / 2.0;
            double midLon = (minLon + maxLon) / 2.0;
            children = new Node[]{
                    new Node(minLat, midLat, minLon, midLon, depth + 1),
                    new Node(minLat, midLat, midLon, maxLon, depth + 1),
                    new Node(midLat, maxLat, minLon, midLon, depth + 1),
                    new Node(midLat, maxLat, midLon, maxLon, depth + 1)
            };
            List<Integer> pending = entries;
            entries = null;
            for (int index : pending) {
                childFor(registry.get(index)).insert(index, registry);
            }
        }

        private Node childFor(Station station) {
            double midLat = (minLat + maxLat) / 2.0;
            double midLon = (minLon + maxLon) / 2.0;
            int row = station.lat() < midLat ? 0 : 2;
            int col = station.lon() < midLon ? 0 : 1;
            return children[row + col];
        }

        void collect(double qMinLat, double qMaxLat, double qMinLon, double qMaxLon,
                     List<Integer> out, StationRegistry registry) {
            if (qMaxLat < minLat || qMinLat > maxLat || qMaxLon < minLon || qMinLon > maxLon) {
                return;
            }
            if (children != null) {
                for (Node child : children) {
                    child.collect(qMinLat, qMaxLat, qMinLon, qMaxLon, out, registry);
                }
                return;
            }
            for (int index : entries) {
                Station station = registry.get(index);
                if (station.lat() >= qMinLat && station.lat() <= qMaxLat
                        && station.lon() >= qMinLon && station.lon() <= qMaxLon) {
                    out.add(index);
                }
            }
        }

        int count() {
            if (children == null) return entries.size();
            int total = 0;
            for (Node child : children) {
                total += child.count();
            }
            return total;
        }
    }
}
