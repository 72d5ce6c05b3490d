package com.uberlite.radius;

import com.uberlite.radius.config.RadiusSearchConfig;
import com.uberlite.radius.query.RadiusSearch;
import com.uberlite.radius.query.RangeFilter;
import com.uberlite.radius.query.RingCover;
import com.uberlite.radius.store.CompactIndexStore;
import com.uberlite.radius.store.StoredLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Random;

/**
 * Indexes synthetic bikes around central San Francisco and runs radius
 * queries of increasing size against the compact-index store.
 */
public class RadiusSearchDemo {
    private static final Logger log = LoggerFactory.getLogger(RadiusSearchDemo.class);

    private static final double CENTER_LAT = 37.7749;
    private static final double CENTER_LON = -122.4194;
    private static final int ENTITY_COUNT = 5_000;
    private static final double[] RADII_METERS = {50, 250, 1_000, 5_000};

    public static void main(String[] args) throws Exception {
        var config = RadiusSearchConfig.fromEnvironment();
        var search = RadiusSearch.withH3(config);
        Path dbDir = Files.createTempDirectory("radius-search-demo");

        try (var store = new CompactIndexStore(dbDir.toString(), search, config)) {
            // Fixed seed keeps runs comparable; offsets span roughly +/- 5 km.
            var random = new Random(42);
            for (int i = 0; i < ENTITY_COUNT; i++) {
                double lat = CENTER_LAT + (random.nextDouble() - 0.5) * 0.09;
                double lon = CENTER_LON + (random.nextDouble() - 0.5) * 0.11;
                store.put(StoredLocation.of(String.format("bike-%05d", i), lat, lon));
            }
            log.info("Indexed {} entities at resolution {}", ENTITY_COUNT, config.indexResolution());

            for (double radius : RADII_METERS) {
                RingCover cover = search.ringByRadius(CENTER_LAT, CENTER_LON, radius);
                RangeFilter filter = search.buildRadiusPredicate(CENTER_LAT, CENTER_LON, radius);
                int candidates = store.findCandidates(filter).size();
                int hits = store.findWithinRadius(CENTER_LAT, CENTER_LON, radius).size();

                log.info("radius={}m resolution={} k={} cells={} ranges={} candidates={} within={}",
                    (long) radius, cover.resolution(), cover.ringSize(), cover.cells().size(),
                    filter.ranges().size(), candidates, hits);
            }
        } finally {
            deleteDirectory(dbDir.toFile());
        }
    }

    private static void deleteDirectory(File dir) {
        File[] files = dir.listFiles();
        if (files != null) {
            for (File file : files) {
                deleteDirectory(file);
            }
        }
        if (!dir.delete()) {
            log.warn("Could not delete {}", dir);
        }
    }
}
