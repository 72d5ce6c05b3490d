package com.uberlite.radius.query;

import com.uberlite.radius.config.RadiusSearchConfig;
import com.uberlite.radius.grid.H3HexGrid;
import com.uberlite.radius.grid.HexGrid;
import com.uberlite.radius.index.CompactIndex;
import com.uberlite.radius.index.CompactRange;
import com.uberlite.radius.index.RangeMerger;
import com.uberlite.radius.index.RangeProjector;
import com.uberlite.radius.resolution.EdgeLengthTable;
import com.uberlite.radius.resolution.ResolutionSelector;
import com.uberlite.radius.resolution.RingEnumerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Turns a search circle into compact-index ranges for backends that can only
 * filter on scalar ranges.
 *
 * Flow: radius → resolution → center cell → k-ring → per-cell ranges → union.
 * The result is a superset of the circle; exact distance checks belong to the caller.
 *
 * Stateless and thread-safe; the grid, table and config are fixed at construction.
 */
public class RadiusSearch {
    private static final Logger log = LoggerFactory.getLogger(RadiusSearch.class);

    private final HexGrid grid;
    private final EdgeLengthTable table;
    private final ResolutionSelector resolutionSelector;
    private final RingEnumerator ringEnumerator;
    private final RangeProjector rangeProjector;

    public RadiusSearch(HexGrid grid, EdgeLengthTable table, RadiusSearchConfig config) {
        this.grid = grid;
        this.table = table;
        this.resolutionSelector = new ResolutionSelector(table, config.edgeMultiplier());
        this.ringEnumerator = new RingEnumerator(grid, config.ringMultiplier());
        this.rangeProjector = new RangeProjector(grid);
    }

    public static RadiusSearch withH3() {
        return withH3(RadiusSearchConfig.fromEnvironment());
    }

    public static RadiusSearch withH3(RadiusSearchConfig config) {
        return new RadiusSearch(H3HexGrid.instance(), EdgeLengthTable.standard(), config);
    }

    /** Compact index of the cell containing a point, for write-time indexing. */
    public long compactIndexOf(double lat, double lon, int resolution) {
        return CompactIndex.toCompact(grid.cellOf(lat, lon, resolution));
    }

    public long compactIndexOf(long cell) {
        return CompactIndex.toCompact(cell);
    }

    public int selectResolution(double radiusMeters) {
        return resolutionSelector.selectResolution(radiusMeters);
    }

    /**
     * Finest resolution a query can run at. Entities must be indexed at this
     * resolution or finer: a coarser cell fills the missing digits with 7 and
     * lands above every finer query range.
     */
    public int finestQueryResolution() {
        return table.finestResolution();
    }

    public RingCover ringByRadius(double lat, double lon, double radiusMeters) {
        int resolution = resolutionSelector.selectResolution(radiusMeters);
        long center = grid.cellOf(lat, lon, resolution);
        int k = ringEnumerator.ringSize(center, radiusMeters);
        Set<Long> cells = ringEnumerator.ring(center, k);
        return new RingCover(resolution, k, cells);
    }

    public List<CompactRange> rangesByRadius(double lat, double lon, double radiusMeters) {
        RingCover cover = ringByRadius(lat, lon, radiusMeters);

        var ranges = new ArrayList<CompactRange>(cover.cells().size());
        for (long cell : cover.cells()) {
            ranges.add(rangeProjector.project(cell));
        }
        List<CompactRange> merged = RangeMerger.union(ranges);

        log.debug("radius={}m at ({}, {}): resolution={} k={} cells={} ranges={}",
            radiusMeters, lat, lon, cover.resolution(), cover.ringSize(),
            cover.cells().size(), merged.size());
        return merged;
    }

    public RangeFilter buildRadiusPredicate(double lat, double lon, double radiusMeters) {
        return RangeFilter.of(rangesByRadius(lat, lon, radiusMeters));
    }
}
