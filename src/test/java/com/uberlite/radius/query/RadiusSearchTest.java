package com.uberlite.radius.query;

import com.uberlite.radius.config.RadiusSearchConfig;
import com.uberlite.radius.grid.FakeHexGrid;
import com.uberlite.radius.grid.GeoDistance;
import com.uberlite.radius.grid.H3HexGrid;
import com.uberlite.radius.index.CompactIndex;
import com.uberlite.radius.index.CompactRange;
import com.uberlite.radius.resolution.EdgeLengthTable;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RadiusSearchTest {

    private static final double LAT = 37.7749;
    private static final double LON = -122.4194;

    private final RadiusSearch h3Search = RadiusSearch.withH3(RadiusSearchConfig.defaults());

    @Test
    void ringCellsAreProjectedAndMerged() {
        // Siblings under the same res 8 parent with adjacent digits give touching ranges.
        long center = FakeHexGrid.cell(9, 1, 1, 1, 1, 1, 1, 1, 1, 3);
        long sibling = FakeHexGrid.cell(9, 1, 1, 1, 1, 1, 1, 1, 1, 4);
        long distant = FakeHexGrid.cell(2, 0, 0, 0, 0, 0, 0, 0, 0, 0);
        var grid = new FakeHexGrid()
            .withCellForAnyPoint(center)
            .withRadius(center, 200.0)
            .withRing(center, 1, Set.of(center, sibling, distant));
        var search = new RadiusSearch(grid, EdgeLengthTable.standard(), RadiusSearchConfig.defaults());

        List<CompactRange> ranges = search.rangesByRadius(0, 0, 400);

        assertEquals(2, ranges.size());
        long span = (1L << 18) - 1;
        assertEquals(CompactIndex.toCompact(distant), ranges.get(0).upperBound());
        assertEquals(CompactIndex.toCompact(center) - span, ranges.get(1).lowerBound());
        assertEquals(CompactIndex.toCompact(sibling), ranges.get(1).upperBound());
    }

    @Test
    void ringByRadiusReportsResolutionAndRingSize() {
        RingCover cover = h3Search.ringByRadius(LAT, LON, 1_000);

        assertEquals(8, cover.resolution());
        assertEquals(h3Search.selectResolution(1_000), cover.resolution());
        assertTrue(cover.ringSize() >= 1);
        assertTrue(cover.cells().contains(H3HexGrid.instance().cellOf(LAT, LON, 8)));
        assertEquals(1 + 3 * cover.ringSize() * (cover.ringSize() + 1), cover.cells().size());
    }

    @Test
    void nearbyPointsMatchAndFarPointsDoNot() {
        var filter = h3Search.buildRadiusPredicate(LAT, LON, 1_000);

        assertTrue(filter.test(h3Search.compactIndexOf(LAT, LON, 15)));
        // ~300 m north
        double nearLat = LAT + 0.0027;
        assertTrue(GeoDistance.meters(LAT, LON, nearLat, LON) < 1_000);
        assertTrue(filter.test(h3Search.compactIndexOf(nearLat, LON, 15)));
        // ~22 km north
        assertFalse(filter.test(h3Search.compactIndexOf(LAT + 0.2, LON, 15)));
    }

    @Test
    void coarserIndexResolutionStillMatchesAsLongAsItIsFinerThanQuery() {
        var filter = h3Search.buildRadiusPredicate(LAT, LON, 1_000);
        // Query runs at resolution 8; entities indexed at 10 still carry their full prefix.
        assertTrue(filter.test(h3Search.compactIndexOf(LAT, LON, 10)));
    }

    @Test
    void rangesAreDisjointAndOrdered() {
        var ranges = h3Search.rangesByRadius(LAT, LON, 5_000);
        assertFalse(ranges.isEmpty());
        for (int i = 1; i < ranges.size(); i++) {
            assertTrue(ranges.get(i).lowerBound() > ranges.get(i - 1).upperBound() + 1);
        }
    }

    @Test
    void compactIndexOfCellMatchesCoordinateVariant() {
        long fromPoint = h3Search.compactIndexOf(LAT, LON, 12);
        assertTrue(fromPoint < (1L << 52));
        assertEquals(fromPoint, h3Search.compactIndexOf(fromPoint));
    }

    @Test
    void globeSizedRadiusCoversEveryBaseCell() {
        var filter = h3Search.buildRadiusPredicate(LAT, LON, 1e300);

        assertEquals(1, filter.ranges().size());
        assertTrue(filter.test(h3Search.compactIndexOf(LAT, LON, 15)));
        // antipode of the query point
        assertTrue(filter.test(h3Search.compactIndexOf(-LAT, LON + 180, 15)));
    }

    @Test
    void finestQueryResolutionComesFromTable() {
        assertEquals(10, h3Search.finestQueryResolution());
    }

    @Test
    void invalidRadiusIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> h3Search.buildRadiusPredicate(LAT, LON, -5));
    }
}
