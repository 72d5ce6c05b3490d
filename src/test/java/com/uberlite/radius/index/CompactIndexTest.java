package com.uberlite.radius.index;

import com.uberlite.radius.grid.FakeHexGrid;
import com.uberlite.radius.grid.H3HexGrid;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CompactIndexTest {

    @Test
    void stripsModeAndResolutionBits() {
        long cell = FakeHexGrid.cell(12, 3, 5);
        long compact = CompactIndex.toCompact(cell);

        assertEquals(0, compact >>> 52);
        assertEquals(12, compact >>> 45);
        assertEquals(cell & 0x000F_FFFF_FFFF_FFFFL, compact);
    }

    @Test
    void maskingIsIdempotent() {
        long cell = H3HexGrid.instance().cellOf(40.7128, -74.0060, 10);
        long once = CompactIndex.toCompact(cell);
        assertEquals(once, CompactIndex.toCompact(once));
    }

    @Test
    void sameCellAtDifferentResolutionsDiffersOnlyInUnusedDigits() {
        // A res 9 cell fills digit 10 with 7; its res 10 child at digit d < 7 sorts below it.
        long parent = FakeHexGrid.cell(20, 1, 2, 3, 4, 5, 6, 0, 1, 2);
        long child = FakeHexGrid.cell(20, 1, 2, 3, 4, 5, 6, 0, 1, 2, 4);
        assertTrue(CompactIndex.toCompact(child) < CompactIndex.toCompact(parent));
    }
}
