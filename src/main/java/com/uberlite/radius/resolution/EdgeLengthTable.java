package com.uberlite.radius.resolution;

import com.uberlite.radius.config.RadiusSearchConfigurationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Average hexagon edge length per resolution, ordered finest first.
 *
 * The standard table stops at resolution 10 (~66 m edges) and ends with an
 * unbounded sentinel mapped to resolution 0, so any finite radius resolves.
 * Instances are immutable and shared across threads.
 */
public final class EdgeLengthTable {

    public static final int SENTINEL_EDGE_LENGTH = Integer.MAX_VALUE;

    public record Entry(int edgeLengthMeters, int resolution) {

        /** The sentinel covers every radius regardless of the edge multiplier. */
        public boolean isSentinel() {
            return edgeLengthMeters == SENTINEL_EDGE_LENGTH;
        }
    }

    private static final EdgeLengthTable STANDARD = new EdgeLengthTable(List.of(
        new Entry(66, 10),
        new Entry(174, 9),
        new Entry(461, 8),
        new Entry(1_221, 7),
        new Entry(3_230, 6),
        new Entry(8_544, 5),
        new Entry(22_606, 4),
        new Entry(59_811, 3),
        new Entry(158_245, 2),
        new Entry(418_676, 1),
        new Entry(1_107_713, 0),
        new Entry(SENTINEL_EDGE_LENGTH, 0)
    ));

    private final List<Entry> entries;

    public EdgeLengthTable(List<Entry> entries) {
        this.entries = List.copyOf(validate(entries));
    }

    public static EdgeLengthTable standard() {
        return STANDARD;
    }

    /** Builds a table from finest-first entries and appends the sentinel. */
    public static EdgeLengthTable withSentinel(List<Entry> entries) {
        var all = new ArrayList<>(entries);
        all.add(new Entry(SENTINEL_EDGE_LENGTH, 0));
        return new EdgeLengthTable(all);
    }

    public List<Entry> entries() {
        return entries;
    }

    /** Finest resolution any query can select from this table. */
    public int finestResolution() {
        return entries.get(0).resolution();
    }

    private static List<Entry> validate(List<Entry> entries) {
        if (entries == null || entries.isEmpty()) {
            throw new RadiusSearchConfigurationException("Edge length table is empty");
        }
        Entry previous = null;
        for (Entry entry : entries) {
            if (entry.resolution() < 0 || entry.resolution() > 15) {
                throw new RadiusSearchConfigurationException(
                    "Edge length table entry has resolution outside 0-15: " + entry);
            }
            if (entry.edgeLengthMeters() <= 0) {
                throw new RadiusSearchConfigurationException(
                    "Edge length table entry has non-positive edge length: " + entry);
            }
            if (previous != null) {
                // Finest first: edges grow, resolutions never get finer.
                if (entry.edgeLengthMeters() <= previous.edgeLengthMeters()) {
                    throw new RadiusSearchConfigurationException(
                        "Edge lengths must strictly increase, got " + previous + " then " + entry);
                }
                if (entry.resolution() > previous.resolution()) {
                    throw new RadiusSearchConfigurationException(
                        "Resolutions must not increase, got " + previous + " then " + entry);
                }
            }
            previous = entry;
        }
        return entries;
    }
}
