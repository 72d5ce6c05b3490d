package com.uberlite.radius.index;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Unions overlapping and touching ranges into a minimal ascending set.
 *
 * Two ranges touch when no compact value lies between them
 * ({@code next.lower == current.upper + 1}).
 */
public final class RangeMerger {

    private static final Comparator<CompactRange> BY_LOWER_BOUND =
        Comparator.comparingLong(CompactRange::lowerBound);

    private RangeMerger() {}

    public static List<CompactRange> union(Collection<CompactRange> ranges) {
        var ordered = new ArrayList<>(ranges);
        // List.sort is stable
        ordered.sort(BY_LOWER_BOUND);

        var merged = new ArrayList<CompactRange>();
        CompactRange current = null;
        for (CompactRange next : ordered) {
            if (current == null) {
                current = next;
            } else if (touches(current, next)) {
                current = current.unionWith(next);
            } else {
                merged.add(current);
                current = next;
            }
        }
        if (current != null) {
            merged.add(current);
        }
        return merged;
    }

    private static boolean touches(CompactRange current, CompactRange next) {
        return current.upperBound() == Long.MAX_VALUE
            || next.lowerBound() <= current.upperBound() + 1;
    }
}
