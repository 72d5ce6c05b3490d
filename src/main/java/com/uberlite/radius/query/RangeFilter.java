package com.uberlite.radius.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.uberlite.radius.index.CompactRange;
import com.uberlite.radius.index.RangeMerger;

import java.util.Collection;
import java.util.List;
import java.util.function.LongPredicate;

/**
 * Disjunction of inclusive range tests over an entity's compact index.
 *
 * Kept as data rather than a closure so a query layer can translate it into its
 * native filter, e.g. {@code (h3 BETWEEN a AND b) OR (h3 BETWEEN c AND d)}.
 * Ranges are always merged and ascending; an empty filter matches nothing.
 *
 * @param ranges merged ranges ordered by lower bound
 */
public record RangeFilter(
    @JsonProperty("ranges") List<CompactRange> ranges
) implements LongPredicate {

    private static final RangeFilter NONE = new RangeFilter(List.of());

    public RangeFilter {
        ranges = ranges == null ? List.of() : List.copyOf(RangeMerger.union(ranges));
    }

    public static RangeFilter of(Collection<CompactRange> ranges) {
        return new RangeFilter(List.copyOf(ranges));
    }

    public static RangeFilter none() {
        return NONE;
    }

    public boolean matchesNothing() {
        return ranges.isEmpty();
    }

    @Override
    public boolean test(long compactIndex) {
        // Last range whose lower bound is <= compactIndex.
        int lo = 0;
        int hi = ranges.size() - 1;
        int candidate = -1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            if (ranges.get(mid).lowerBound() <= compactIndex) {
                candidate = mid;
                lo = mid + 1;
            } else {
                hi = mid - 1;
            }
        }
        return candidate >= 0 && ranges.get(candidate).contains(compactIndex);
    }
}
