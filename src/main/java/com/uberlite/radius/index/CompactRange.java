package com.uberlite.radius.index;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inclusive interval of compact index values.
 *
 * @param lowerBound smallest compact index in the range
 * @param upperBound largest compact index in the range
 */
public record CompactRange(
    @JsonProperty("lower_bound") long lowerBound,
    @JsonProperty("upper_bound") long upperBound
) {
    public CompactRange {
        if (lowerBound > upperBound) {
            throw new IllegalArgumentException(
                "Range lower bound " + lowerBound + " exceeds upper bound " + upperBound);
        }
    }

    public static CompactRange singleton(long value) {
        return new CompactRange(value, value);
    }

    public boolean contains(long compactIndex) {
        return lowerBound <= compactIndex && compactIndex <= upperBound;
    }

    /** Keeps this lower bound; callers merge in ascending lower-bound order. */
    public CompactRange unionWith(CompactRange other) {
        return new CompactRange(lowerBound, Math.max(upperBound, other.upperBound));
    }

    /** Number of compact values covered. */
    public long size() {
        return upperBound - lowerBound + 1;
    }
}
