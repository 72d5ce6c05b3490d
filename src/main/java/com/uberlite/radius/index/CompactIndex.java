package com.uberlite.radius.index;

/**
 * Strips the mode/resolution prefix from an H3 cell id, keeping only the
 * base cell and per-level child digits.
 *
 * The same transform must be used when indexing entities and when projecting
 * query ranges, otherwise the numeric comparisons are meaningless.
 */
public final class CompactIndex {

    /** Low 52 bits: 7-bit base cell followed by fifteen 3-bit child digits. */
    public static final long MASK = 0x000F_FFFF_FFFF_FFFFL;

    public static final int BITS_PER_LEVEL = 3;

    private CompactIndex() {}

    public static long toCompact(long cell) {
        return cell & MASK;
    }
}
