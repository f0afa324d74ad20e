package dev.quarry.extraction;

/**
 * Ceiling on the cell grids a document may declare.
 *
 * <p>Declared extents (an XLSX {@code <dimension ref>}, a table's row and column spans) come from
 * the file and are untrusted. They are checked here in {@code long} arithmetic before anything is
 * sized from them. Grids up to {@link #SPARSE_THRESHOLD} cells are always materialized densely;
 * larger ones only when they are also reasonably populated.</p>
 */
public final class SizingGuard {
    public static final long DEFAULT_MAX_CELLS = 100_000_000L;

    /** Extent below which a grid is dense no matter how few cells it populates. */
    public static final long SPARSE_THRESHOLD = 1_000_000L;

    /** Above {@link #SPARSE_THRESHOLD}, a dense grid may hold at most this many cells per populated cell. */
    public static final int DENSITY_FACTOR = 4;

    private static final SizingGuard DEFAULT = new SizingGuard(DEFAULT_MAX_CELLS);

    private final long maxCells;

    public SizingGuard(long maxCells) {
        if (maxCells <= 0) {
            throw new IllegalArgumentException("maxCells must be positive, got " + maxCells);
        }
        this.maxCells = maxCells;
    }

    public static SizingGuard defaults() {
        return DEFAULT;
    }

    public long getMaxCells() {
        return maxCells;
    }

    /**
     * Whether a declared grid is over the ceiling. Overflowing products and negative extents count as over.
     *
     * @param rows declared row count
     * @param cols declared column count
     * @return true if the grid must not be allocated densely
     */
    public boolean exceeds(long rows, long cols) {
        if (rows < 0 || cols < 0) {
            return true;
        }
        try {
            return Math.multiplyExact(rows, cols) > maxCells;
        } catch (ArithmeticException e) {
            return true;
        }
    }

    /**
     * Whether a grid may be materialized densely.
     *
     * @param rows declared row count
     * @param cols declared column count
     * @param populatedCells cells that actually carry a value
     * @return true if within the ceiling and either small or at most {@link #DENSITY_FACTOR} times
     *     the populated cells
     */
    public boolean allowsDense(long rows, long cols, long populatedCells) {
        if (exceeds(rows, cols)) {
            return false;
        }
        long extent = rows * cols;
        if (extent <= SPARSE_THRESHOLD) {
            return true;
        }
        return extent <= Math.max(1L, populatedCells) * DENSITY_FACTOR;
    }
}
