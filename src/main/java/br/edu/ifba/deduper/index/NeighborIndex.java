package br.edu.ifba.deduper.index;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Exact radius search over 64-bit codes under Hamming distance.
 *
 * <p>Indexes follow a build-then-freeze discipline: a single writer inserts
 * every code, calls {@link #freeze()}, and from then on any number of threads
 * may query concurrently. Inserting into a frozen index fails.</p>
 */
public interface NeighborIndex {

    /**
     * Adds a code for the given file.
     *
     * @throws IllegalStateException if the index is frozen
     */
    void insert(long code, @NotNull String fileId);

    /**
     * Returns every file whose code lies within {@code radius} of {@code code}.
     * The result has no false negatives and no false positives.
     *
     * @param counter receives the number of distance computations performed
     */
    List<NeighborMatch> query(long code, int radius, @NotNull ComparisonCounter counter);

    default List<NeighborMatch> query(long code, int radius) {
        return query(code, radius, new ComparisonCounter());
    }

    /**
     * Ends the build phase.
     */
    void freeze();

    boolean isFrozen();

    /**
     * Number of inserted codes.
     */
    int size();

    /**
     * Creates a BK-tree, or a linear scan when the expected size exceeds the
     * fallback ceiling.
     */
    static NeighborIndex forSize(int expectedSize, int fallbackCeiling) {
        if (expectedSize > fallbackCeiling) {
            return new LinearScanIndex(expectedSize);
        }
        return new BKTree(expectedSize);
    }
}
