package br.edu.ifba.deduper.index;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Brute-force fallback used when a bucket is too large for the tree to pay off.
 */
public final class LinearScanIndex implements NeighborIndex {

    private long[] codes;
    private final List<String> fileIds;
    private volatile boolean frozen;

    public LinearScanIndex() {
        this(16);
    }

    public LinearScanIndex(int expectedSize) {
        int capacity = Math.max(16, expectedSize);
        this.codes = new long[capacity];
        this.fileIds = new ArrayList<>(capacity);
    }

    @Override
    public void insert(long code, @NotNull String fileId) {
        if (frozen) {
            throw new IllegalStateException("cannot insert into a frozen index");
        }
        if (fileId == null) {
            throw new IllegalArgumentException("fileId cannot be null");
        }
        int position = fileIds.size();
        if (position == codes.length) {
            codes = Arrays.copyOf(codes, codes.length * 2);
        }
        codes[position] = code;
        fileIds.add(fileId);
    }

    @Override
    public List<NeighborMatch> query(long code, int radius, @NotNull ComparisonCounter counter) {
        if (radius < 0) {
            throw new IllegalArgumentException("radius cannot be negative");
        }
        List<NeighborMatch> matches = new ArrayList<>();
        int n = fileIds.size();
        for (int i = 0; i < n; i++) {
            int distance = HammingDistance.between(code, codes[i]);
            if (distance <= radius) {
                matches.add(new NeighborMatch(fileIds.get(i), distance));
            }
        }
        counter.add(n);
        return matches;
    }

    @Override
    public void freeze() {
        frozen = true;
    }

    @Override
    public boolean isFrozen() {
        return frozen;
    }

    @Override
    public int size() {
        return fileIds.size();
    }
}
