package br.edu.ifba.deduper.index;

/**
 * Counts distance computations for one unit of work. Not thread-safe: each
 * worker task owns its counter.
 */
public final class ComparisonCounter {

    private long count;

    public void add(long comparisons) {
        count += comparisons;
    }

    public void increment() {
        count++;
    }

    public long count() {
        return count;
    }
}
