package br.edu.ifba.deduper.core;

/**
 * Inclusive Hamming distance range.
 *
 * @param lower lowest distance in the band
 * @param upper highest distance in the band
 */
public record DistanceBand(int lower, int upper) {

    public boolean contains(int distance) {
        return distance >= lower && distance <= upper;
    }

    @Override
    public String toString() {
        return lower + "-" + upper;
    }
}
