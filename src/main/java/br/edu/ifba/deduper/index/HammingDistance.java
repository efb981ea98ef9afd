package br.edu.ifba.deduper.index;

/**
 * Hamming distance over 64-bit codes.
 */
public final class HammingDistance {

    private HammingDistance() {
    }

    public static int between(long a, long b) {
        return Long.bitCount(a ^ b);
    }
}
