package br.edu.ifba.deduper.core;

/**
 * Caller-supplied resource pressure hint.
 *
 * @param cpu CPU pressure in [0.0, 1.0]
 * @param memory memory pressure in [0.0, 1.0]
 */
public record ResourcePressure(double cpu, double memory) {

    public static final ResourcePressure NONE = new ResourcePressure(0.0, 0.0);

    public ResourcePressure {
        if (cpu < 0.0 || cpu > 1.0) {
            throw new IllegalArgumentException("cpu pressure must be in [0.0, 1.0]");
        }
        if (memory < 0.0 || memory > 1.0) {
            throw new IllegalArgumentException("memory pressure must be in [0.0, 1.0]");
        }
    }

    public double peak() {
        return Math.max(cpu, memory);
    }
}
