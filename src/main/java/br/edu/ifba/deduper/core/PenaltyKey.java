package br.edu.ifba.deduper.core;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Penalties applied when a signal cannot be computed.
 *
 * Each penalty replaces the signal it names, so a pair never carries both.
 */
public enum PenaltyKey {

    HASH_MISSING("hashMissing", -0.1, SignalKey.HASH),

    CHECKSUM_MISSING("checksumMissing", -0.05, SignalKey.CHECKSUM),

    DURATION_MISSING("durationMissing", -0.05, SignalKey.DURATION);

    private final String id;
    private final double value;
    private final SignalKey replaces;

    PenaltyKey(String id, double value, SignalKey replaces) {
        this.id = id;
        this.value = value;
        this.replaces = replaces;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public double value() {
        return value;
    }

    public SignalKey replaces() {
        return replaces;
    }

    /**
     * Human-readable label derived from the id, e.g. {@code hashMissing} becomes {@code Hash Missing}.
     */
    public String label() {
        StringBuilder label = new StringBuilder();
        for (int i = 0; i < id.length(); i++) {
            char c = id.charAt(i);
            if (i == 0) {
                label.append(Character.toUpperCase(c));
            } else if (Character.isUpperCase(c)) {
                label.append(' ').append(c);
            } else {
                label.append(c);
            }
        }
        return label.toString();
    }
}
