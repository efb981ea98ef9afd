package br.edu.ifba.deduper.core;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of signal kinds the pairwise scorer can produce.
 */
public enum SignalKey {

    CHECKSUM("checksum", "Checksum"),

    HASH("hash", "Hash Distance"),

    NAME("name", "Name"),

    CAPTURE_TIME("captureTime", "Capture Date"),

    DURATION("duration", "Duration"),

    /** File size and pixel dimension similarity. */
    METADATA("metadata", "Metadata");

    private final String id;
    private final String label;

    SignalKey(String id, String label) {
        this.id = id;
        this.label = label;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public String label() {
        return label;
    }
}
