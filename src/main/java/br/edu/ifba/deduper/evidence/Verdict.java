package br.edu.ifba.deduper.evidence;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Pass/warn/fail classification of one evidence item.
 */
public enum Verdict {

    PASS,

    WARN,

    FAIL;

    static final double PASS_ABOVE = 0.3;
    static final double WARN_ABOVE = 0.1;

    /**
     * Classifies a contribution: above 0.3 passes, above 0.1 warns, anything else fails.
     */
    public static Verdict forContribution(double contribution) {
        if (contribution > PASS_ABOVE) {
            return PASS;
        }
        if (contribution > WARN_ABOVE) {
            return WARN;
        }
        return FAIL;
    }

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
