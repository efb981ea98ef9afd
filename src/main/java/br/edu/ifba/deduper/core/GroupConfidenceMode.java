package br.edu.ifba.deduper.core;

import java.util.List;

/**
 * How member confidences fold into a group confidence.
 */
public enum GroupConfidenceMode {

    /** Weakest member decides. */
    MINIMUM,

    MAXIMUM,

    MEAN;

    public double aggregate(List<Double> confidences) {
        if (confidences.isEmpty()) {
            return 0.0;
        }
        return switch (this) {
            case MINIMUM -> confidences.stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
            case MAXIMUM -> confidences.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
            case MEAN -> confidences.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        };
    }
}
