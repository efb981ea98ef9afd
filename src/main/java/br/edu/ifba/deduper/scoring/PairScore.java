package br.edu.ifba.deduper.scoring;

import br.edu.ifba.deduper.core.ConfidencePenalty;
import br.edu.ifba.deduper.core.ConfidenceSignal;
import br.edu.ifba.deduper.core.FilePair;
import br.edu.ifba.deduper.core.MediaType;
import br.edu.ifba.deduper.core.SignalKey;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Optional;

/**
 * Pairwise confidence with the signals and penalties behind it.
 *
 * @param pair the two files
 * @param mediaType shared media type
 * @param confidence clamp(sum of contributions + sum of penalties, 0, 1)
 * @param signals computed signals in key order
 * @param penalties penalties for signals that could not be computed
 * @param rationale textual trail, including every missing signal and partial extraction
 * @param hashDistance effective perceptual hash distance, null when either hash is missing
 * @param secondaryDistance secondary hash distance, null when either secondary hash is missing
 * @param checksumMatch true when the checksums are identical
 * @param truncated true when video keyframe counts differed
 * @param durationMismatch true when video durations differ beyond tolerance
 */
public record PairScore(
    @NotNull FilePair pair,
    @NotNull MediaType mediaType,
    double confidence,
    @NotNull List<ConfidenceSignal> signals,
    @NotNull List<ConfidencePenalty> penalties,
    @NotNull List<String> rationale,
    @Nullable Integer hashDistance,
    @Nullable Integer secondaryDistance,
    boolean checksumMatch,
    boolean truncated,
    boolean durationMismatch
) {

    public PairScore {
        if (pair == null) {
            throw new IllegalArgumentException("pair cannot be null");
        }
        if (mediaType == null) {
            throw new IllegalArgumentException("mediaType cannot be null");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0.0, 1.0]");
        }
        signals = List.copyOf(signals);
        penalties = List.copyOf(penalties);
        rationale = List.copyOf(rationale);
    }

    public Optional<ConfidenceSignal> signal(@NotNull SignalKey key) {
        return signals.stream().filter(s -> s.key() == key).findFirst();
    }

    public boolean hasBothHashes() {
        return hashDistance != null;
    }

    public String toLogString() {
        return String.format("Score(%s) [%s]: %.3f hash=%s secondary=%s%s%s",
            pair, mediaType, confidence, hashDistance, secondaryDistance,
            checksumMatch ? " checksum" : "",
            truncated ? " truncated" : "");
    }
}
