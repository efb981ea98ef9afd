package br.edu.ifba.deduper.scoring;

import br.edu.ifba.deduper.candidate.CandidatePair;
import br.edu.ifba.deduper.candidate.FrameAlignment;
import br.edu.ifba.deduper.core.ConfidencePenalty;
import br.edu.ifba.deduper.core.ConfidenceSignal;
import br.edu.ifba.deduper.core.DetectOptions;
import br.edu.ifba.deduper.core.FilePair;
import br.edu.ifba.deduper.core.FileRecord;
import br.edu.ifba.deduper.core.MediaType;
import br.edu.ifba.deduper.core.PenaltyKey;
import br.edu.ifba.deduper.core.PixelSize;
import br.edu.ifba.deduper.core.SignalKey;
import br.edu.ifba.deduper.core.SignalWeights;
import br.edu.ifba.deduper.core.Thresholds;
import br.edu.ifba.deduper.index.HammingDistance;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Scores candidate pairs from independent weighted signals.
 *
 * Signals:
 * - checksum: 1.0 if equal (short-circuits to confidence 1.0), else 0.0
 * - hash: 1 - distance / (5 * threshold), clamped
 * - name: stem similarity, see {@link NameSimilarity}
 * - captureTime: 1.0 inside a 5 minute window, then halves every further window
 * - duration: 1.0 inside the tolerance, then linear down to 0 at five times the tolerance
 * - metadata: mean of size ratio and pixel count ratio
 *
 * A signal whose inputs are missing becomes a penalty instead.
 * The scorer is pure; it is safe to call from many threads.
 */
@ApplicationScoped
public class PairwiseScorer {

    private static final Logger logger = LoggerFactory.getLogger(PairwiseScorer.class);

    /** Distance at which the hash raw score reaches 0, as a multiple of the threshold. */
    public static final int HASH_CEILING_FACTOR = 5;

    public static final Duration CAPTURE_WINDOW = Duration.ofMinutes(5);

    /** Duration raw score reaches 0 at this multiple of the tolerance. */
    static final double DURATION_FALLOFF_FACTOR = 5.0;

    private final NameSimilarity nameSimilarity;

    @Inject
    public PairwiseScorer(NameSimilarity nameSimilarity) {
        this.nameSimilarity = nameSimilarity;
    }

    /**
     * Scores two records, computing video alignment when needed.
     */
    public PairScore score(@NotNull FileRecord a, @NotNull FileRecord b, @NotNull DetectOptions options) {
        return score(a, b, null, options);
    }

    /**
     * Scores a candidate pair.
     *
     * @param a first record
     * @param b second record
     * @param candidate candidate carrying precomputed distances (nullable)
     * @param options detection options
     * @return the pair score
     */
    public PairScore score(
            @NotNull FileRecord a,
            @NotNull FileRecord b,
            @Nullable CandidatePair candidate,
            @NotNull DetectOptions options) {

        if (a.mediaType() != b.mediaType()) {
            throw new IllegalArgumentException(
                String.format("cannot compare %s with %s: media types differ", a.id(), b.id()));
        }
        if (a.id().compareTo(b.id()) > 0) {
            FileRecord swap = a;
            a = b;
            b = swap;
        }

        SignalWeights weights = options.weights();
        Thresholds thresholds = options.thresholds();
        FilePair pair = FilePair.of(a.id(), b.id());
        MediaType mediaType = a.mediaType();

        if (a.hasChecksum() && b.hasChecksum() && a.checksum().equals(b.checksum())) {
            return checksumMatch(a, b, weights);
        }

        List<ConfidenceSignal> signals = new ArrayList<>();
        List<ConfidencePenalty> penalties = new ArrayList<>();
        List<String> rationale = new ArrayList<>();

        // checksum
        if (a.hasChecksum() && b.hasChecksum()) {
            signals.add(ConfidenceSignal.of(SignalKey.CHECKSUM, weights.checksum(), 0.0,
                "checksums differ", 1.0, 0.0));
            rationale.add("checksums differ");
        } else {
            String missing = missingIds(a.hasChecksum() ? null : a, b.hasChecksum() ? null : b);
            penalties.add(ConfidencePenalty.of(PenaltyKey.CHECKSUM_MISSING, "checksum unavailable for " + missing));
            rationale.add("MissingSignal: checksum unavailable for " + missing);
        }

        // perceptual hash
        Integer hashDistance = null;
        Integer secondaryDistance = null;
        boolean truncated = false;
        if (mediaType.expectsPerceptualHash()) {
            if (a.hasPerceptualHash() && b.hasPerceptualHash()) {
                int threshold = thresholds.distanceFor(mediaType);
                String description;
                if (mediaType == MediaType.VIDEO) {
                    FrameAlignment alignment = candidate != null && candidate.alignment() != null
                        ? candidate.alignment()
                        : FrameAlignment.between(a.perceptualHash().codes(), b.perceptualHash().codes());
                    hashDistance = alignment.maxDistance();
                    truncated = alignment.truncated();
                    description = String.format("max keyframe distance=%d over %d frames",
                        hashDistance, alignment.alignedFrames());
                    if (truncated) {
                        rationale.add(String.format(
                            "PartialExtraction: keyframe counts differ (%d vs %d), compared first %d",
                            alignment.firstFrameCount(), alignment.secondFrameCount(), alignment.alignedFrames()));
                    }
                } else {
                    hashDistance = candidate != null && candidate.hashDistance() != null
                        ? candidate.hashDistance()
                        : HammingDistance.between(a.perceptualHash().primaryCode(), b.perceptualHash().primaryCode());
                    description = "dHash distance=" + hashDistance;
                }
                signals.add(ConfidenceSignal.of(SignalKey.HASH, weights.hash(),
                    hashRawScore(hashDistance, threshold), description,
                    hashDistance.doubleValue(), (double) threshold));
                rationale.add(description);
            } else {
                String missing = missingIds(a.hasPerceptualHash() ? null : a, b.hasPerceptualHash() ? null : b);
                penalties.add(ConfidencePenalty.of(PenaltyKey.HASH_MISSING, "perceptual hash unavailable for " + missing));
                rationale.add("MissingSignal: perceptual hash unavailable for " + missing);
            }

            if (a.secondaryHash() != null && b.secondaryHash() != null) {
                secondaryDistance = HammingDistance.between(a.secondaryHash(), b.secondaryHash());
                rationale.add(String.format("secondary hash distance=%d (confirms at <= %d)",
                    secondaryDistance, thresholds.confirmationHashDistance()));
            }
        }

        // name
        double nameScore = nameSimilarity.similarity(a.fileName(), b.fileName());
        String nameRationale = String.format("name similarity=%d%%", Math.round(nameScore * 100));
        signals.add(ConfidenceSignal.of(SignalKey.NAME, weights.name(), nameScore, nameRationale,
            nameScore, thresholds.nameSimilarityThreshold()));
        rationale.add(nameRationale);

        // capture time
        if (a.captureTimestamp() != null && b.captureTimestamp() != null) {
            Duration delta = Duration.between(a.captureTimestamp(), b.captureTimestamp()).abs();
            String description = "capture time delta=" + delta.getSeconds() + "s";
            signals.add(ConfidenceSignal.of(SignalKey.CAPTURE_TIME, weights.captureTime(),
                captureTimeRawScore(delta), description,
                (double) delta.getSeconds(), (double) CAPTURE_WINDOW.getSeconds()));
            rationale.add(description);
        } else {
            rationale.add("capture time unavailable");
        }

        // duration
        boolean durationMismatch = false;
        if (mediaType == MediaType.VIDEO || mediaType == MediaType.AUDIO) {
            Double durationA = a.effectiveDuration();
            Double durationB = b.effectiveDuration();
            if (durationA != null && durationB != null) {
                double longer = Math.max(durationA, durationB);
                double deltaPct = longer == 0.0 ? 0.0 : Math.abs(durationA - durationB) / longer;
                double tolerance = thresholds.durationTolerancePct();
                durationMismatch = deltaPct > tolerance;
                String description = String.format("duration delta=%.1f%%", deltaPct * 100);
                signals.add(ConfidenceSignal.of(SignalKey.DURATION, weights.duration(),
                    durationRawScore(deltaPct, tolerance), description, deltaPct, tolerance));
                rationale.add(description);
            } else {
                String missing = missingIds(durationA == null ? a : null, durationB == null ? b : null);
                penalties.add(ConfidencePenalty.of(PenaltyKey.DURATION_MISSING, "duration unavailable for " + missing));
                rationale.add("MissingSignal: duration unavailable for " + missing);
            }
        }

        // metadata
        double metadataScore = metadataRawScore(a, b);
        String metadataRationale = String.format("size/dimension similarity=%d%%", Math.round(metadataScore * 100));
        signals.add(ConfidenceSignal.of(SignalKey.METADATA, weights.metadata(), metadataScore, metadataRationale,
            metadataScore, 1.0));
        rationale.add(metadataRationale);

        double sum = signals.stream().mapToDouble(ConfidenceSignal::contribution).sum()
            + penalties.stream().mapToDouble(ConfidencePenalty::value).sum();
        double confidence = Math.max(0.0, Math.min(1.0, sum));

        PairScore score = new PairScore(pair, mediaType, confidence, signals, penalties, rationale,
            hashDistance, secondaryDistance, false, truncated, durationMismatch);
        if (logger.isDebugEnabled()) {
            logger.debug(score.toLogString());
        }
        return score;
    }

    /**
     * Confirmed duplicate: only the checksum signal, confidence 1.0.
     */
    public PairScore checksumMatch(@NotNull FileRecord a, @NotNull FileRecord b, @NotNull SignalWeights weights) {
        ConfidenceSignal checksum = ConfidenceSignal.of(SignalKey.CHECKSUM, weights.checksum(), 1.0,
            "checksum match", 0.0, 0.0);
        return new PairScore(FilePair.of(a.id(), b.id()), a.mediaType(), 1.0, List.of(checksum), List.of(),
            List.of("checksum match"), null, null, true, false, false);
    }

    /**
     * Hash raw score: linear from 1.0 at distance 0 to 0.0 at
     * {@code HASH_CEILING_FACTOR * threshold}.
     */
    public double hashRawScore(int distance, int threshold) {
        int ceiling = Math.max(1, HASH_CEILING_FACTOR * threshold);
        return clamp(1.0 - (double) distance / ceiling);
    }

    /**
     * Capture time raw score: 1.0 up to the window, then halving per further window.
     */
    public double captureTimeRawScore(@NotNull Duration delta) {
        double seconds = Math.abs(delta.toMillis()) / 1000.0;
        double window = CAPTURE_WINDOW.getSeconds();
        if (seconds <= window) {
            return 1.0;
        }
        return clamp(Math.pow(0.5, (seconds - window) / window));
    }

    /**
     * Duration raw score for a relative delta of the longer duration.
     */
    public double durationRawScore(double deltaPct, double tolerance) {
        if (deltaPct <= tolerance) {
            return 1.0;
        }
        double span = tolerance * (DURATION_FALLOFF_FACTOR - 1.0);
        if (span <= 0.0) {
            return 0.0;
        }
        return clamp(1.0 - (deltaPct - tolerance) / span);
    }

    /**
     * Confidence a pair at exactly the duplicate distance earns from its hash.
     * Pairs that cannot be judged by distance must reach it from other signals.
     */
    public double duplicateThreshold(@NotNull DetectOptions options) {
        int threshold = options.thresholds().imageDistance();
        return options.weights().hash() * hashRawScore(threshold, threshold);
    }

    double metadataRawScore(FileRecord a, FileRecord b) {
        double sizeScore = ratio(a.fileSize(), b.fileSize());
        PixelSize dimsA = a.dimensions();
        PixelSize dimsB = b.dimensions();
        if (dimsA == null || dimsB == null) {
            return sizeScore;
        }
        return (sizeScore + ratio(dimsA.pixelCount(), dimsB.pixelCount())) / 2.0;
    }

    private static double ratio(long x, long y) {
        long larger = Math.max(x, y);
        if (larger == 0) {
            return 1.0;
        }
        return (double) Math.min(x, y) / larger;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static String missingIds(@Nullable FileRecord first, @Nullable FileRecord second) {
        if (first != null && second != null) {
            return first.id() + ", " + second.id();
        }
        return first != null ? first.id() : second.id();
    }
}
