package br.edu.ifba.deduper;

import br.edu.ifba.deduper.bucket.CandidateBucketer;
import br.edu.ifba.deduper.candidate.CandidateGenerator;
import br.edu.ifba.deduper.cluster.ClusteringEngine;
import br.edu.ifba.deduper.core.FileRecord;
import br.edu.ifba.deduper.core.MediaType;
import br.edu.ifba.deduper.core.PerceptualHash;
import br.edu.ifba.deduper.detection.ConcurrencyPlanner;
import br.edu.ifba.deduper.detection.DuplicateDetectionEngine;
import br.edu.ifba.deduper.evidence.EvidenceFormatter;
import br.edu.ifba.deduper.keeper.KeeperRanker;
import br.edu.ifba.deduper.scoring.NameSimilarity;
import br.edu.ifba.deduper.scoring.PairwiseScorer;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared builders for detection tests.
 */
public final class Fixtures {

    public static final Instant CAPTURED = Instant.parse("2024-06-01T10:00:00Z");

    public static final long CODE = 0x5A5A_F0F0_1234_ABCDL;

    private Fixtures() {
    }

    /**
     * Engine wired by hand, outside the container.
     */
    public static DuplicateDetectionEngine engine() {
        NameSimilarity names = new NameSimilarity();
        return new DuplicateDetectionEngine(
            new CandidateBucketer(),
            new CandidateGenerator(names),
            new PairwiseScorer(names),
            new ClusteringEngine(new KeeperRanker()),
            new EvidenceFormatter(),
            new ConcurrencyPlanner()
        );
    }

    public static FileRecord.Builder photo(String id) {
        return FileRecord.builder(id, MediaType.PHOTO)
            .fileName(id + ".jpg")
            .fileSize(1_000_000);
    }

    public static FileRecord.Builder video(String id, List<Long> frames, double durationSeconds) {
        return FileRecord.builder(id, MediaType.VIDEO)
            .fileName(id + ".mp4")
            .fileSize(50_000_000)
            .perceptualHash(PerceptualHash.video(frames, durationSeconds));
    }

    /**
     * Flips the lowest {@code bits} bits of a code, giving a code at exactly that Hamming distance.
     */
    public static long flip(long code, int bits) {
        if (bits >= 64) {
            return ~code;
        }
        return code ^ ((1L << bits) - 1);
    }

    /**
     * Pseudo-random keyframe codes derived from a seed.
     */
    public static List<Long> frames(int count, long seed) {
        List<Long> frames = new ArrayList<>(count);
        long value = seed;
        for (int i = 0; i < count; i++) {
            value = value * 6364136223846793005L + 1442695040888963407L;
            frames.add(value);
        }
        return frames;
    }

    /**
     * Copies frames with every frame moved by {@code bits} bits.
     */
    public static List<Long> shifted(List<Long> frames, int bits) {
        List<Long> shifted = new ArrayList<>(frames.size());
        for (long frame : frames) {
            shifted.add(flip(frame, bits));
        }
        return shifted;
    }
}
