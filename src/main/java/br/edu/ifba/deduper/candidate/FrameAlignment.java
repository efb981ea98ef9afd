package br.edu.ifba.deduper.candidate;

import br.edu.ifba.deduper.index.HammingDistance;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Index-aligned keyframe comparison of two videos.
 *
 * @param frameDistances Hamming distance per aligned position
 * @param firstFrameCount keyframes of the first video
 * @param secondFrameCount keyframes of the second video
 */
public record FrameAlignment(
    @NotNull List<Integer> frameDistances,
    int firstFrameCount,
    int secondFrameCount
) {

    public FrameAlignment {
        if (frameDistances == null || frameDistances.isEmpty()) {
            throw new IllegalArgumentException("frameDistances cannot be null or empty");
        }
        frameDistances = List.copyOf(frameDistances);
    }

    /**
     * Aligns the first {@code min(a, b)} frames of both videos.
     */
    public static FrameAlignment between(@NotNull List<Long> first, @NotNull List<Long> second) {
        int aligned = Math.min(first.size(), second.size());
        List<Integer> distances = new ArrayList<>(aligned);
        for (int i = 0; i < aligned; i++) {
            distances.add(HammingDistance.between(first.get(i), second.get(i)));
        }
        return new FrameAlignment(distances, first.size(), second.size());
    }

    public int alignedFrames() {
        return frameDistances.size();
    }

    /**
     * Effective distance of the pair: the worst aligned frame.
     */
    public int maxDistance() {
        return frameDistances.stream().mapToInt(Integer::intValue).max().orElse(0);
    }

    /**
     * True when the frame counts differ and trailing frames went uncompared.
     */
    public boolean truncated() {
        return firstFrameCount != secondFrameCount;
    }
}
