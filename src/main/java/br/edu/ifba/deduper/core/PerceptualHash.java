package br.edu.ifba.deduper.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Perceptual fingerprint supplied by the hashing collaborator.
 *
 * <p>A photo carries exactly one 64-bit dHash code. A video carries the ordered
 * list of per-keyframe codes plus the clip duration in seconds.</p>
 *
 * @param codes 64-bit codes (one for photos, one per sampled keyframe for videos)
 * @param durationSeconds clip duration, only meaningful for videos (nullable)
 */
public record PerceptualHash(
    @NotNull List<Long> codes,
    @Nullable Double durationSeconds
) {

    public PerceptualHash {
        if (codes == null || codes.isEmpty()) {
            throw new IllegalArgumentException("codes cannot be null or empty");
        }
        if (durationSeconds != null && durationSeconds < 0) {
            throw new IllegalArgumentException("durationSeconds cannot be negative");
        }
        codes = List.copyOf(codes);
    }

    /**
     * Creates an image fingerprint from a single dHash code.
     */
    public static PerceptualHash image(long code) {
        return new PerceptualHash(List.of(code), null);
    }

    /**
     * Creates a video fingerprint from ordered keyframe codes.
     */
    public static PerceptualHash video(@NotNull List<Long> frameCodes, @Nullable Double durationSeconds) {
        return new PerceptualHash(frameCodes, durationSeconds);
    }

    /**
     * Returns the first (for photos, the only) code.
     */
    public long primaryCode() {
        return codes.get(0);
    }

    public int frameCount() {
        return codes.size();
    }
}
