package br.edu.ifba.deduper.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * A scanned file as delivered by the metadata and hashing collaborators.
 *
 * <p>Records are immutable inputs owned by the caller. A {@code null}
 * perceptual hash means upstream extraction failed for this file; it is never
 * silently absent.</p>
 *
 * @param id stable unique identifier
 * @param mediaType media category
 * @param fileSize size in bytes
 * @param checksum content hash, e.g. hex SHA-256 (nullable)
 * @param perceptualHash dHash code or video keyframe codes (nullable)
 * @param secondaryHash alternate 64-bit perceptual hash used to confirm borderline pairs (nullable)
 * @param fileName file name including extension
 * @param captureTimestamp capture time from EXIF/container metadata (nullable)
 * @param createdAt filesystem creation time (nullable)
 * @param durationSeconds media duration for audio/video (nullable)
 * @param dimensions pixel dimensions (nullable)
 * @param bitrate bitrate in bits per second (nullable)
 * @param gpsPresent whether location metadata is present
 * @param partial whether the extractor flagged this record as partial or timed out
 */
public record FileRecord(
    @NotNull String id,
    @NotNull MediaType mediaType,
    long fileSize,
    @Nullable String checksum,
    @Nullable PerceptualHash perceptualHash,
    @Nullable Long secondaryHash,
    @NotNull String fileName,
    @Nullable Instant captureTimestamp,
    @Nullable Instant createdAt,
    @Nullable Double durationSeconds,
    @Nullable PixelSize dimensions,
    @Nullable Long bitrate,
    boolean gpsPresent,
    boolean partial
) {

    public FileRecord {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        Objects.requireNonNull(mediaType, "mediaType must not be null");
        if (fileSize < 0) {
            throw new IllegalArgumentException("fileSize cannot be negative");
        }
        if (fileName == null) {
            throw new IllegalArgumentException("fileName cannot be null");
        }
        if (checksum != null && checksum.isBlank()) {
            checksum = null;
        }
    }

    public static Builder builder(@NotNull String id, @NotNull MediaType mediaType) {
        return new Builder(id, mediaType);
    }

    public boolean hasPerceptualHash() {
        return perceptualHash != null;
    }

    public boolean hasChecksum() {
        return checksum != null;
    }

    /**
     * Returns true when the record lacks data its media type should carry,
     * or the extractor marked it partial.
     */
    public boolean isIncomplete() {
        return partial || (mediaType.expectsPerceptualHash() && perceptualHash == null);
    }

    /**
     * Duration from the explicit field, falling back to the video signature.
     */
    @Nullable
    public Double effectiveDuration() {
        if (durationSeconds != null) {
            return durationSeconds;
        }
        return perceptualHash != null ? perceptualHash.durationSeconds() : null;
    }

    /**
     * Lower-case extension without the dot, or an empty string.
     */
    @NotNull
    public String fileExtension() {
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * File name without its extension.
     */
    @NotNull
    public String baseName() {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    public static final class Builder {
        private final String id;
        private final MediaType mediaType;
        private long fileSize;
        private String checksum;
        private PerceptualHash perceptualHash;
        private Long secondaryHash;
        private String fileName;
        private Instant captureTimestamp;
        private Instant createdAt;
        private Double durationSeconds;
        private PixelSize dimensions;
        private Long bitrate;
        private boolean gpsPresent;
        private boolean partial;

        private Builder(String id, MediaType mediaType) {
            this.id = id;
            this.mediaType = mediaType;
            this.fileName = id;
        }

        public Builder fileSize(long fileSize) {
            this.fileSize = fileSize;
            return this;
        }

        public Builder checksum(@Nullable String checksum) {
            this.checksum = checksum;
            return this;
        }

        public Builder perceptualHash(@Nullable PerceptualHash perceptualHash) {
            this.perceptualHash = perceptualHash;
            return this;
        }

        public Builder imageHash(long code) {
            this.perceptualHash = PerceptualHash.image(code);
            return this;
        }

        public Builder secondaryHash(@Nullable Long secondaryHash) {
            this.secondaryHash = secondaryHash;
            return this;
        }

        public Builder fileName(@NotNull String fileName) {
            this.fileName = Objects.requireNonNull(fileName, "fileName must not be null");
            return this;
        }

        public Builder captureTimestamp(@Nullable Instant captureTimestamp) {
            this.captureTimestamp = captureTimestamp;
            return this;
        }

        public Builder createdAt(@Nullable Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder durationSeconds(@Nullable Double durationSeconds) {
            this.durationSeconds = durationSeconds;
            return this;
        }

        public Builder dimensions(int width, int height) {
            this.dimensions = new PixelSize(width, height);
            return this;
        }

        public Builder bitrate(@Nullable Long bitrate) {
            this.bitrate = bitrate;
            return this;
        }

        public Builder gpsPresent(boolean gpsPresent) {
            this.gpsPresent = gpsPresent;
            return this;
        }

        public Builder partial(boolean partial) {
            this.partial = partial;
            return this;
        }

        public FileRecord build() {
            return new FileRecord(
                id, mediaType, fileSize, checksum, perceptualHash, secondaryHash, fileName,
                captureTimestamp, createdAt, durationSeconds, dimensions, bitrate, gpsPresent, partial
            );
        }
    }
}
