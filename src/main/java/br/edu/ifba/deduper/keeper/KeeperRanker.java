package br.edu.ifba.deduper.keeper;

import br.edu.ifba.deduper.core.FileRecord;
import br.edu.ifba.deduper.core.PixelSize;
import jakarta.enterprise.context.ApplicationScoped;
import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Orders duplicate group members by quality and suggests the one to keep.
 *
 * Priority:
 * 1. Higher resolution, then higher bitrate
 * 2. Preferred format family
 * 3. Richer metadata (capture date, GPS)
 * 4. Earliest capture timestamp
 * 5. Smallest file id
 *
 * Advisory only; callers may override the suggestion.
 */
@ApplicationScoped
public class KeeperRanker {

    private static final Map<String, String> FORMAT_FAMILIES = Map.ofEntries(
        Map.entry("dng", "raw"), Map.entry("cr2", "raw"), Map.entry("cr3", "raw"),
        Map.entry("nef", "raw"), Map.entry("arw", "raw"), Map.entry("raf", "raw"),
        Map.entry("orf", "raw"), Map.entry("rw2", "raw"), Map.entry("pef", "raw"),
        Map.entry("srw", "raw"), Map.entry("raw", "raw"),
        Map.entry("tif", "tiff"), Map.entry("tiff", "tiff"),
        Map.entry("jpg", "jpeg"), Map.entry("jpeg", "jpeg"), Map.entry("jpe", "jpeg"),
        Map.entry("heic", "heic"), Map.entry("heif", "heic")
    );

    /**
     * Returns members best first.
     *
     * @param members group members
     * @param formatPreference format families, most preferred first
     */
    public List<FileRecord> rank(@NotNull List<FileRecord> members, @NotNull List<String> formatPreference) {
        List<FileRecord> ranked = new ArrayList<>(members);
        ranked.sort(comparator(formatPreference));
        return ranked;
    }

    public Optional<String> suggest(@NotNull List<FileRecord> members, @NotNull List<String> formatPreference) {
        if (members.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(rank(members, formatPreference).get(0).id());
    }

    /**
     * Deterministic best-first comparator.
     */
    public Comparator<FileRecord> comparator(@NotNull List<String> formatPreference) {
        List<String> preference = formatPreference.stream()
            .map(f -> f.toLowerCase(Locale.ROOT).trim())
            .toList();

        Comparator<FileRecord> byResolution = Comparator.comparingLong(KeeperRanker::pixelCount).reversed();
        Comparator<FileRecord> byBitrate = Comparator.comparingLong(KeeperRanker::bitrate).reversed();
        Comparator<FileRecord> byFormat = Comparator.comparingInt(r -> formatRank(r, preference));
        Comparator<FileRecord> byMetadata = Comparator.comparingInt(KeeperRanker::metadataRichness).reversed();
        Comparator<FileRecord> byCapture = Comparator.comparing(
            FileRecord::captureTimestamp, Comparator.nullsLast(Comparator.<Instant>naturalOrder()));

        return byResolution
            .thenComparing(byBitrate)
            .thenComparing(byFormat)
            .thenComparing(byMetadata)
            .thenComparing(byCapture)
            .thenComparing(FileRecord::id);
    }

    /**
     * Format family of a record: "raw", "tiff", "jpeg", "heic" or the bare extension.
     */
    public static String formatFamily(@NotNull FileRecord record) {
        String extension = record.fileExtension();
        return FORMAT_FAMILIES.getOrDefault(extension, extension);
    }

    /**
     * One-line explanation of why the first ranked record is suggested.
     */
    public String describe(@NotNull FileRecord keeper) {
        StringBuilder reason = new StringBuilder("Suggested keeper ").append(keeper.id());
        List<String> traits = new ArrayList<>();
        if (keeper.dimensions() != null) {
            traits.add(keeper.dimensions().width() + "x" + keeper.dimensions().height());
        }
        if (keeper.bitrate() != null) {
            traits.add(keeper.bitrate() + "bps");
        }
        String family = formatFamily(keeper);
        if (!family.isEmpty()) {
            traits.add(family);
        }
        if (keeper.captureTimestamp() != null) {
            traits.add("captured " + keeper.captureTimestamp());
        }
        if (keeper.gpsPresent()) {
            traits.add("GPS");
        }
        if (!traits.isEmpty()) {
            reason.append(" (").append(String.join(", ", traits)).append(')');
        }
        return reason.toString();
    }

    private static long pixelCount(FileRecord record) {
        PixelSize dimensions = record.dimensions();
        return dimensions == null ? 0L : dimensions.pixelCount();
    }

    private static long bitrate(FileRecord record) {
        return record.bitrate() == null ? 0L : record.bitrate();
    }

    private static int formatRank(FileRecord record, List<String> preference) {
        int rank = preference.indexOf(formatFamily(record));
        return rank < 0 ? preference.size() : rank;
    }

    private static int metadataRichness(FileRecord record) {
        int richness = 0;
        if (record.captureTimestamp() != null) richness++;
        if (record.gpsPresent()) richness++;
        return richness;
    }
}
