package br.edu.ifba.deduper.bucket;

import br.edu.ifba.deduper.core.FileRecord;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Output of the bucketer.
 *
 * @param buckets disjoint buckets in key order
 * @param checksumGroups exact-checksum groups, short-circuited out of hash bucketing except for their representative
 * @param records every accepted record by id
 * @param sizeTolerancePct tolerance the size classes were computed with
 */
public record BucketingResult(
    @NotNull SortedMap<BucketKey, CandidateBucket> buckets,
    @NotNull List<ChecksumGroup> checksumGroups,
    @NotNull Map<String, FileRecord> records,
    double sizeTolerancePct
) {

    public BucketingResult {
        if (buckets == null || checksumGroups == null || records == null) {
            throw new IllegalArgumentException("bucketing parts cannot be null");
        }
        checksumGroups = List.copyOf(checksumGroups);
    }

    public int totalFiles() {
        return records.size();
    }

    public double averageBucketSize() {
        if (buckets.isEmpty()) return 0.0;
        return buckets.values().stream().mapToInt(CandidateBucket::size).average().orElse(0.0);
    }

    /**
     * Bucket key a record would fall into, whether or not it was kept in bucketing.
     */
    public BucketKey keyOf(@NotNull FileRecord record) {
        return new BucketKey(record.mediaType(), CandidateBucketer.sizeClass(record.fileSize(), sizeTolerancePct));
    }
}
