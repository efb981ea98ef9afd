package br.edu.ifba.deduper.bucket;

import br.edu.ifba.deduper.core.DetectOptions;
import br.edu.ifba.deduper.core.FileRecord;
import jakarta.enterprise.context.ApplicationScoped;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Partitions the scanned file set into disjoint buckets before any distance
 * computation.
 *
 * Pure partitioning:
 * 1. Records with identical (media type, checksum, size) form checksum groups;
 *    only each group's representative continues to hash bucketing
 * 2. The remaining records are keyed by (media type, size class)
 * 3. Inside a bucket, records without a perceptual hash are flagged apart
 *
 * A checksum group never spans media types: every group, like every bucket,
 * belongs to exactly one media type. Equal checksums under different media
 * type tags are left to the regular buckets of each type and are not grouped.
 */
@ApplicationScoped
public class CandidateBucketer {

    private static final Logger logger = LoggerFactory.getLogger(CandidateBucketer.class);

    /**
     * Buckets the given records.
     *
     * @param records scanned records in input order
     * @param options detection options (size tolerance)
     * @return buckets and checksum groups
     */
    public BucketingResult bucket(@NotNull List<FileRecord> records, @NotNull DetectOptions options) {
        if (records == null) {
            throw new IllegalArgumentException("records cannot be null");
        }
        double tolerance = options.limits().sizeTolerancePct();

        Map<String, FileRecord> byId = new LinkedHashMap<>();
        for (FileRecord record : records) {
            FileRecord previous = byId.putIfAbsent(record.id(), record);
            if (previous != null) {
                logger.warn("Duplicate file id '{}' in input, keeping the first record", record.id());
            }
        }

        List<FileRecord> sorted = new ArrayList<>(byId.values());
        sorted.sort(Comparator.comparing(FileRecord::id));

        // Step 1: exact checksum short-circuit
        Map<String, List<FileRecord>> byChecksum = new LinkedHashMap<>();
        for (FileRecord record : sorted) {
            if (record.hasChecksum()) {
                String checksumKey = record.mediaType() + "|" + record.checksum() + "|" + record.fileSize();
                byChecksum.computeIfAbsent(checksumKey, k -> new ArrayList<>()).add(record);
            }
        }

        List<ChecksumGroup> checksumGroups = new ArrayList<>();
        Set<String> shortCircuited = new HashSet<>();
        for (List<FileRecord> sameChecksum : byChecksum.values()) {
            if (sameChecksum.size() < 2) {
                continue;
            }
            ChecksumGroup group = new ChecksumGroup(
                sameChecksum.get(0).mediaType(), sameChecksum.get(0).checksum(), sameChecksum);
            checksumGroups.add(group);
            for (int i = 1; i < sameChecksum.size(); i++) {
                shortCircuited.add(sameChecksum.get(i).id());
            }
        }

        // Step 2: size-class buckets
        SortedMap<BucketKey, List<FileRecord>> hashed = new TreeMap<>();
        SortedMap<BucketKey, List<FileRecord>> unhashed = new TreeMap<>();
        for (FileRecord record : sorted) {
            if (shortCircuited.contains(record.id())) {
                continue;
            }
            BucketKey key = new BucketKey(record.mediaType(), sizeClass(record.fileSize(), tolerance));
            SortedMap<BucketKey, List<FileRecord>> target = record.hasPerceptualHash() ? hashed : unhashed;
            target.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
        }

        SortedMap<BucketKey, CandidateBucket> buckets = new TreeMap<>();
        Set<BucketKey> keys = new TreeSet<>(hashed.keySet());
        keys.addAll(unhashed.keySet());
        for (BucketKey key : keys) {
            CandidateBucket bucket = new CandidateBucket(
                key,
                hashed.getOrDefault(key, List.of()),
                unhashed.getOrDefault(key, List.of())
            );
            buckets.put(key, bucket);
            logger.debug("Bucket {}: {} hashed, {} unhashed", key, bucket.hashed().size(), bucket.unhashed().size());
        }

        logger.debug("Bucketed {} records into {} buckets, {} checksum groups ({} records short-circuited)",
            byId.size(), buckets.size(), checksumGroups.size(), shortCircuited.size());

        return new BucketingResult(buckets, checksumGroups, byId, tolerance);
    }

    /**
     * Logarithmic size class: sizes within a factor of {@code 1 + tolerance}
     * of each other land in the same or an adjacent class.
     *
     * @param fileSize size in bytes
     * @param tolerance relative width of a class, in (0, 1)
     * @return class index, 0 for empty files
     */
    public static int sizeClass(long fileSize, double tolerance) {
        if (fileSize <= 1) {
            return 0;
        }
        return (int) Math.floor(Math.log(fileSize) / Math.log1p(tolerance));
    }
}
