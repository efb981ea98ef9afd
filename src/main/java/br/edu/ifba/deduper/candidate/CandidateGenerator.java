package br.edu.ifba.deduper.candidate;

import br.edu.ifba.deduper.bucket.BucketKey;
import br.edu.ifba.deduper.bucket.BucketingResult;
import br.edu.ifba.deduper.bucket.CandidateBucket;
import br.edu.ifba.deduper.core.CancellationToken;
import br.edu.ifba.deduper.core.DetectOptions;
import br.edu.ifba.deduper.core.FilePair;
import br.edu.ifba.deduper.core.FileRecord;
import br.edu.ifba.deduper.core.MediaType;
import br.edu.ifba.deduper.index.ComparisonCounter;
import br.edu.ifba.deduper.index.NeighborIndex;
import br.edu.ifba.deduper.index.NeighborMatch;
import br.edu.ifba.deduper.index.VideoFrameIndex;
import br.edu.ifba.deduper.scoring.NameSimilarity;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Produces the candidate pairs of a scan.
 *
 * Algorithm:
 * 1. Build one neighbor index per bucket (video: one per keyframe position),
 *    in parallel across buckets, then freeze them
 * 2. Query each hashed record against its own bucket's index and the next
 *    size class's index with radius max(distance, confirmation band upper)
 * 3. Compare each unhashed record by name against its own and adjacent buckets
 * 4. Deduplicate unordered pairs and sort them by file ids
 */
@ApplicationScoped
public class CandidateGenerator {

    private static final Logger logger = LoggerFactory.getLogger(CandidateGenerator.class);

    private final NameSimilarity nameSimilarity;

    @Inject
    public CandidateGenerator(NameSimilarity nameSimilarity) {
        this.nameSimilarity = nameSimilarity;
    }

    /**
     * Generates candidates on the calling thread.
     */
    public CandidateSet generate(@NotNull BucketingResult bucketing, @NotNull DetectOptions options) {
        return generate(bucketing, options, new CancellationToken(), Runnable::run);
    }

    /**
     * Generates candidates, running per-bucket work on the given executor.
     *
     * @param bucketing bucketer output
     * @param options detection options
     * @param token checked between buckets
     * @param executor executor for per-bucket tasks
     * @return candidate pairs and generation statistics
     */
    public CandidateSet generate(
            @NotNull BucketingResult bucketing,
            @NotNull DetectOptions options,
            @NotNull CancellationToken token,
            @NotNull Executor executor) {

        Map<MediaType, Integer> radius = new EnumMap<>(MediaType.class);
        for (MediaType mediaType : MediaType.values()) {
            radius.put(mediaType, options.thresholds().searchRadius(mediaType));
        }

        // Phase 1: build and freeze every bucket index
        List<CompletableFuture<BucketIndex>> builds = new ArrayList<>();
        for (CandidateBucket bucket : bucketing.buckets().values()) {
            if (bucket.hashed().isEmpty()) {
                continue;
            }
            builds.add(CompletableFuture.supplyAsync(
                () -> token.isCancelled() ? null : buildIndex(bucket, options), executor));
        }
        CompletableFuture.allOf(builds.toArray(new CompletableFuture[0])).join();

        Map<BucketKey, BucketIndex> indexes = new TreeMap<>();
        for (CompletableFuture<BucketIndex> build : builds) {
            BucketIndex index = build.join();
            if (index != null) {
                indexes.put(index.key(), index);
            }
        }
        int degraded = (int) indexes.values().stream().filter(BucketIndex::degraded).count();

        if (token.isCancelled()) {
            logger.info("Candidate generation cancelled after index construction");
            return new CandidateSet(List.of(), radius, Set.of(), degraded, 0, true);
        }

        // Phase 2: query frozen indexes, one task per bucket
        List<CompletableFuture<BucketCandidates>> queries = new ArrayList<>();
        for (CandidateBucket bucket : bucketing.buckets().values()) {
            queries.add(CompletableFuture.supplyAsync(
                () -> token.isCancelled() ? null : queryBucket(bucket, bucketing, indexes, radius, options),
                executor));
        }
        CompletableFuture.allOf(queries.toArray(new CompletableFuture[0])).join();

        Map<FilePair, CandidatePair> unique = new LinkedHashMap<>();
        Set<BucketKey> exhausted = new HashSet<>();
        long comparisons = 0;
        for (CompletableFuture<BucketCandidates> query : queries) {
            BucketCandidates result = query.join();
            if (result == null) {
                continue;
            }
            for (CandidatePair pair : result.pairs()) {
                unique.putIfAbsent(pair.pair(), pair);
            }
            if (result.exhausted()) {
                exhausted.add(result.key());
            }
            comparisons += result.comparisons();
        }

        List<CandidatePair> pairs = new ArrayList<>(unique.values());
        pairs.sort(null);

        logger.debug("Generated {} candidate pairs from {} buckets ({} comparisons, {} degraded, {} over budget)",
            pairs.size(), bucketing.buckets().size(), comparisons, degraded, exhausted.size());

        return new CandidateSet(pairs, radius, exhausted, degraded, comparisons, token.isCancelled());
    }

    private BucketIndex buildIndex(CandidateBucket bucket, DetectOptions options) {
        int ceiling = options.limits().indexFallbackBucketSize();
        int size = bucket.hashed().size();
        boolean degraded = size > ceiling;
        if (degraded) {
            logger.warn("Bucket {} holds {} hashed files, above the index ceiling of {}: falling back to linear scan",
                bucket.key(), size, ceiling);
        }

        if (bucket.key().mediaType() == MediaType.VIDEO) {
            VideoFrameIndex frames = new VideoFrameIndex(() -> NeighborIndex.forSize(size, ceiling));
            for (FileRecord record : bucket.hashed()) {
                frames.insert(record.perceptualHash().codes(), record.id());
            }
            frames.freeze();
            return new BucketIndex(bucket.key(), null, frames, degraded);
        }

        NeighborIndex index = NeighborIndex.forSize(size, ceiling);
        for (FileRecord record : bucket.hashed()) {
            index.insert(record.perceptualHash().primaryCode(), record.id());
        }
        index.freeze();
        return new BucketIndex(bucket.key(), index, null, degraded);
    }

    private BucketCandidates queryBucket(
            CandidateBucket bucket,
            BucketingResult bucketing,
            Map<BucketKey, BucketIndex> indexes,
            Map<MediaType, Integer> radius,
            DetectOptions options) {

        BucketKey key = bucket.key();
        long budget = options.limits().maxComparisonsPerBucket();
        ComparisonCounter counter = new ComparisonCounter();
        List<CandidatePair> pairs = new ArrayList<>();
        boolean exhausted = false;
        int r = radius.get(key.mediaType());

        BucketIndex own = indexes.get(key);
        BucketIndex next = indexes.get(key.next());

        for (FileRecord record : bucket.hashed()) {
            if (budget > 0 && counter.count() >= budget) {
                exhausted = true;
                break;
            }
            collectIndexMatches(record, own, true, r, counter, bucketing, key, options, pairs);
            collectIndexMatches(record, next, false, r, counter, bucketing, key, options, pairs);
        }

        if (!exhausted && bucket.hasUnhashed()) {
            double nameThreshold = options.thresholds().nameSimilarityThreshold();
            List<FileRecord> neighborhood = new ArrayList<>();
            addBucketRecords(bucketing.buckets().get(key.previous()), neighborhood);
            addBucketRecords(bucket, neighborhood);
            addBucketRecords(bucketing.buckets().get(key.next()), neighborhood);

            Set<String> unhashedIds = new HashSet<>();
            bucket.unhashed().forEach(u -> unhashedIds.add(u.id()));

            outer:
            for (FileRecord record : bucket.unhashed()) {
                for (FileRecord other : neighborhood) {
                    if (budget > 0 && counter.count() >= budget) {
                        exhausted = true;
                        break outer;
                    }
                    if (other.id().equals(record.id())) {
                        continue;
                    }
                    // Unhashed mates of the same bucket are compared once, from the smaller id.
                    if (unhashedIds.contains(other.id()) && other.id().compareTo(record.id()) < 0) {
                        continue;
                    }
                    if (options.isIgnored(record.id(), other.id())) {
                        continue;
                    }
                    counter.increment();
                    if (nameSimilarity.similarity(record.fileName(), other.fileName()) >= nameThreshold) {
                        pairs.add(new CandidatePair(FilePair.of(record.id(), other.id()), key, null, null));
                    }
                }
            }
        }

        if (exhausted) {
            logger.warn("Bucket {} hit the comparison budget of {}; its groups will be marked incomplete", key, budget);
        }
        logger.debug("Bucket {}: {} candidates from {} comparisons", key, pairs.size(), counter.count());
        return new BucketCandidates(key, pairs, counter.count(), exhausted);
    }

    private void collectIndexMatches(
            FileRecord record,
            @Nullable BucketIndex index,
            boolean sameBucket,
            int radius,
            ComparisonCounter counter,
            BucketingResult bucketing,
            BucketKey key,
            DetectOptions options,
            List<CandidatePair> pairs) {

        if (index == null) {
            return;
        }
        List<NeighborMatch> matches = index.video() != null
            ? index.video().query(record.perceptualHash().codes(), radius, counter)
            : index.photo().query(record.perceptualHash().primaryCode(), radius, counter);

        for (NeighborMatch match : matches) {
            String otherId = match.fileId();
            if (otherId.equals(record.id())) {
                continue;
            }
            // Pairs inside one bucket are found from both ends; keep the smaller id's.
            if (sameBucket && otherId.compareTo(record.id()) < 0) {
                continue;
            }
            if (options.isIgnored(record.id(), otherId)) {
                continue;
            }
            FrameAlignment alignment = null;
            if (key.mediaType() == MediaType.VIDEO) {
                FileRecord other = bucketing.records().get(otherId);
                alignment = FrameAlignment.between(record.perceptualHash().codes(), other.perceptualHash().codes());
            }
            pairs.add(new CandidatePair(FilePair.of(record.id(), otherId), key, match.distance(), alignment));
        }
    }

    private static void addBucketRecords(@Nullable CandidateBucket bucket, List<FileRecord> target) {
        if (bucket != null) {
            target.addAll(bucket.hashed());
            target.addAll(bucket.unhashed());
        }
    }

    private record BucketIndex(
        BucketKey key,
        @Nullable NeighborIndex photo,
        @Nullable VideoFrameIndex video,
        boolean degraded
    ) {
    }

    private record BucketCandidates(
        BucketKey key,
        List<CandidatePair> pairs,
        long comparisons,
        boolean exhausted
    ) {
    }
}
