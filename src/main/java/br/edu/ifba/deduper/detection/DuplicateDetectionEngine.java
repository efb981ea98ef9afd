package br.edu.ifba.deduper.detection;

import br.edu.ifba.deduper.bucket.BucketKey;
import br.edu.ifba.deduper.bucket.BucketingResult;
import br.edu.ifba.deduper.bucket.CandidateBucket;
import br.edu.ifba.deduper.bucket.CandidateBucketer;
import br.edu.ifba.deduper.bucket.ChecksumGroup;
import br.edu.ifba.deduper.candidate.CandidateGenerator;
import br.edu.ifba.deduper.candidate.CandidatePair;
import br.edu.ifba.deduper.candidate.CandidateSet;
import br.edu.ifba.deduper.cluster.ClusteringEngine;
import br.edu.ifba.deduper.cluster.ClusteringResult;
import br.edu.ifba.deduper.core.CancellationToken;
import br.edu.ifba.deduper.core.DetectOptions;
import br.edu.ifba.deduper.core.DetectionMetrics;
import br.edu.ifba.deduper.core.FileRecord;
import br.edu.ifba.deduper.core.MediaType;
import br.edu.ifba.deduper.core.ResourcePressure;
import br.edu.ifba.deduper.evidence.EvidenceFormatter;
import br.edu.ifba.deduper.scoring.PairScore;
import br.edu.ifba.deduper.scoring.PairwiseScorer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs the detection pipeline: records, buckets, indexes, candidate pairs,
 * scores, groups, keeper suggestion.
 *
 * <p>Per-bucket index work and pair scoring run on a bounded worker pool sized
 * by {@link ConcurrencyPlanner}. Unions happen afterwards on the calling
 * thread. Each call builds its own indexes and pool; nothing is kept between
 * calls except what the returned {@link DetectionRun} holds.</p>
 */
@ApplicationScoped
public class DuplicateDetectionEngine {

    private static final Logger logger = LoggerFactory.getLogger(DuplicateDetectionEngine.class);

    private final CandidateBucketer bucketer;
    private final CandidateGenerator generator;
    private final PairwiseScorer scorer;
    private final ClusteringEngine clustering;
    private final EvidenceFormatter evidenceFormatter;
    private final ConcurrencyPlanner planner;

    @Inject
    public DuplicateDetectionEngine(
            CandidateBucketer bucketer,
            CandidateGenerator generator,
            PairwiseScorer scorer,
            ClusteringEngine clustering,
            EvidenceFormatter evidenceFormatter,
            ConcurrencyPlanner planner) {
        this.bucketer = bucketer;
        this.generator = generator;
        this.scorer = scorer;
        this.clustering = clustering;
        this.evidenceFormatter = evidenceFormatter;
        this.planner = planner;
    }

    public DetectionRun detect(@NotNull List<FileRecord> records, @NotNull DetectOptions options) {
        return detect(records, options, ResourcePressure.NONE, new CancellationToken());
    }

    /**
     * Scans a full set of records.
     *
     * @param records every record of the scan, delivered in full
     * @param options detection options, validated before any work
     * @param pressure resource pressure hint for the worker pool size
     * @param token cancellation token, checked between buckets and scoring batches
     * @return groups, similar pairs and metrics
     * @throws br.edu.ifba.deduper.exception.ConfigurationException if the options are invalid
     */
    public DetectionRun detect(
            @NotNull List<FileRecord> records,
            @NotNull DetectOptions options,
            @NotNull ResourcePressure pressure,
            @NotNull CancellationToken token) {

        if (records == null) {
            throw new IllegalArgumentException("records cannot be null");
        }
        options.validate();

        Instant start = Instant.now();
        int degree = planner.degree(options.limits(), pressure);
        logger.info("Detecting duplicates in {} files (imageDistance={}, videoFrameDistance={}, band={}, parallelism={})",
            records.size(), options.thresholds().imageDistance(), options.thresholds().videoFrameDistance(),
            options.thresholds().confirmationBand(), degree);

        Instant bucketingStart = Instant.now();
        BucketingResult bucketing = bucketer.bucket(records, options);
        logger.debug("Bucketed {} files into {} buckets in {}ms", bucketing.totalFiles(),
            bucketing.buckets().size(), Duration.between(bucketingStart, Instant.now()).toMillis());

        ExecutorService executor = Executors.newFixedThreadPool(degree);
        try {
            Instant candidatesStart = Instant.now();
            CandidateSet candidates = generator.generate(bucketing, options, token, executor);
            logger.debug("Generated {} candidate pairs in {}ms", candidates.pairs().size(),
                Duration.between(candidatesStart, Instant.now()).toMillis());

            return scoreAndCluster(bucketing, candidates, options, token, executor, start);
        } finally {
            executor.shutdown();
        }
    }

    public DetectionRun rerank(@NotNull DetectionRun previous, @NotNull DetectOptions options) {
        return rerank(previous, options, ResourcePressure.NONE, new CancellationToken());
    }

    /**
     * Re-scores and re-clusters the candidates of a previous run with new
     * options, without rebucketing or rebuilding indexes.
     *
     * <p>Pairs farther apart than the previous search radius were never
     * generated; widening the radius needs a fresh scan.</p>
     */
    public DetectionRun rerank(
            @NotNull DetectionRun previous,
            @NotNull DetectOptions options,
            @NotNull ResourcePressure pressure,
            @NotNull CancellationToken token) {

        if (previous == null) {
            throw new IllegalArgumentException("previous run cannot be null");
        }
        options.validate();

        Instant start = Instant.now();
        CandidateSet cached = previous.candidates();
        for (MediaType mediaType : MediaType.values()) {
            int wanted = options.thresholds().searchRadius(mediaType);
            int scanned = cached.radiusFor(mediaType);
            if (mediaType.expectsPerceptualHash() && wanted > scanned) {
                logger.warn("Re-rank radius {} for {} exceeds the scanned radius {}; pairs beyond {} need a fresh scan",
                    wanted, mediaType, scanned, scanned);
            }
        }
        if (options.limits().sizeTolerancePct() != previous.bucketing().sizeTolerancePct()) {
            logger.warn("Re-rank keeps the size classes of the original scan (tolerance {}); requested {}",
                previous.bucketing().sizeTolerancePct(), options.limits().sizeTolerancePct());
        }

        List<CandidatePair> kept = new ArrayList<>();
        for (CandidatePair pair : cached.pairs()) {
            if (!options.isIgnored(pair.pair().first(), pair.pair().second())) {
                kept.add(pair);
            }
        }
        // Candidates cut short by a cancelled scan stay partial after re-ranking
        boolean partial = cached.cancelled() || previous.cancelled();
        CandidateSet candidates = new CandidateSet(kept, cached.searchRadius(), cached.exhaustedBuckets(),
            cached.degradedBuckets(), 0, partial);

        logger.info("Re-ranking {} cached candidate pairs (imageDistance={}, videoFrameDistance={})",
            kept.size(), options.thresholds().imageDistance(), options.thresholds().videoFrameDistance());

        ExecutorService executor = Executors.newFixedThreadPool(planner.degree(options.limits(), pressure));
        try {
            return scoreAndCluster(previous.bucketing(), candidates, options, token, executor, start);
        } finally {
            executor.shutdown();
        }
    }

    /**
     * Reports how the records would be bucketed and searched, without scoring.
     */
    public List<BucketStats> previewBuckets(@NotNull List<FileRecord> records, @NotNull DetectOptions options) {
        options.validate();
        BucketingResult bucketing = bucketer.bucket(records, options);
        int ceiling = options.limits().indexFallbackBucketSize();

        List<BucketStats> stats = new ArrayList<>();
        for (CandidateBucket bucket : bucketing.buckets().values()) {
            int hashed = bucket.hashed().size();
            int unhashed = bucket.unhashed().size();
            BucketStats.Strategy strategy;
            long estimate;
            if (hashed == 0) {
                strategy = BucketStats.Strategy.NAME_SCAN;
                estimate = (long) unhashed * (unhashed - 1) / 2;
            } else if (hashed > ceiling) {
                strategy = BucketStats.Strategy.LINEAR_SCAN;
                estimate = (long) hashed * hashed + (long) unhashed * bucket.size();
            } else {
                strategy = BucketStats.Strategy.BK_TREE;
                long perQuery = Math.max(1, Math.round(Math.log(hashed + 1) / Math.log(2)));
                estimate = hashed * perQuery + (long) unhashed * bucket.size();
            }
            stats.add(new BucketStats(bucket.key(), hashed, unhashed, estimate, strategy));
        }

        logger.info("Preview: {} files in {} buckets, {} checksum groups",
            bucketing.totalFiles(), stats.size(), bucketing.checksumGroups().size());
        return stats;
    }

    private DetectionRun scoreAndCluster(
            BucketingResult bucketing,
            CandidateSet candidates,
            DetectOptions options,
            CancellationToken token,
            ExecutorService executor,
            Instant start) {

        Map<String, FileRecord> records = bucketing.records();

        List<PairScore> scores = new ArrayList<>();
        for (ChecksumGroup group : bucketing.checksumGroups()) {
            FileRecord representative = group.representative();
            for (FileRecord member : group.members().subList(1, group.members().size())) {
                scores.add(scorer.checksumMatch(representative, member, options.weights()));
            }
        }

        // Score candidate pairs in parallel batches; results keep candidate order
        Instant scoringStart = Instant.now();
        List<CandidatePair> pairs = candidates.pairs();
        int batchSize = options.limits().batchSize();
        List<CompletableFuture<List<PairScore>>> futures = new ArrayList<>();
        for (int from = 0; from < pairs.size(); from += batchSize) {
            List<CandidatePair> batch = pairs.subList(from, Math.min(from + batchSize, pairs.size()));
            futures.add(CompletableFuture.supplyAsync(() -> scoreBatch(batch, records, options, token), executor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        for (CompletableFuture<List<PairScore>> future : futures) {
            scores.addAll(future.join());
        }
        logger.debug("Scored {} pairs in {} batches in {}ms", pairs.size(), futures.size(),
            Duration.between(scoringStart, Instant.now()).toMillis());

        boolean cancelled = candidates.cancelled() || token.isCancelled();
        if (cancelled) {
            logger.info("Detection cancelled; partial groups will be marked incomplete");
        }

        Set<String> budgetLimited = new HashSet<>();
        if (!candidates.exhaustedBuckets().isEmpty()) {
            for (FileRecord record : records.values()) {
                BucketKey key = bucketing.keyOf(record);
                if (candidates.exhaustedBuckets().contains(key)) {
                    budgetLimited.add(record.id());
                }
            }
        }

        // Sequential reducer
        ClusteringResult clustered = clustering.cluster(records, scores, budgetLimited, cancelled, options,
            scorer.duplicateThreshold(options));

        if (!clustered.similarPairs().isEmpty()) {
            logger.info("{} pairs retained as similar but not duplicate", clustered.similarPairs().size());
        }

        DetectionMetrics metrics = new DetectionMetrics(
            bucketing.totalFiles(),
            bucketing.buckets().size(),
            bucketing.averageBucketSize(),
            candidates.degradedBuckets(),
            pairs.size(),
            candidates.comparisons() + pairs.size(),
            clustered.similarPairs().size(),
            clustered.groups().size(),
            (int) clustered.incompleteGroups(),
            Duration.between(start, Instant.now())
        );
        logger.info(metrics.toLogString());

        return new DetectionRun(clustered.groups(), clustered.similarPairs(), metrics, options, cancelled,
            bucketing, candidates, evidenceFormatter);
    }

    private List<PairScore> scoreBatch(
            List<CandidatePair> batch,
            Map<String, FileRecord> records,
            DetectOptions options,
            CancellationToken token) {
        if (token.isCancelled()) {
            return List.of();
        }
        List<PairScore> scores = new ArrayList<>(batch.size());
        for (CandidatePair candidate : batch) {
            FileRecord first = records.get(candidate.pair().first());
            FileRecord second = records.get(candidate.pair().second());
            scores.add(scorer.score(first, second, candidate, options));
        }
        return scores;
    }
}
