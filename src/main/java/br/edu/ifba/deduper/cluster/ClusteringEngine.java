package br.edu.ifba.deduper.cluster;

import br.edu.ifba.deduper.core.ConfidencePenalty;
import br.edu.ifba.deduper.core.ConfidenceSignal;
import br.edu.ifba.deduper.core.DetectOptions;
import br.edu.ifba.deduper.core.DistanceBand;
import br.edu.ifba.deduper.core.DuplicateGroupMember;
import br.edu.ifba.deduper.core.DuplicateGroupResult;
import br.edu.ifba.deduper.core.FileRecord;
import br.edu.ifba.deduper.core.PenaltyKey;
import br.edu.ifba.deduper.core.SignalKey;
import br.edu.ifba.deduper.core.SimilarPair;
import br.edu.ifba.deduper.core.Thresholds;
import br.edu.ifba.deduper.keeper.KeeperRanker;
import br.edu.ifba.deduper.scoring.PairScore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Turns scored pairs into duplicate groups.
 *
 * Algorithm:
 * 1. Judge each pair: checksum matches and pairs within the duplicate distance
 *    are unioned; pairs in the confirmation band need the secondary hash;
 *    pairs without a comparable hash must reach the duplicate confidence
 * 2. Union duplicates in a Union-Find, sequentially and in pair order
 * 3. Each class with two or more members becomes a group; singletons are dropped
 *
 * Output is deterministic: members are sorted by file id and groups by
 * confidence descending, then first member id.
 */
@ApplicationScoped
public class ClusteringEngine {

    private static final Logger logger = LoggerFactory.getLogger(ClusteringEngine.class);

    private static final Comparator<PairScore> PAIR_ORDER = Comparator
        .comparing((PairScore s) -> s.pair().first())
        .thenComparing(s -> s.pair().second());

    private final KeeperRanker keeperRanker;

    @Inject
    public ClusteringEngine(KeeperRanker keeperRanker) {
        this.keeperRanker = keeperRanker;
    }

    /**
     * Judges one scored pair.
     *
     * @param score the pair score
     * @param options detection options
     * @param duplicateThreshold confidence needed by pairs without a comparable hash
     * @return the decision and its reason
     */
    public PairDecision decide(@NotNull PairScore score, @NotNull DetectOptions options, double duplicateThreshold) {
        if (score.checksumMatch()) {
            return PairDecision.duplicate("checksum match");
        }

        if (score.hasBothHashes()) {
            Thresholds thresholds = options.thresholds();
            int distance = score.hashDistance();
            int threshold = thresholds.distanceFor(score.mediaType());
            if (distance > thresholds.searchRadius(score.mediaType())) {
                return PairDecision.rejected(
                    String.format("hash distance %d beyond search radius %d", distance, thresholds.searchRadius(score.mediaType())));
            }
            if (score.durationMismatch()) {
                return PairDecision.similar(
                    String.format("hash distance %d but durations differ beyond %.0f%%",
                        distance, thresholds.durationTolerancePct() * 100));
            }

            DistanceBand band = thresholds.confirmationBand();
            Integer secondary = score.secondaryDistance();
            boolean inBand = band.contains(distance);
            boolean confirmed = secondary != null && secondary <= thresholds.confirmationHashDistance();
            boolean contradicted = secondary != null && !confirmed;

            if (distance <= threshold) {
                if (inBand && contradicted) {
                    return PairDecision.similar(String.format(
                        "hash distance %d in confirmation band %s but secondary distance %d > %d",
                        distance, band, secondary, thresholds.confirmationHashDistance()));
                }
                return PairDecision.duplicate(String.format("hash distance %d <= %d", distance, threshold));
            }
            if (inBand && confirmed) {
                return PairDecision.duplicate(String.format(
                    "hash distance %d in confirmation band %s, confirmed by secondary distance %d",
                    distance, band, secondary));
            }
            return PairDecision.similar(String.format(
                "hash distance %d > %d without secondary confirmation", distance, threshold));
        }

        if (score.confidence() >= duplicateThreshold) {
            if (score.durationMismatch()) {
                return PairDecision.similar(String.format(
                    "confidence %.2f but durations differ beyond tolerance", score.confidence()));
            }
            return PairDecision.duplicate(String.format(
                "confidence %.2f >= %.2f without comparable hashes", score.confidence(), duplicateThreshold));
        }
        return PairDecision.rejected(String.format("confidence %.2f < %.2f", score.confidence(), duplicateThreshold));
    }

    /**
     * Clusters scored pairs into groups.
     *
     * @param records every scanned record by id
     * @param scores scored pairs, including checksum matches
     * @param budgetLimitedIds files whose bucket hit the comparison budget
     * @param cancelled true if the scan was cancelled; every group is then incomplete
     * @param options detection options
     * @param duplicateThreshold confidence needed by pairs without a comparable hash
     * @return groups and similar-not-duplicate pairs
     */
    public ClusteringResult cluster(
            @NotNull Map<String, FileRecord> records,
            @NotNull List<PairScore> scores,
            @NotNull Set<String> budgetLimitedIds,
            boolean cancelled,
            @NotNull DetectOptions options,
            double duplicateThreshold) {

        List<PairScore> ordered = new ArrayList<>(scores);
        ordered.sort(PAIR_ORDER);

        TreeSet<String> involved = new TreeSet<>();
        for (PairScore score : ordered) {
            involved.add(score.pair().first());
            involved.add(score.pair().second());
        }
        List<String> ids = new ArrayList<>(involved);
        Map<String, Integer> indexOf = new HashMap<>();
        for (int i = 0; i < ids.size(); i++) {
            indexOf.put(ids.get(i), i);
        }

        UnionFind unionFind = new UnionFind(ids.size());
        Map<String, List<PairScore>> edgesByFile = new HashMap<>();
        Map<PairScore, String> reasons = new HashMap<>();
        List<SimilarPair> similarPairs = new ArrayList<>();

        for (PairScore score : ordered) {
            PairDecision decision = decide(score, options, duplicateThreshold);
            switch (decision.outcome()) {
                case DUPLICATE -> {
                    unionFind.union(indexOf.get(score.pair().first()), indexOf.get(score.pair().second()));
                    edgesByFile.computeIfAbsent(score.pair().first(), k -> new ArrayList<>()).add(score);
                    edgesByFile.computeIfAbsent(score.pair().second(), k -> new ArrayList<>()).add(score);
                    reasons.put(score, decision.reason());
                }
                case SIMILAR -> {
                    SimilarPair similar = new SimilarPair(score.pair(), score.mediaType(), score.confidence(), decision.reason());
                    similarPairs.add(similar);
                    logger.debug(similar.toLogString());
                }
                case REJECTED -> logger.trace("Rejected {}: {}", score.pair(), decision.reason());
            }
        }

        Map<Integer, List<String>> components = new LinkedHashMap<>();
        for (int i = 0; i < ids.size(); i++) {
            components.computeIfAbsent(unionFind.find(i), k -> new ArrayList<>()).add(ids.get(i));
        }

        List<DuplicateGroupResult> groups = new ArrayList<>();
        for (List<String> memberIds : components.values()) {
            if (memberIds.size() < 2) {
                continue;
            }
            groups.add(buildGroup(memberIds, records, edgesByFile, reasons, budgetLimitedIds, cancelled, options));
        }

        groups.sort(Comparator.comparingDouble(DuplicateGroupResult::confidence).reversed()
            .thenComparing(g -> g.members().get(0).fileId()));

        return new ClusteringResult(groups, similarPairs);
    }

    private DuplicateGroupResult buildGroup(
            List<String> memberIds,
            Map<String, FileRecord> records,
            Map<String, List<PairScore>> edgesByFile,
            Map<PairScore, String> reasons,
            Set<String> budgetLimitedIds,
            boolean cancelled,
            DetectOptions options) {

        List<DuplicateGroupMember> members = new ArrayList<>();
        List<FileRecord> memberRecords = new ArrayList<>();
        Set<String> rationaleLines = new LinkedHashSet<>();
        Set<PairScore> groupEdges = new TreeSet<>(PAIR_ORDER);
        boolean incomplete = cancelled;

        for (String fileId : memberIds) {
            FileRecord record = records.get(fileId);
            List<PairScore> edges = edgesByFile.getOrDefault(fileId, List.of());
            groupEdges.addAll(edges);
            memberRecords.add(record);
            members.add(buildMember(record, edges));

            if (record.partial()) {
                rationaleLines.add("PartialExtraction: " + fileId + " was only partially extracted");
                incomplete = true;
            }
            if (record.mediaType().expectsPerceptualHash() && !record.hasPerceptualHash()) {
                incomplete = true;
            }
            if (budgetLimitedIds.contains(fileId)) {
                incomplete = true;
            }
        }

        for (PairScore edge : groupEdges) {
            rationaleLines.add(edge.pair() + ": " + reasons.get(edge));
            for (String line : edge.rationale()) {
                if (line.startsWith("MissingSignal") || line.startsWith("PartialExtraction")) {
                    rationaleLines.add(line);
                }
            }
            if (edge.truncated()) {
                incomplete = true;
            }
        }
        if (memberIds.stream().anyMatch(budgetLimitedIds::contains)) {
            rationaleLines.add("Comparison budget reached while scanning this group's files; members may be missing");
        }
        if (cancelled) {
            rationaleLines.add("Scan cancelled before completion");
        }

        String keeper = null;
        if (!memberRecords.isEmpty()) {
            FileRecord best = keeperRanker.rank(memberRecords, options.formatPreference()).get(0);
            keeper = best.id();
            rationaleLines.add(keeperRanker.describe(best));
        }

        double confidence = options.groupConfidenceMode().aggregate(
            members.stream().map(DuplicateGroupMember::confidence).toList());

        return new DuplicateGroupResult(
            groupId(memberIds),
            memberRecords.get(0).mediaType(),
            members,
            confidence,
            new ArrayList<>(rationaleLines),
            keeper,
            incomplete
        );
    }

    private DuplicateGroupMember buildMember(FileRecord record, List<PairScore> edges) {
        double confidence = 0.0;
        Map<SignalKey, ConfidenceSignal> strongest = new EnumMap<>(SignalKey.class);
        Map<PenaltyKey, ConfidencePenalty> penalties = new EnumMap<>(PenaltyKey.class);
        List<String> rationale = new ArrayList<>();

        for (PairScore edge : edges) {
            confidence = Math.max(confidence, edge.confidence());
            for (ConfidenceSignal signal : edge.signals()) {
                strongest.merge(signal.key(), signal,
                    (current, candidate) -> candidate.contribution() > current.contribution() ? candidate : current);
            }
            for (ConfidencePenalty penalty : edge.penalties()) {
                penalties.putIfAbsent(penalty.key(), penalty);
            }
            String other = edge.pair().other(record.id());
            for (String line : edge.rationale()) {
                rationale.add("vs " + other + ": " + line);
            }
        }
        if (record.partial()) {
            rationale.add("PartialExtraction: extractor reported partial data");
        }

        return new DuplicateGroupMember(
            record.id(),
            confidence,
            new ArrayList<>(strongest.values()),
            new ArrayList<>(penalties.values()),
            rationale,
            record.fileSize()
        );
    }

    /**
     * Stable group id derived from the sorted member ids.
     */
    static String groupId(List<String> sortedMemberIds) {
        String joined = String.join("\n", sortedMemberIds);
        return UUID.nameUUIDFromBytes(joined.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
