package br.edu.ifba.deduper.detection;

import br.edu.ifba.deduper.bucket.BucketingResult;
import br.edu.ifba.deduper.candidate.CandidateSet;
import br.edu.ifba.deduper.core.DetectOptions;
import br.edu.ifba.deduper.core.DetectionMetrics;
import br.edu.ifba.deduper.core.DuplicateGroupMember;
import br.edu.ifba.deduper.core.DuplicateGroupResult;
import br.edu.ifba.deduper.core.SimilarPair;
import br.edu.ifba.deduper.evidence.EvidenceFormatter;
import br.edu.ifba.deduper.evidence.EvidenceItem;
import org.jetbrains.annotations.NotNull;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Output of one scan or re-rank.
 *
 * <p>Besides the groups, a run keeps the bucketing and candidate pairs it was
 * computed from, so that {@link DuplicateDetectionEngine#rerank} can re-score
 * with new options without rebuilding indexes. Nothing here is shared with
 * other runs.</p>
 */
public final class DetectionRun {

    private final List<DuplicateGroupResult> groups;
    private final List<SimilarPair> similarPairs;
    private final DetectionMetrics metrics;
    private final DetectOptions options;
    private final boolean cancelled;
    private final BucketingResult bucketing;
    private final CandidateSet candidates;
    private final EvidenceFormatter evidenceFormatter;

    DetectionRun(
            List<DuplicateGroupResult> groups,
            List<SimilarPair> similarPairs,
            DetectionMetrics metrics,
            DetectOptions options,
            boolean cancelled,
            BucketingResult bucketing,
            CandidateSet candidates,
            EvidenceFormatter evidenceFormatter) {
        this.groups = List.copyOf(groups);
        this.similarPairs = List.copyOf(similarPairs);
        this.metrics = metrics;
        this.options = options;
        this.cancelled = cancelled;
        this.bucketing = bucketing;
        this.candidates = candidates;
        this.evidenceFormatter = evidenceFormatter;
    }

    /**
     * Groups sorted by confidence descending, then first member id.
     */
    public List<DuplicateGroupResult> groups() {
        return groups;
    }

    /**
     * Pairs held back for manual review.
     */
    public List<SimilarPair> similarPairs() {
        return similarPairs;
    }

    public DetectionMetrics metrics() {
        return metrics;
    }

    public DetectOptions options() {
        return options;
    }

    /**
     * True if the scan was cancelled; every group is then incomplete.
     */
    public boolean cancelled() {
        return cancelled;
    }

    public Optional<DuplicateGroupResult> group(@NotNull String groupId) {
        return groups.stream().filter(g -> g.groupId().equals(groupId)).findFirst();
    }

    /**
     * Explains a group: its rationale plus summarized and per-member evidence.
     */
    public Optional<GroupRationale> explain(@NotNull String groupId) {
        return group(groupId).map(group -> {
            Map<String, List<EvidenceItem>> perMember = new LinkedHashMap<>();
            for (DuplicateGroupMember member : group.members()) {
                perMember.put(member.fileId(), evidenceFormatter.format(member));
            }
            return new GroupRationale(
                group.groupId(),
                group.mediaType(),
                group.confidence(),
                group.keeperSuggestion(),
                group.incomplete(),
                group.rationaleLines(),
                evidenceFormatter.summarize(group),
                perMember
            );
        });
    }

    BucketingResult bucketing() {
        return bucketing;
    }

    CandidateSet candidates() {
        return candidates;
    }

    public String toLogString() {
        return metrics.toLogString() + (cancelled ? " (cancelled)" : "");
    }
}
