package br.edu.ifba.deduper.evidence;

import br.edu.ifba.deduper.core.ConfidencePenalty;
import br.edu.ifba.deduper.core.ConfidenceSignal;
import br.edu.ifba.deduper.core.DuplicateGroupMember;
import br.edu.ifba.deduper.core.DuplicateGroupResult;
import br.edu.ifba.deduper.core.PenaltyKey;
import br.edu.ifba.deduper.core.SignalKey;
import jakarta.enterprise.context.ApplicationScoped;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts signals and penalties into sorted evidence items.
 *
 * Items are sorted by contribution descending (penalties carry their negative
 * value), ties broken by id. A penalty on a signal's key forces that signal to fail.
 */
@ApplicationScoped
public class EvidenceFormatter {

    private static final Comparator<EvidenceItem> ORDER = Comparator
        .comparingDouble(EvidenceItem::contribution).reversed()
        .thenComparing(EvidenceItem::id);

    /**
     * Evidence for a single member.
     */
    public List<EvidenceItem> format(@NotNull DuplicateGroupMember member) {
        return toItems(member.signals(), member.penalties());
    }

    /**
     * Evidence for a whole group: signals of every member folded by key,
     * keeping the largest contribution; penalties de-duplicated by key.
     */
    public List<EvidenceItem> summarize(@NotNull DuplicateGroupResult group) {
        Map<SignalKey, ConfidenceSignal> strongest = new EnumMap<>(SignalKey.class);
        Map<PenaltyKey, ConfidencePenalty> penalties = new EnumMap<>(PenaltyKey.class);
        for (DuplicateGroupMember member : group.members()) {
            for (ConfidenceSignal signal : member.signals()) {
                strongest.merge(signal.key(), signal,
                    (current, candidate) -> candidate.contribution() > current.contribution() ? candidate : current);
            }
            for (ConfidencePenalty penalty : member.penalties()) {
                penalties.putIfAbsent(penalty.key(), penalty);
            }
        }
        return toItems(new ArrayList<>(strongest.values()), new ArrayList<>(penalties.values()));
    }

    private List<EvidenceItem> toItems(List<ConfidenceSignal> signals, List<ConfidencePenalty> penalties) {
        Set<SignalKey> penalized = EnumSet.noneOf(SignalKey.class);
        penalties.forEach(p -> penalized.add(p.key().replaces()));

        List<EvidenceItem> items = new ArrayList<>();
        for (ConfidenceSignal signal : signals) {
            Verdict verdict = penalized.contains(signal.key())
                ? Verdict.FAIL
                : Verdict.forContribution(signal.contribution());
            items.add(new EvidenceItem(
                signal.key().id(),
                signal.key().label(),
                distanceText(signal),
                thresholdText(signal),
                verdict,
                signal.contribution()
            ));
        }
        for (ConfidencePenalty penalty : penalties) {
            items.add(new EvidenceItem(
                EvidenceItem.PENALTY_PREFIX + penalty.key().id(),
                penalty.key().label(),
                "missing",
                "required",
                Verdict.FAIL,
                penalty.value()
            ));
        }
        items.sort(ORDER);
        return items;
    }

    String distanceText(ConfidenceSignal signal) {
        return switch (signal.key()) {
            case CHECKSUM -> signal.rawScore() >= 1.0 ? "0" : "1";
            case HASH -> integer(signal.measurement());
            case NAME, METADATA -> percent(signal.rawScore());
            case CAPTURE_TIME -> signal.measurement() == null ? "" : elapsed(signal.measurement().longValue());
            case DURATION -> signal.measurement() == null ? "" : percent(signal.measurement());
        };
    }

    String thresholdText(ConfidenceSignal signal) {
        return switch (signal.key()) {
            case CHECKSUM -> "0";
            case HASH -> integer(signal.threshold());
            case NAME, DURATION -> signal.threshold() == null ? "" : percent(signal.threshold());
            case CAPTURE_TIME -> signal.threshold() == null ? "" : elapsed(signal.threshold().longValue());
            case METADATA -> "100%";
        };
    }

    /**
     * Compact elapsed time: seconds below a minute, then minutes, hours, days.
     */
    static String elapsed(long seconds) {
        long s = Math.abs(seconds);
        if (s < 60) return s + "s";
        if (s < 3_600) return (s / 60) + "m";
        if (s < 86_400) return (s / 3_600) + "h";
        return (s / 86_400) + "d";
    }

    static String percent(double fraction) {
        return Math.round(fraction * 100) + "%";
    }

    private static String integer(@Nullable Double value) {
        return value == null ? "" : String.valueOf(Math.round(value));
    }
}
