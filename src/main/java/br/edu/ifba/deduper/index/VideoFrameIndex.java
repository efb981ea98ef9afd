package br.edu.ifba.deduper.index;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * One neighbor index per keyframe position.
 *
 * <p>A stored video matches a query when, at every aligned position
 * (up to the shorter of the two frame counts), its frame code lies within the
 * radius. That is exactly "maximum aligned frame distance &lt;= radius".</p>
 */
public final class VideoFrameIndex {

    private final Supplier<NeighborIndex> indexFactory;
    private final List<NeighborIndex> positions = new ArrayList<>();
    private final Map<String, Integer> frameCounts = new HashMap<>();
    private boolean frozen;

    public VideoFrameIndex(@NotNull Supplier<NeighborIndex> indexFactory) {
        if (indexFactory == null) {
            throw new IllegalArgumentException("indexFactory cannot be null");
        }
        this.indexFactory = indexFactory;
    }

    public void insert(@NotNull List<Long> frameCodes, @NotNull String fileId) {
        if (frozen) {
            throw new IllegalStateException("cannot insert into a frozen index");
        }
        if (frameCodes == null || frameCodes.isEmpty()) {
            throw new IllegalArgumentException("frameCodes cannot be null or empty");
        }
        while (positions.size() < frameCodes.size()) {
            positions.add(indexFactory.get());
        }
        for (int i = 0; i < frameCodes.size(); i++) {
            positions.get(i).insert(frameCodes.get(i), fileId);
        }
        frameCounts.put(fileId, frameCodes.size());
    }

    /**
     * Returns every stored video whose maximum aligned frame distance to the
     * query is within the radius, with that maximum as the match distance.
     */
    public List<NeighborMatch> query(@NotNull List<Long> frameCodes, int radius, @NotNull ComparisonCounter counter) {
        Map<String, Integer> hits = new LinkedHashMap<>();
        Map<String, Integer> maxDistance = new HashMap<>();
        int usable = Math.min(frameCodes.size(), positions.size());
        for (int i = 0; i < usable; i++) {
            for (NeighborMatch match : positions.get(i).query(frameCodes.get(i), radius, counter)) {
                // Candidates that missed an earlier position can never qualify.
                if (i > 0 && hits.getOrDefault(match.fileId(), 0) != i) {
                    continue;
                }
                hits.merge(match.fileId(), 1, Integer::sum);
                maxDistance.merge(match.fileId(), match.distance(), Math::max);
            }
        }

        List<NeighborMatch> matches = new ArrayList<>();
        for (Map.Entry<String, Integer> hit : hits.entrySet()) {
            int aligned = Math.min(frameCodes.size(), frameCounts.get(hit.getKey()));
            if (hit.getValue() == aligned) {
                matches.add(new NeighborMatch(hit.getKey(), maxDistance.get(hit.getKey())));
            }
        }
        return matches;
    }

    public void freeze() {
        positions.forEach(NeighborIndex::freeze);
        frozen = true;
    }

    public int size() {
        return frameCounts.size();
    }
}
