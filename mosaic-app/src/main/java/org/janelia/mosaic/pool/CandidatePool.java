package org.janelia.mosaic.pool;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only collection of candidate images loaded for one mosaic job.
 * Candidates are ordered by their position in the loaded path list
 * (independent of the order in which parallel loads completed).
 * The pool owns the usage counters of its candidates.
 */
public class CandidatePool {

    private final List<CandidateImage> candidates;
    private final int attemptedCount;
    private final int skippedCount;

    public CandidatePool(final Collection<CandidateImage> candidates,
                         final int attemptedCount,
                         final int skippedCount) {
        final List<CandidateImage> sortedCandidates = new ArrayList<>(candidates);
        sortedCandidates.sort(Comparator.comparingInt(CandidateImage::getSourceIndex));
        this.candidates = Collections.unmodifiableList(sortedCandidates);
        this.attemptedCount = attemptedCount;
        this.skippedCount = skippedCount;
    }

    public static CandidatePool empty() {
        return new CandidatePool(Collections.emptyList(), 0, 0);
    }

    public List<CandidateImage> getCandidates() {
        return candidates;
    }

    public CandidateImage get(final int index) {
        return candidates.get(index);
    }

    public int size() {
        return candidates.size();
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }

    /**
     * @return number of paths that were loaded (or attempted).
     */
    public int getAttemptedCount() {
        return attemptedCount;
    }

    /**
     * @return number of paths that could not be loaded.
     */
    public int getSkippedCount() {
        return skippedCount;
    }

    /**
     * @return path to selection count map in pool order.
     */
    public Map<String, Integer> getUsageCounts() {
        final Map<String, Integer> usageCounts = new LinkedHashMap<>();
        for (final CandidateImage candidate : candidates) {
            usageCounts.put(candidate.getFilePath(), candidate.getUsageCount());
        }
        return usageCounts;
    }

    @Override
    public String toString() {
        return "CandidatePool{size=" + candidates.size() + ", attemptedCount=" + attemptedCount +
               ", skippedCount=" + skippedCount + "}";
    }
}
