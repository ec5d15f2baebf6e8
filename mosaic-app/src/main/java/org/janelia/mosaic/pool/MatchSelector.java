package org.janelia.mosaic.pool;

import java.util.List;

import org.janelia.mosaic.color.ColorRGB;

/**
 * Selects the candidate whose average color is closest (Euclidean RGB distance) to a target color.
 * Candidates that have never been selected are preferred.
 * Once every candidate has been selected at least once, the closest candidate overall is chosen,
 * so a selection never fails for a non-empty pool.
 * Ties are broken by pool order.
 */
public class MatchSelector {

    private MatchSelector() {
    }

    /**
     * Selects the best candidate and increments its usage count.
     * Selections against the same pool are serialized.
     *
     * @return the selected candidate or null if the pool is empty.
     */
    public static CandidateImage selectClosest(final ColorRGB targetColor,
                                               final CandidatePool pool) {

        synchronized (pool) {

            final List<CandidateImage> candidates = pool.getCandidates();

            CandidateImage selected = findClosest(targetColor, candidates, true);
            if (selected == null) {
                selected = findClosest(targetColor, candidates, false);
            }

            if (selected != null) {
                selected.incrementUsageCount();
            }

            return selected;
        }
    }

    /**
     * @return closest candidate (first one encountered for ties) or null if no candidate qualifies.
     */
    static CandidateImage findClosest(final ColorRGB targetColor,
                                      final List<CandidateImage> candidates,
                                      final boolean unusedOnly) {
        CandidateImage closest = null;
        double closestDistance = Double.MAX_VALUE;
        double distance;
        for (final CandidateImage candidate : candidates) {
            if (unusedOnly && (! candidate.isUnused())) {
                continue;
            }
            distance = candidate.distanceTo(targetColor);
            if (distance < closestDistance) {
                closestDistance = distance;
                closest = candidate;
            }
        }
        return closest;
    }
}
