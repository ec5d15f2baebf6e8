package org.janelia.mosaic;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

import org.janelia.mosaic.json.JsonUtils;

/**
 * Summary of a completed mosaic job.
 */
public class MosaicStatistics implements Serializable {

    private MosaicStrategy strategy;
    private int columns;
    private int rows;
    private int tilesProcessed;
    private int fallbackTileCount;
    private int failedDrawCount;
    private int candidatesTotal;
    private int candidatesLoaded;
    private int candidatesSkipped;
    private int uniqueCandidatesUsed;
    private String mostUsedCandidatePath;
    private int mostUsedCandidateCount;
    private Double averageColorDistance;
    private Map<String, Integer> candidateUsageCounts;
    private long randomSeed;
    private long elapsedMilliseconds;

    public MosaicStatistics() {
        this.candidateUsageCounts = new LinkedHashMap<>();
    }

    public MosaicStrategy getStrategy() {
        return strategy;
    }

    public void setStrategy(final MosaicStrategy strategy) {
        this.strategy = strategy;
    }

    public int getColumns() {
        return columns;
    }

    public int getRows() {
        return rows;
    }

    public void setGridSize(final int columns,
                            final int rows) {
        this.columns = columns;
        this.rows = rows;
    }

    public int getTilesProcessed() {
        return tilesProcessed;
    }

    public void setTilesProcessed(final int tilesProcessed) {
        this.tilesProcessed = tilesProcessed;
    }

    public int getFallbackTileCount() {
        return fallbackTileCount;
    }

    public void setFallbackTileCount(final int fallbackTileCount) {
        this.fallbackTileCount = fallbackTileCount;
    }

    public int getFailedDrawCount() {
        return failedDrawCount;
    }

    public void setFailedDrawCount(final int failedDrawCount) {
        this.failedDrawCount = failedDrawCount;
    }

    public int getCandidatesTotal() {
        return candidatesTotal;
    }

    public int getCandidatesLoaded() {
        return candidatesLoaded;
    }

    public int getCandidatesSkipped() {
        return candidatesSkipped;
    }

    public void setCandidateCounts(final int total,
                                   final int loaded,
                                   final int skipped) {
        this.candidatesTotal = total;
        this.candidatesLoaded = loaded;
        this.candidatesSkipped = skipped;
    }

    public int getUniqueCandidatesUsed() {
        return uniqueCandidatesUsed;
    }

    public String getMostUsedCandidatePath() {
        return mostUsedCandidatePath;
    }

    public int getMostUsedCandidateCount() {
        return mostUsedCandidateCount;
    }

    public Map<String, Integer> getCandidateUsageCounts() {
        return candidateUsageCounts;
    }

    /**
     * Sets usage counts and derives the unique and most used values from them.
     * The first candidate with the highest count wins ties.
     */
    public void setCandidateUsageCounts(final Map<String, Integer> usageCounts) {
        this.candidateUsageCounts = new LinkedHashMap<>();
        this.uniqueCandidatesUsed = 0;
        this.mostUsedCandidatePath = null;
        this.mostUsedCandidateCount = 0;
        for (final Map.Entry<String, Integer> entry : usageCounts.entrySet()) {
            final int count = entry.getValue();
            if (count > 0) {
                candidateUsageCounts.put(entry.getKey(), count);
                uniqueCandidatesUsed++;
                if (count > mostUsedCandidateCount) {
                    mostUsedCandidateCount = count;
                    mostUsedCandidatePath = entry.getKey();
                }
            }
        }
    }

    public Double getAverageColorDistance() {
        return averageColorDistance;
    }

    public void setAverageColorDistance(final Double averageColorDistance) {
        this.averageColorDistance = averageColorDistance;
    }

    public long getRandomSeed() {
        return randomSeed;
    }

    public void setRandomSeed(final long randomSeed) {
        this.randomSeed = randomSeed;
    }

    public long getElapsedMilliseconds() {
        return elapsedMilliseconds;
    }

    public void setElapsedMilliseconds(final long elapsedMilliseconds) {
        this.elapsedMilliseconds = elapsedMilliseconds;
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    public static MosaicStatistics fromJson(final String json) {
        return JSON_HELPER.fromJson(json);
    }

    @Override
    public String toString() {
        return "{strategy: " + strategy +
               ", grid: " + columns + "x" + rows +
               ", tilesProcessed: " + tilesProcessed +
               ", fallbackTileCount: " + fallbackTileCount +
               ", candidatesLoaded: " + candidatesLoaded +
               ", candidatesSkipped: " + candidatesSkipped +
               ", uniqueCandidatesUsed: " + uniqueCandidatesUsed +
               '}';
    }

    private static final JsonUtils.Helper<MosaicStatistics> JSON_HELPER =
            new JsonUtils.Helper<>(JsonUtils.MAPPER, MosaicStatistics.class);
}
