package org.janelia.mosaic.pool;

import java.util.concurrent.atomic.AtomicInteger;

import org.janelia.mosaic.color.ColorRGB;

/**
 * Summary of an image that may be drawn into mosaic tiles.
 */
public class CandidateImage {

    private final String filePath;
    private final ColorRGB averageColor;
    private final int sourceIndex;
    private final AtomicInteger usageCount;

    /**
     * @param  filePath      path of the image file.
     * @param  averageColor  average color of the entire image.
     * @param  sourceIndex   position of the path in the list that was loaded (used for stable ordering).
     */
    public CandidateImage(final String filePath,
                          final ColorRGB averageColor,
                          final int sourceIndex) {
        this.filePath = filePath;
        this.averageColor = averageColor;
        this.sourceIndex = sourceIndex;
        this.usageCount = new AtomicInteger(0);
    }

    public String getFilePath() {
        return filePath;
    }

    public ColorRGB getAverageColor() {
        return averageColor;
    }

    public int getSourceIndex() {
        return sourceIndex;
    }

    /**
     * @return number of times this image has been chosen by the {@link MatchSelector}.
     */
    public int getUsageCount() {
        return usageCount.get();
    }

    public boolean isUnused() {
        return usageCount.get() == 0;
    }

    public double distanceTo(final ColorRGB color) {
        return averageColor.distanceTo(color);
    }

    // only the selector (while holding the pool lock) changes usage
    int incrementUsageCount() {
        return usageCount.incrementAndGet();
    }

    @Override
    public String toString() {
        return "CandidateImage{" + filePath + ", averageColor=" + averageColor + ", usageCount=" + usageCount + "}";
    }
}
