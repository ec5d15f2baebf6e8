package org.janelia.mosaic;

import org.janelia.mosaic.image.PixelBuffer;

/**
 * Output of a mosaic job.
 */
public class MosaicResult {

    private final PixelBuffer output;
    private final MosaicStatistics statistics;
    private final String outputPath;
    private final String thumbnailPath;

    public MosaicResult(final PixelBuffer output,
                        final MosaicStatistics statistics,
                        final String outputPath,
                        final String thumbnailPath) {
        this.output = output;
        this.statistics = statistics;
        this.outputPath = outputPath;
        this.thumbnailPath = thumbnailPath;
    }

    public PixelBuffer getOutput() {
        return output;
    }

    public MosaicStatistics getStatistics() {
        return statistics;
    }

    /**
     * @return path of the written output image or null if the output was not written.
     */
    public String getOutputPath() {
        return outputPath;
    }

    /**
     * @return path of the written thumbnail or null if no thumbnail was written.
     */
    public String getThumbnailPath() {
        return thumbnailPath;
    }

    @Override
    public String toString() {
        return "{outputPath: " + outputPath + ", statistics: " + statistics + '}';
    }
}
