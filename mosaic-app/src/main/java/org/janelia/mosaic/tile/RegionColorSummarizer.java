package org.janelia.mosaic.tile;

import java.awt.Rectangle;

import org.janelia.mosaic.color.ColorRGB;
import org.janelia.mosaic.image.PixelBuffer;

/**
 * Computes average colors of rectangular pixel regions.
 */
public class RegionColorSummarizer {

    private RegionColorSummarizer() {
    }

    /**
     * @return average color of the entire buffer.
     */
    public static ColorRGB averageColor(final PixelBuffer buffer) {
        return averageColor(buffer, buffer.getBounds());
    }

    /**
     * Channel values are summed with long accumulators and divided by the pixel count,
     * truncating any fractional part.
     *
     * @return average color of the specified region.
     *
     * @throws ZeroAreaRegionException
     *   if the region contains no pixels.
     *
     * @throws IllegalArgumentException
     *   if the region is not within the buffer's bounds.
     */
    public static ColorRGB averageColor(final PixelBuffer buffer,
                                        final Rectangle region)
            throws IllegalArgumentException {

        if ((region.width < 1) || (region.height < 1)) {
            throw new ZeroAreaRegionException("cannot average zero area region " + region);
        }

        if (! buffer.contains(region)) {
            throw new IllegalArgumentException("region " + region + " is outside " + buffer.getWidth() + "x" +
                                               buffer.getHeight() + " buffer bounds");
        }

        long redTotal = 0;
        long greenTotal = 0;
        long blueTotal = 0;

        final int maxX = region.x + region.width;
        final int maxY = region.y + region.height;
        int rgb;
        for (int y = region.y; y < maxY; y++) {
            for (int x = region.x; x < maxX; x++) {
                rgb = buffer.getRGB(x, y);
                redTotal += (rgb >> 16) & 0xff;
                greenTotal += (rgb >> 8) & 0xff;
                blueTotal += rgb & 0xff;
            }
        }

        final long pixelCount = (long) region.width * region.height;

        return new ColorRGB((int) (redTotal / pixelCount),
                            (int) (greenTotal / pixelCount),
                            (int) (blueTotal / pixelCount));
    }
}
