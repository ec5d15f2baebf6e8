package org.janelia.mosaic;

import ij.process.ColorProcessor;

import java.awt.Color;
import java.awt.Rectangle;

import org.janelia.mosaic.color.ColorRGB;
import org.janelia.mosaic.image.PixelBuffer;

/**
 * Mutable pixel surface that starts as a copy of the master image and is written tile by tile.
 */
public class OutputCanvas {

    private final ColorProcessor colorProcessor;
    private final int[] pixels;

    public OutputCanvas(final PixelBuffer master) {
        this.colorProcessor = master.toColorProcessor();
        this.pixels = (int[]) colorProcessor.getPixels();
    }

    public int getWidth() {
        return colorProcessor.getWidth();
    }

    public int getHeight() {
        return colorProcessor.getHeight();
    }

    /**
     * Fills the specified region with an opaque color.
     */
    public void fillRectangle(final Rectangle region,
                              final ColorRGB color) {
        checkBounds(region);
        colorProcessor.setColor(new Color(color.toRGB()));
        colorProcessor.setRoi(region);
        colorProcessor.fill();
        colorProcessor.resetRoi();
    }

    /**
     * Draws the specified image with its upper left corner at the region's origin.
     * The image must have the same dimensions as the region.
     */
    public void drawImage(final Rectangle region,
                          final PixelBuffer image)
            throws IllegalArgumentException {
        checkBounds(region);
        if ((image.getWidth() != region.width) || (image.getHeight() != region.height)) {
            throw new IllegalArgumentException("image " + image + " does not fit region " + region);
        }
        colorProcessor.insert(image.toColorProcessor(), region.x, region.y);
    }

    /**
     * Blends the specified color (using its alpha) over every pixel in the region.
     */
    public void overlayRectangle(final Rectangle region,
                                 final ColorRGB overlayColor) {
        checkBounds(region);
        final int canvasWidth = colorProcessor.getWidth();
        final int maxY = region.y + region.height;
        final int maxX = region.x + region.width;
        int index;
        for (int y = region.y; y < maxY; y++) {
            index = (y * canvasWidth) + region.x;
            for (int x = region.x; x < maxX; x++) {
                pixels[index] = overlayColor.blendOver(pixels[index]);
                index++;
            }
        }
    }

    public PixelBuffer toPixelBuffer() {
        return PixelBuffer.fromImageProcessor(colorProcessor);
    }

    private void checkBounds(final Rectangle region)
            throws IllegalArgumentException {
        if ((region.x < 0) || (region.y < 0) ||
            (region.x + region.width > colorProcessor.getWidth()) ||
            (region.y + region.height > colorProcessor.getHeight())) {
            throw new IllegalArgumentException("region " + region + " is outside canvas bounds " +
                                               colorProcessor.getWidth() + "x" + colorProcessor.getHeight());
        }
    }
}
