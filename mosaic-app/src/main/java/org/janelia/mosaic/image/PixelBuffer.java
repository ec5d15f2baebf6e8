package org.janelia.mosaic.image;

import ij.process.ColorProcessor;
import ij.process.ImageProcessor;

import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.util.Arrays;

import org.janelia.mosaic.color.ColorRGB;

/**
 * Decoded image with random access to packed 0x00RRGGBB pixel values.
 * Instances are never changed once they have been created.
 */
public class PixelBuffer {

    private static final int RGB_MASK = 0x00ffffff;

    private final int width;
    private final int height;
    private final int[] pixels;

    /**
     * Wraps (without copying) the specified pixel array.
     *
     * @throws IllegalArgumentException
     *   if the dimensions are not positive or do not match the pixel count.
     */
    public PixelBuffer(final int width,
                       final int height,
                       final int[] pixels)
            throws IllegalArgumentException {

        if ((width < 1) || (height < 1)) {
            throw new IllegalArgumentException("buffer dimensions " + width + "x" + height + " must be positive");
        }
        if (pixels.length != (width * height)) {
            throw new IllegalArgumentException("buffer dimensions " + width + "x" + height +
                                               " do not match pixel count " + pixels.length);
        }

        this.width = width;
        this.height = height;
        this.pixels = pixels;
    }

    /**
     * @return buffer with every pixel set to the specified color.
     */
    public static PixelBuffer filled(final int width,
                                     final int height,
                                     final ColorRGB color) {
        final int[] pixels = new int[width * height];
        Arrays.fill(pixels, color.toRGB());
        return new PixelBuffer(width, height, pixels);
    }

    /**
     * @return buffer containing the sRGB values of the specified image.
     *
     * @throws PixelAccessException
     *   if the image's pixels cannot be converted.
     */
    public static PixelBuffer fromBufferedImage(final BufferedImage image)
            throws PixelAccessException {

        final int w = image.getWidth();
        final int h = image.getHeight();
        final int[] pixels;
        try {
            pixels = image.getRGB(0, 0, w, h, null, 0, w);
        } catch (final RuntimeException e) {
            throw new PixelAccessException("failed to read pixels from " + w + "x" + h + " image of type " +
                                           image.getType(), e);
        }

        for (int i = 0; i < pixels.length; i++) {
            pixels[i] &= RGB_MASK;
        }

        return new PixelBuffer(w, h, pixels);
    }

    /**
     * @return buffer containing a copy of the specified processor's pixels converted to RGB.
     *
     * @throws PixelAccessException
     *   if the processor cannot be converted.
     */
    public static PixelBuffer fromImageProcessor(final ImageProcessor imageProcessor)
            throws PixelAccessException {

        final ColorProcessor colorProcessor;
        try {
            if (imageProcessor instanceof ColorProcessor) {
                colorProcessor = (ColorProcessor) imageProcessor;
            } else {
                colorProcessor = imageProcessor.convertToColorProcessor();
            }
        } catch (final RuntimeException e) {
            throw new PixelAccessException("failed to convert " + imageProcessor + " to RGB", e);
        }

        final int[] sourcePixels = (int[]) colorProcessor.getPixels();
        final int[] pixels = new int[sourcePixels.length];
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] = sourcePixels[i] & RGB_MASK;
        }

        return new PixelBuffer(colorProcessor.getWidth(), colorProcessor.getHeight(), pixels);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public Rectangle getBounds() {
        return new Rectangle(0, 0, width, height);
    }

    public boolean contains(final Rectangle region) {
        return (region.x >= 0) && (region.y >= 0) && (region.width >= 0) && (region.height >= 0) &&
               ((region.x + region.width) <= width) && ((region.y + region.height) <= height);
    }

    /**
     * @return packed 0x00RRGGBB value of the pixel at (x, y).
     */
    public int getRGB(final int x,
                      final int y) {
        return pixels[(y * width) + x];
    }

    public ColorRGB getColor(final int x,
                             final int y) {
        return ColorRGB.fromRGB(getRGB(x, y));
    }

    /**
     * @return copy of the pixels within the specified region.
     *
     * @throws IllegalArgumentException
     *   if the region does not lie within this buffer.
     */
    public PixelBuffer getRegion(final Rectangle region)
            throws IllegalArgumentException {

        if (! contains(region)) {
            throw new IllegalArgumentException("region " + region + " is outside " + width + "x" + height +
                                               " buffer bounds");
        }

        final int[] regionPixels = new int[region.width * region.height];
        for (int y = 0; y < region.height; y++) {
            System.arraycopy(pixels, ((region.y + y) * width) + region.x,
                             regionPixels, y * region.width,
                             region.width);
        }
        return new PixelBuffer(region.width, region.height, regionPixels);
    }

    /**
     * @return new (independent) ImageJ processor with this buffer's pixels.
     */
    public ColorProcessor toColorProcessor() {
        return new ColorProcessor(width, height, pixels.clone());
    }

    public BufferedImage toBufferedImage() {
        final BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        image.setRGB(0, 0, width, height, pixels, 0, width);
        return image;
    }

    /**
     * @return true if the other buffer has the same dimensions and pixel values as this buffer.
     */
    public boolean hasSamePixels(final PixelBuffer other) {
        return (other != null) &&
               (width == other.width) &&
               (height == other.height) &&
               Arrays.equals(pixels, other.pixels);
    }

    @Override
    public String toString() {
        return "PixelBuffer{" + width + "x" + height + "}";
    }
}
