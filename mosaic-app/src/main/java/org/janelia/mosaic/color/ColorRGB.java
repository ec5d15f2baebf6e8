package org.janelia.mosaic.color;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.Objects;

/**
 * Immutable 8-bit per channel color with an optional alpha channel (opaque by default).
 */
public class ColorRGB implements Serializable {

    public static final int OPAQUE = 255;

    public static final ColorRGB BLACK = new ColorRGB(0, 0, 0);
    public static final ColorRGB WHITE = new ColorRGB(255, 255, 255);

    /** Largest possible distance between two colors: sqrt(3 * 255^2). */
    public static final double MAX_DISTANCE = Math.sqrt(3.0 * 255 * 255);

    private int red;
    private int green;
    private int blue;
    private int alpha;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private ColorRGB() {
        this.alpha = OPAQUE;
    }

    public ColorRGB(final int red,
                    final int green,
                    final int blue) {
        this(red, green, blue, OPAQUE);
    }

    public ColorRGB(final int red,
                    final int green,
                    final int blue,
                    final int alpha)
            throws IllegalArgumentException {
        this.red = checkChannel("red", red);
        this.green = checkChannel("green", green);
        this.blue = checkChannel("blue", blue);
        this.alpha = checkChannel("alpha", alpha);
    }

    /**
     * @return opaque color for the specified packed 0x??RRGGBB value (high order bits are ignored).
     */
    public static ColorRGB fromRGB(final int packedRGB) {
        return new ColorRGB((packedRGB >> 16) & 0xff, (packedRGB >> 8) & 0xff, packedRGB & 0xff);
    }

    public int getRed() {
        return red;
    }

    public int getGreen() {
        return green;
    }

    public int getBlue() {
        return blue;
    }

    public int getAlpha() {
        return alpha;
    }

    @JsonIgnore
    public boolean isOpaque() {
        return alpha == OPAQUE;
    }

    /**
     * @return packed 0x00RRGGBB representation of this color (alpha is dropped).
     */
    public int toRGB() {
        return (red << 16) | (green << 8) | blue;
    }

    /**
     * @return Euclidean distance between this color and the other color in RGB space (alpha is ignored).
     */
    public double distanceTo(final ColorRGB other) {
        final double deltaRed = red - other.red;
        final double deltaGreen = green - other.green;
        final double deltaBlue = blue - other.blue;
        return Math.sqrt((deltaRed * deltaRed) + (deltaGreen * deltaGreen) + (deltaBlue * deltaBlue));
    }

    /**
     * @return overlay version of this color with the specified alpha.
     */
    public ColorRGB withAlpha(final int overlayAlpha)
            throws IllegalArgumentException {
        return new ColorRGB(red, green, blue, overlayAlpha);
    }

    /**
     * @return opaque result of compositing this color (using its alpha) over the specified color.
     */
    public ColorRGB blendOver(final ColorRGB under) {
        return ColorRGB.fromRGB(blendOver(under.toRGB()));
    }

    /**
     * Composites this color (using its alpha) over a packed 0x??RRGGBB pixel value.
     *
     * @return packed 0x00RRGGBB result.
     */
    public int blendOver(final int underRGB) {
        if (alpha == OPAQUE) {
            return toRGB();
        }
        final int r = blendChannel(red, (underRGB >> 16) & 0xff);
        final int g = blendChannel(green, (underRGB >> 8) & 0xff);
        final int b = blendChannel(blue, underRGB & 0xff);
        return (r << 16) | (g << 8) | b;
    }

    public String toHexString() {
        return String.format("#%02X%02X%02X", red, green, blue);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if ((o == null) || (getClass() != o.getClass())) {
            return false;
        }
        final ColorRGB that = (ColorRGB) o;
        return (red == that.red) && (green == that.green) && (blue == that.blue) && (alpha == that.alpha);
    }

    @Override
    public int hashCode() {
        return Objects.hash(red, green, blue, alpha);
    }

    @Override
    public String toString() {
        return "(" + red + "," + green + "," + blue + (isOpaque() ? "" : "," + alpha) + ")";
    }

    private int blendChannel(final int overValue,
                             final int underValue) {
        // rounded integer form of a*over + (1-a)*under
        return ((overValue * alpha) + (underValue * (OPAQUE - alpha)) + 127) / OPAQUE;
    }

    private static int checkChannel(final String name,
                                    final int value)
            throws IllegalArgumentException {
        if ((value < 0) || (value > 255)) {
            throw new IllegalArgumentException(name + " value " + value + " must be between 0 and 255");
        }
        return value;
    }
}
