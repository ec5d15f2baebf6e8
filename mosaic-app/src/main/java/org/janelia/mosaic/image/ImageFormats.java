package org.janelia.mosaic.image;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Image format names and file extension helpers.
 */
public class ImageFormats {

    public static final String JPEG_FORMAT = "jpg";
    public static final String PNG_FORMAT = "png";
    public static final String TIFF_FORMAT = "tiff";
    public static final String TIF_FORMAT = "tif";

    /** Extensions of files that are considered to be images when expanding candidate directories. */
    public static final Set<String> SUPPORTED_EXTENSIONS =
            Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList("jpg", "jpeg", "png", "bmp", "gif",
                                                                          "tif", "tiff")));

    /** Extensions that ImageIO reads without help, all others fall back to ImageJ. */
    static final Set<String> IMAGE_IO_EXTENSIONS =
            Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList("jpg", "jpeg", "png", "bmp", "gif",
                                                                          "wbmp")));

    private ImageFormats() {
    }

    /**
     * @return lower case extension of the specified path or an empty string if the path has no extension.
     */
    public static String getExtension(final String path) {
        final int lastSeparator = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        final int lastDot = path.lastIndexOf('.');
        return (lastDot > lastSeparator) ? path.substring(lastDot + 1).toLowerCase(Locale.ROOT) : "";
    }

    public static boolean isSupportedImagePath(final String path) {
        return SUPPORTED_EXTENSIONS.contains(getExtension(path));
    }

    public static boolean isTiff(final String format) {
        return TIFF_FORMAT.equalsIgnoreCase(format) || TIF_FORMAT.equalsIgnoreCase(format);
    }

    public static boolean isJpeg(final String format) {
        return JPEG_FORMAT.equalsIgnoreCase(format) || "jpeg".equalsIgnoreCase(format);
    }

    /**
     * @return format derived from the path's extension or the default format if the path has no extension.
     */
    public static String deriveFormat(final String path,
                                      final String defaultFormat) {
        final String extension = getExtension(path);
        return extension.isEmpty() ? defaultFormat : extension;
    }
}
