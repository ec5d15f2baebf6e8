package org.janelia.mosaic.image;

/**
 * Indicates that the pixels of a decoded image could not be read
 * (e.g. because the image uses an unsupported channel layout).
 */
public class PixelAccessException
        extends RuntimeException {

    public PixelAccessException(final String message) {
        super(message);
    }

    public PixelAccessException(final String message,
                                final Throwable cause) {
        super(message, cause);
    }
}
