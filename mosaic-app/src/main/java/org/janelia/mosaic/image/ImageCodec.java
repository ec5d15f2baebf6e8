package org.janelia.mosaic.image;

import java.io.IOException;

/**
 * Converts between image files and {@link PixelBuffer} instances.
 */
public interface ImageCodec {

    /**
     * @param  path  path of the image file to decode.
     *
     * @return decoded pixels for the image.
     *
     * @throws UnreadableImageException
     *   if the file is missing, corrupt, or in an unsupported format.
     */
    PixelBuffer decode(final String path)
            throws UnreadableImageException;

    /**
     * @param  buffer   pixels to encode.
     * @param  path     path of the file to write (parent directories are created as needed).
     * @param  format   image format name (e.g. jpg, png, tiff).
     * @param  quality  compression quality (0.0 to 1.0) for lossy formats.
     *
     * @throws IOException
     *   if the image cannot be written.
     */
    void encode(final PixelBuffer buffer,
                final String path,
                final String format,
                final float quality)
            throws IOException;

}
