package org.janelia.mosaic.tile;

/**
 * Indicates that a region (or configured tile size) has no pixels.
 */
public class ZeroAreaRegionException
        extends IllegalArgumentException {

    public ZeroAreaRegionException(final String message) {
        super(message);
    }
}
