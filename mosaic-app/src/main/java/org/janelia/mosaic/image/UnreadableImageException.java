package org.janelia.mosaic.image;

import java.io.IOException;

/**
 * Indicates that an image could not be decoded because it is missing, corrupt, or in an unsupported format.
 */
public class UnreadableImageException
        extends IOException {

    private final String path;

    public UnreadableImageException(final String path,
                                    final String reason) {
        this(path, reason, null);
    }

    public UnreadableImageException(final String path,
                                    final String reason,
                                    final Throwable cause) {
        super("failed to read image " + path + ", " + reason, cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
