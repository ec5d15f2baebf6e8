package org.janelia.mosaic.image;

/**
 * Indicates that decoding an image kept running out of memory after all retry attempts were used.
 */
public class ResourceExhaustedException
        extends UnreadableImageException {

    private final int attemptCount;

    public ResourceExhaustedException(final String path,
                                      final int attemptCount,
                                      final Throwable cause) {
        super(path, "ran out of memory in each of " + attemptCount + " decode attempts", cause);
        this.attemptCount = attemptCount;
    }

    public int getAttemptCount() {
        return attemptCount;
    }
}
