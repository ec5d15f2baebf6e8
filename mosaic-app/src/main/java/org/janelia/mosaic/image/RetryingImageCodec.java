package org.janelia.mosaic.image;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Codec wrapper that retries decoding when the JVM runs out of memory.
 * The number of attempts is bounded and the wait between attempts grows linearly.
 * Once all attempts fail, a {@link ResourceExhaustedException} is thrown.
 */
public class RetryingImageCodec
        implements ImageCodec {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_BACKOFF_MILLIS = 250;

    private final ImageCodec delegate;
    private final int maxAttempts;
    private final long backoffMillis;

    public RetryingImageCodec(final ImageCodec delegate) {
        this(delegate, DEFAULT_MAX_ATTEMPTS, DEFAULT_BACKOFF_MILLIS);
    }

    public RetryingImageCodec(final ImageCodec delegate,
                              final int maxAttempts,
                              final long backoffMillis)
            throws IllegalArgumentException {

        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (backoffMillis < 0) {
            throw new IllegalArgumentException("backoffMillis must not be negative");
        }

        this.delegate = delegate;
        this.maxAttempts = maxAttempts;
        this.backoffMillis = backoffMillis;
    }

    @Override
    public PixelBuffer decode(final String path)
            throws UnreadableImageException {

        OutOfMemoryError lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return delegate.decode(path);
            } catch (final OutOfMemoryError e) {
                lastError = e;
                LOG.warn("decode: attempt {} of {} ran out of memory for {}", attempt, maxAttempts, path);
                if (attempt < maxAttempts) {
                    waitBeforeRetry(path, attempt);
                }
            }
        }

        throw new ResourceExhaustedException(path, maxAttempts, lastError);
    }

    @Override
    public void encode(final PixelBuffer buffer,
                       final String path,
                       final String format,
                       final float quality)
            throws IOException {
        delegate.encode(buffer, path, format, quality);
    }

    private void waitBeforeRetry(final String path,
                                 final int attempt)
            throws UnreadableImageException {
        try {
            Thread.sleep(backoffMillis * attempt);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UnreadableImageException(path, "interrupted while waiting to retry decode", e);
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(RetryingImageCodec.class);
}
