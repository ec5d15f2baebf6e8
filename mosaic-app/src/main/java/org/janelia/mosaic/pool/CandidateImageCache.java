package org.janelia.mosaic.pool;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.CacheStats;
import com.google.common.cache.LoadingCache;
import com.google.common.cache.Weigher;
import com.google.common.util.concurrent.ExecutionError;
import com.google.common.util.concurrent.UncheckedExecutionException;

import ij.process.ColorProcessor;
import ij.process.ImageProcessor;

import java.util.Objects;
import java.util.concurrent.ExecutionException;

import org.janelia.mosaic.image.ImageCodec;
import org.janelia.mosaic.image.PixelBuffer;
import org.janelia.mosaic.image.UnreadableImageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cache of candidate images that have been decoded and resized to tile dimensions.
 * The cache is constrained by a max pixel count parameter which should roughly correlate to max memory usage.
 * Once the cache is full, least recently used instances are removed to make room.
 *
 * For gory details about the cache implementation, see
 * <a href="https://github.com/google/guava/wiki/CachesExplained">
 *     https://github.com/google/guava/wiki/CachesExplained
 * </a>.
 *
 * @author Eric Trautman
 */
public class CandidateImageCache {

    /** Default max number of pixels is 100 million (about 400MB). */
    public static final long DEFAULT_MAX_CACHED_PIXELS = 100 * 1000000L;

    private final ImageCodec imageCodec;
    private final LoadingCache<CacheKey, PixelBuffer> cache;

    public CandidateImageCache(final ImageCodec imageCodec) {
        this(imageCodec, DEFAULT_MAX_CACHED_PIXELS);
    }

    /**
     * @param  imageCodec               codec for decoding candidate files.
     * @param  maximumNumberOfCachedPixels  the maximum number of pixels to maintain in the cache.
     *                                  A value of zero disables caching.
     */
    public CandidateImageCache(final ImageCodec imageCodec,
                               final long maximumNumberOfCachedPixels) {

        this.imageCodec = imageCodec;

        // weigh entries in kilo-pixels so that large caches do not overflow the int weight range
        final Weigher<CacheKey, PixelBuffer> weigher =
                (key, value) -> Math.max(1, (int) Math.min(Integer.MAX_VALUE,
                                                           ((long) value.getWidth() * value.getHeight()) / 1000));

        final CacheLoader<CacheKey, PixelBuffer> loader =
                new CacheLoader<CacheKey, PixelBuffer>() {
                    @Override
                    public PixelBuffer load(final CacheKey key)
                            throws UnreadableImageException {
                        return loadResizedImage(key);
                    }
                };

        this.cache = CacheBuilder.newBuilder()
                .maximumWeight(maximumNumberOfCachedPixels / 1000)
                .weigher(weigher)
                .recordStats()
                .build(loader);
    }

    /**
     * @return the image at the specified path resized to the specified dimensions.
     *
     * @throws UnreadableImageException
     *   if the image cannot be decoded or resized.
     */
    public PixelBuffer getResized(final String path,
                                  final int width,
                                  final int height)
            throws UnreadableImageException {

        final CacheKey key = new CacheKey(path, width, height);
        try {
            return cache.get(key);
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof UnreadableImageException) {
                throw (UnreadableImageException) cause;
            }
            throw new UnreadableImageException(path, "failed to load resized image", cause);
        } catch (final UncheckedExecutionException | ExecutionError e) {
            throw new UnreadableImageException(path, "failed to load resized image", e.getCause());
        }
    }

    public CacheStats getStats() {
        return cache.stats();
    }

    public long size() {
        return cache.size();
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    /**
     * @return copy of the source image scaled to the specified dimensions
     *         (pixels are averaged when down sampling).
     */
    public static PixelBuffer resize(final PixelBuffer source,
                                     final int width,
                                     final int height) {
        if ((source.getWidth() == width) && (source.getHeight() == height)) {
            return source;
        }
        final ColorProcessor processor = source.toColorProcessor();
        processor.setInterpolationMethod(ImageProcessor.BILINEAR);
        return PixelBuffer.fromImageProcessor(processor.resize(width, height, true));
    }

    private PixelBuffer loadResizedImage(final CacheKey key)
            throws UnreadableImageException {
        final PixelBuffer source = imageCodec.decode(key.path);
        final PixelBuffer resized = resize(source, key.width, key.height);
        LOG.debug("loadResizedImage: resized {}x{} image {} to {}x{}",
                  source.getWidth(), source.getHeight(), key.path, key.width, key.height);
        return resized;
    }

    private static class CacheKey {

        private final String path;
        private final int width;
        private final int height;

        CacheKey(final String path,
                 final int width,
                 final int height) {
            this.path = path;
            this.width = width;
            this.height = height;
        }

        @Override
        public boolean equals(final Object o) {
            if (this == o) {
                return true;
            }
            if ((o == null) || (getClass() != o.getClass())) {
                return false;
            }
            final CacheKey that = (CacheKey) o;
            return (width == that.width) && (height == that.height) && path.equals(that.path);
        }

        @Override
        public int hashCode() {
            return Objects.hash(path, width, height);
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(CandidateImageCache.class);
}
