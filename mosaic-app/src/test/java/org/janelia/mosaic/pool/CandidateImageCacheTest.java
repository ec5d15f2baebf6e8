package org.janelia.mosaic.pool;

import java.io.File;

import org.janelia.mosaic.MosaicTestImages;
import org.janelia.mosaic.color.ColorRGB;
import org.janelia.mosaic.image.ImageIOCodec;
import org.janelia.mosaic.image.PixelBuffer;
import org.janelia.mosaic.image.UnreadableImageException;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Tests the {@link CandidateImageCache} class.
 */
public class CandidateImageCacheTest {

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    @Test
    public void testGetResized() throws Exception {

        final ColorRGB color = new ColorRGB(40, 80, 120);
        final String path = MosaicTestImages.writeSolidPng(temporaryFolder.getRoot(), "solid.png", color);

        final CandidateImageCache cache = new CandidateImageCache(ImageIOCodec.INSTANCE);

        final PixelBuffer resized = cache.getResized(path, 5, 3);
        Assert.assertEquals("invalid resized width", 5, resized.getWidth());
        Assert.assertEquals("invalid resized height", 3, resized.getHeight());
        Assert.assertEquals("resizing a solid image should keep its color", color, resized.getColor(4, 2));

        Assert.assertSame("second request should be served from cache", resized, cache.getResized(path, 5, 3));
        Assert.assertEquals("invalid hit count", 1, cache.getStats().hitCount());

        cache.getResized(path, 2, 2);
        Assert.assertEquals("invalid cache size", 2, cache.size());

        cache.invalidateAll();
        Assert.assertEquals("cache should be empty after invalidation", 0, cache.size());
    }

    @Test
    public void testResizeUnchangedSize() {
        final PixelBuffer source = MosaicTestImages.gradient(6, 4);
        Assert.assertSame("same size resize should return source", source, CandidateImageCache.resize(source, 6, 4));
    }

    @Test
    public void testUnreadableImage() {
        final CandidateImageCache cache = new CandidateImageCache(ImageIOCodec.INSTANCE, 0);
        final String path = new File(temporaryFolder.getRoot(), "missing.png").getAbsolutePath();
        try {
            cache.getResized(path, 4, 4);
            Assert.fail("missing image should have caused exception");
        } catch (final UnreadableImageException e) {
            Assert.assertEquals("invalid path in exception", path, e.getPath());
        }
    }

}
