package org.janelia.mosaic.image;

import java.io.File;
import java.io.IOException;

import org.janelia.mosaic.MosaicTestImages;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Tests the {@link ImageIOCodec} class.
 */
public class ImageIOCodecTest {

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    @Test
    public void testLosslessFormats() throws Exception {

        final PixelBuffer buffer = MosaicTestImages.gradient(31, 17);
        final File directory = temporaryFolder.getRoot();

        for (final String format : new String[] { ImageFormats.PNG_FORMAT, ImageFormats.TIF_FORMAT }) {
            final String path = new File(directory, "nested/test." + format).getAbsolutePath();
            ImageIOCodec.INSTANCE.encode(buffer, path, format, 1.0f);
            final PixelBuffer decoded = ImageIOCodec.INSTANCE.decode(path);
            Assert.assertTrue(format + " pixels changed after write and read", buffer.hasSamePixels(decoded));
        }
    }

    @Test
    public void testJpegDimensions() throws Exception {
        final PixelBuffer buffer = MosaicTestImages.gradient(40, 30);
        final String path = new File(temporaryFolder.getRoot(), "test.jpg").getAbsolutePath();
        ImageIOCodec.INSTANCE.encode(buffer, path, ImageFormats.JPEG_FORMAT, 0.85f);
        final PixelBuffer decoded = ImageIOCodec.INSTANCE.decode(path);
        Assert.assertEquals("invalid width", 40, decoded.getWidth());
        Assert.assertEquals("invalid height", 30, decoded.getHeight());
    }

    @Test
    public void testUnreadableImages() throws Exception {

        final File directory = temporaryFolder.getRoot();

        assertUnreadable(new File(directory, "missing.png").getAbsolutePath());
        assertUnreadable(MosaicTestImages.writeGarbage(directory, "garbage.png"));
        assertUnreadable(MosaicTestImages.writeGarbage(directory, "garbage.jpg"));
    }

    @Test(expected = IOException.class)
    public void testUnsupportedFormat() throws Exception {
        final String path = new File(temporaryFolder.getRoot(), "test.xyz").getAbsolutePath();
        ImageIOCodec.INSTANCE.encode(MosaicTestImages.gradient(3, 3), path, "xyz", 1.0f);
    }

    private void assertUnreadable(final String path) {
        try {
            ImageIOCodec.INSTANCE.decode(path);
            Assert.fail(path + " should not be readable");
        } catch (final UnreadableImageException e) {
            Assert.assertEquals("invalid path in exception", path, e.getPath());
        }
    }

}
