package org.janelia.mosaic.image;

import ij.ImagePlus;
import ij.io.FileInfo;
import ij.io.Opener;
import ij.io.TiffEncoder;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Iterator;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.FileImageOutputStream;
import javax.imageio.stream.ImageOutputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Codec that reads images with ImageIO (falling back to ImageJ for formats ImageIO does not handle)
 * and writes them with ImageIO or, for TIFF, with ImageJ's {@link TiffEncoder}.
 *
 * @author Stephan Saalfeld
 * @author Eric Trautman
 */
public class ImageIOCodec
        implements ImageCodec {

    public static final ImageIOCodec INSTANCE = new ImageIOCodec();

    @Override
    public PixelBuffer decode(final String path)
            throws UnreadableImageException {

        final File file = new File(path);
        if (! file.isFile()) {
            throw new UnreadableImageException(path, "file does not exist");
        }
        if (! file.canRead()) {
            throw new UnreadableImageException(path, "file is not readable");
        }

        final String extension = ImageFormats.getExtension(path);
        final boolean useImageIO = ImageFormats.IMAGE_IO_EXTENSIONS.contains(extension);

        PixelBuffer buffer = null;
        IOException readFailure = null;

        try {
            final BufferedImage image = ImageIO.read(file);
            if (image != null) {
                buffer = PixelBuffer.fromBufferedImage(image);
            }
        } catch (final IOException e) {
            readFailure = e;
        } catch (final PixelAccessException e) {
            throw new UnreadableImageException(path, "pixels are not accessible", e);
        }

        if ((buffer == null) && (! useImageIO)) {
            buffer = openWithImageJ(path);
        }

        if (buffer == null) {
            final String reason = readFailure == null ? "no decoder supports the data" : "data is corrupt";
            throw new UnreadableImageException(path, reason, readFailure);
        }

        LOG.debug("decode: loaded {}x{} image {}", buffer.getWidth(), buffer.getHeight(), path);

        return buffer;
    }

    @Override
    public void encode(final PixelBuffer buffer,
                       final String path,
                       final String format,
                       final float quality)
            throws IOException {

        final File file = prepareFileForWrite(path);
        final BufferedImage image = buffer.toBufferedImage();

        if (ImageFormats.isTiff(format)) {

            try (final FileOutputStream outputStream = new FileOutputStream(file)) {
                writeTiffImage(image, outputStream);
            }

        } else {

            try (final FileImageOutputStream outputStream = new FileImageOutputStream(file)) {
                writeImage(image, format, quality, outputStream);
            }

        }

        LOG.info("encode: exit, saved {}", file.getAbsolutePath());
    }

    /**
     * Writes the specified image using ImageIO.
     */
    public static void writeImage(final BufferedImage image,
                                  final String format,
                                  final float quality,
                                  final ImageOutputStream outputStream)
            throws IOException {

        final Iterator<ImageWriter> writersForFormat = ImageIO.getImageWritersByFormatName(format);

        if ((writersForFormat != null) && writersForFormat.hasNext()) {
            final ImageWriter writer = writersForFormat.next();
            try {
                writer.setOutput(outputStream);

                if (ImageFormats.isJpeg(format)) {
                    final ImageWriteParam param = writer.getDefaultWriteParam();
                    param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                    param.setCompressionQuality(quality);
                    writer.write(null, new IIOImage(image, null, null), param);
                } else {
                    writer.write(image);
                }
            } finally {
                writer.dispose();
            }
        } else {
            throw new IOException("no ImageIO writers exist for the '" + format + "' format");
        }
    }

    /**
     * Writes a {@link BufferedImage} to the specified {@link OutputStream} using ImageJ's {@link TiffEncoder}.
     */
    public static void writeTiffImage(final BufferedImage bufferedImage,
                                      final OutputStream outputStream)
            throws IOException {
        final ImagePlus ip = new ImagePlus("", bufferedImage);
        final FileInfo fileInfo = ip.getFileInfo();
        final TiffEncoder tiffEncoder = new TiffEncoder(fileInfo);
        tiffEncoder.write(outputStream);
    }

    public static File prepareFileForWrite(final String path)
            throws IOException {

        final File file = new File(path).getAbsoluteFile();

        final File parentDirectory = file.getParentFile();
        if ((parentDirectory != null) && (! parentDirectory.exists())) {
            if (! parentDirectory.mkdirs()) {
                // check for existence again in case another parallel process already created the directory
                if (! parentDirectory.exists()) {
                    throw new IOException("failed to create directory " + parentDirectory.getAbsolutePath());
                }
            }
        }

        return file;
    }

    private static PixelBuffer openWithImageJ(final String path)
            throws UnreadableImageException {
        try {
            final ImagePlus imagePlus = new Opener().openImage(path);
            return imagePlus == null ? null : PixelBuffer.fromImageProcessor(imagePlus.getProcessor());
        } catch (final PixelAccessException e) {
            throw new UnreadableImageException(path, "pixels are not accessible", e);
        } catch (final RuntimeException e) {
            throw new UnreadableImageException(path, "ImageJ failed to open file", e);
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(ImageIOCodec.class);
}
