package org.janelia.mosaic;

import java.awt.Rectangle;
import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.janelia.mosaic.color.ColorRGB;
import org.janelia.mosaic.image.ImageIOCodec;
import org.janelia.mosaic.image.PixelBuffer;
import org.janelia.mosaic.image.UnreadableImageException;
import org.janelia.mosaic.progress.LoggingProgressReporter;
import org.janelia.mosaic.progress.ProgressReporter;
import org.janelia.mosaic.tile.RegionColorSummarizer;
import org.janelia.mosaic.tile.TileGrid;
import org.janelia.mosaic.tile.ZeroAreaRegionException;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Tests the {@link MosaicRenderer} class.
 */
public class MosaicRendererTest {

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    private File directory;
    private PixelBuffer master;
    private String masterPath;

    @Before
    public void setup() throws Exception {
        directory = temporaryFolder.getRoot();
        master = MosaicTestImages.gradient(100, 80);
        masterPath = MosaicTestImages.writePng(directory, "master.png", master);
    }

    @Test
    public void testFlatColor() throws Exception {

        final String outputPath = new File(directory, "out/flat.png").getAbsolutePath();
        final MosaicJob job = new MosaicJob(masterPath, null, outputPath, MosaicStrategy.FLAT_COLOR);
        job.setTileWidth(10);
        job.setTileHeight(10);

        final MosaicResult result = new MosaicRenderer().render(job);
        final PixelBuffer output = result.getOutput();

        final TileGrid grid = new TileGrid(100, 80, 10, 10);
        for (int row = 0; row < grid.getRows(); row++) {
            for (int column = 0; column < grid.getColumns(); column++) {
                final Rectangle r = grid.getTileRectangle(column, row);
                final ColorRGB expected = RegionColorSummarizer.averageColor(master, r);
                Assert.assertEquals("invalid color for tile (" + column + "," + row + ")",
                                    expected, output.getColor(r.x + r.width - 1, r.y + r.height - 1));
            }
        }

        final MosaicStatistics statistics = result.getStatistics();
        Assert.assertEquals("invalid columns", 10, statistics.getColumns());
        Assert.assertEquals("invalid rows", 8, statistics.getRows());
        Assert.assertEquals("invalid tiles processed", 80, statistics.getTilesProcessed());
        Assert.assertEquals("flat color should not load candidates", 0, statistics.getCandidatesTotal());

        final PixelBuffer written = ImageIOCodec.INSTANCE.decode(outputPath);
        Assert.assertTrue("written output should match result", output.hasSamePixels(written));
    }

    @Test
    public void testUnreadableCandidatesUseFlatColor() throws Exception {

        final List<String> candidatePaths = Arrays.asList(
                MosaicTestImages.writeGarbage(directory, "bad1.jpg"),
                new File(directory, "missing.png").getAbsolutePath());

        final MosaicJob photoJob = new MosaicJob(masterPath, candidatePaths, null, MosaicStrategy.PHOTO_MATCH);
        photoJob.setTileWidth(10);
        photoJob.setTileHeight(10);
        final MosaicResult photoResult = new MosaicRenderer().render(photoJob);

        final MosaicJob flatJob = new MosaicJob(masterPath, null, null, MosaicStrategy.FLAT_COLOR);
        flatJob.setTileWidth(10);
        flatJob.setTileHeight(10);
        final MosaicResult flatResult = new MosaicRenderer().render(flatJob);

        Assert.assertTrue("photo match output should equal flat color output",
                          flatResult.getOutput().hasSamePixels(photoResult.getOutput()));

        final MosaicStatistics statistics = photoResult.getStatistics();
        Assert.assertEquals("invalid skipped count", 2, statistics.getCandidatesSkipped());
        Assert.assertEquals("invalid loaded count", 0, statistics.getCandidatesLoaded());
        Assert.assertEquals("every tile should be a fallback", 80, statistics.getFallbackTileCount());
        Assert.assertNull("output should not be written without a path", photoResult.getOutputPath());
    }

    @Test(expected = IllegalStateException.class)
    public void testUnreadableCandidatesWithoutFallback() throws Exception {
        final MosaicJob job = new MosaicJob(masterPath,
                                            Arrays.asList(MosaicTestImages.writeGarbage(directory, "bad.png")),
                                            null,
                                            MosaicStrategy.PHOTO_MATCH);
        job.setFlatColorFallback(false);
        new MosaicRenderer().render(job);
    }

    @Test
    public void testHueOverlayIsIdempotent() throws Exception {

        final File poolDirectory = temporaryFolder.newFolder("pool");
        for (int i = 0; i < 6; i++) {
            MosaicTestImages.writePng(poolDirectory, "c" + i + ".png", MosaicTestImages.gradient(20 + i, 15 + i));
        }

        final List<PixelBuffer> outputs = new ArrayList<>();
        final List<MosaicStatistics> statisticsList = new ArrayList<>();
        for (final int threads : new int[] { 1, 4 }) {
            final MosaicJob job = new MosaicJob(masterPath,
                                                Arrays.asList(poolDirectory.getAbsolutePath()),
                                                null,
                                                MosaicStrategy.HUE_OVERLAY);
            job.setTileWidth(15);
            job.setTileHeight(20);
            job.setRandomSeed(1234L);
            job.setNumberOfThreads(threads);
            final MosaicResult result = new MosaicRenderer().render(job);
            outputs.add(result.getOutput());
            statisticsList.add(result.getStatistics());
        }

        Assert.assertTrue("same seed should produce identical output",
                          outputs.get(0).hasSamePixels(outputs.get(1)));
        Assert.assertEquals("invalid seed in statistics", 1234L, statisticsList.get(0).getRandomSeed());
        Assert.assertEquals("invalid loaded count", 6, statisticsList.get(0).getCandidatesLoaded());
        Assert.assertEquals("invalid usage counts",
                            statisticsList.get(0).getCandidateUsageCounts(),
                            statisticsList.get(1).getCandidateUsageCounts());
    }

    @Test
    public void testPhotoMatchStatistics() throws Exception {

        final File poolDirectory = temporaryFolder.newFolder("pool");
        final ColorRGB[] colors = { ColorRGB.BLACK, ColorRGB.WHITE, new ColorRGB(128, 128, 0) };
        for (int i = 0; i < colors.length; i++) {
            MosaicTestImages.writeSolidPng(poolDirectory, "c" + i + ".png", colors[i]);
        }

        final String outputPath = new File(directory, "photo.jpg").getAbsolutePath();
        final String thumbnailPath = new File(directory, "photo_thumb.jpg").getAbsolutePath();

        final MosaicJob job = new MosaicJob(masterPath,
                                            Arrays.asList(poolDirectory.getAbsolutePath()),
                                            outputPath,
                                            MosaicStrategy.PHOTO_MATCH);
        job.setTileWidth(20);
        job.setTileHeight(20);
        job.setThumbnailPath(thumbnailPath);
        job.setThumbnailMaxWidth(50);
        job.setThumbnailMaxHeight(50);

        final LoggingProgressReporter progressReporter = new LoggingProgressReporter();
        final MosaicResult result =
                new MosaicRenderer(ImageIOCodec.INSTANCE, progressReporter, null).render(job);

        final MosaicStatistics statistics = result.getStatistics();
        Assert.assertEquals("invalid tiles processed", 20, statistics.getTilesProcessed());
        Assert.assertEquals("all candidates should be used", 3, statistics.getUniqueCandidatesUsed());
        Assert.assertNotNull("most used candidate should be reported", statistics.getMostUsedCandidatePath());

        int totalUsage = 0;
        for (final Integer count : statistics.getCandidateUsageCounts().values()) {
            totalUsage += count;
        }
        Assert.assertEquals("every tile should use a candidate", 20, totalUsage);
        Assert.assertNotNull("average distance should be reported", statistics.getAverageColorDistance());

        final MosaicStatistics parsed = MosaicStatistics.fromJson(statistics.toJson());
        Assert.assertEquals("json should preserve usage counts",
                            statistics.getCandidateUsageCounts(), parsed.getCandidateUsageCounts());

        final PixelBuffer thumbnail = ImageIOCodec.INSTANCE.decode(result.getThumbnailPath());
        Assert.assertEquals("invalid thumbnail width", 50, thumbnail.getWidth());
        Assert.assertEquals("invalid thumbnail height", 40, thumbnail.getHeight());
        Assert.assertTrue("output file should exist", new File(outputPath).isFile());
    }

    @Test
    public void testThumbnailIsNeverScaledUp() {
        final PixelBuffer small = MosaicTestImages.gradient(30, 20);
        Assert.assertSame("small image should not be scaled",
                          small, MosaicRenderer.createThumbnail(small, 800, 600));
        final PixelBuffer scaled = MosaicRenderer.createThumbnail(MosaicTestImages.gradient(1600, 900), 800, 600);
        Assert.assertEquals("invalid scaled width", 800, scaled.getWidth());
        Assert.assertEquals("invalid scaled height", 450, scaled.getHeight());
    }

    @Test
    public void testProgressNeverExceedsMaximum() throws Exception {

        final PixelBuffer largeMaster = MosaicTestImages.gradient(400, 400);
        final String largeMasterPath = MosaicTestImages.writePng(directory, "large_master.png", largeMaster);

        final File poolDirectory = temporaryFolder.newFolder("pool");
        for (int i = 0; i < 40; i++) {
            MosaicTestImages.writePng(poolDirectory, "c" + i + ".png", MosaicTestImages.gradient(12 + i, 10 + i));
        }

        final MosaicJob job = new MosaicJob(largeMasterPath,
                                            Arrays.asList(poolDirectory.getAbsolutePath()),
                                            null,
                                            MosaicStrategy.PHOTO_MATCH);
        job.setTileWidth(10);
        job.setTileHeight(10);
        job.setNumberOfThreads(2);

        final StepRecordingReporter progressReporter = new StepRecordingReporter();
        new MosaicRenderer(ImageIOCodec.INSTANCE, progressReporter, null).render(job);

        Assert.assertEquals("count should never exceed maximum, largest overrun was " +
                            progressReporter.largestOverrun,
                            0, progressReporter.largestOverrun);
        Assert.assertEquals("invalid step maximums",
                            Arrays.asList(40 + 1600, 1600), progressReporter.maximums);
        Assert.assertEquals("every step should be completed",
                            progressReporter.maximums, progressReporter.finalCounts);
    }

    @Test(expected = UnreadableImageException.class)
    public void testUnreadableMaster() throws Exception {
        final String badMaster = MosaicTestImages.writeGarbage(directory, "master.jpg");
        new MosaicRenderer().render(new MosaicJob(badMaster, null, null, MosaicStrategy.FLAT_COLOR));
    }

    @Test(expected = ZeroAreaRegionException.class)
    public void testInvalidTileSize() throws Exception {
        final MosaicJob job = new MosaicJob(masterPath, null, null, MosaicStrategy.FLAT_COLOR);
        job.setTileHeight(-3);
        new MosaicRenderer().render(job);
    }

    private static class StepRecordingReporter
            implements ProgressReporter {

        private final List<Integer> maximums = new ArrayList<>();
        private final List<Integer> finalCounts = new ArrayList<>();
        private int largestOverrun = 0;

        @Override
        public synchronized void setMaximum(final int maximum) {
            maximums.add(maximum);
            finalCounts.add(0);
        }

        @Override
        public synchronized void increment() {
            final int step = finalCounts.size() - 1;
            final int count = step < 0 ? 1 : finalCounts.get(step) + 1;
            final int maximum = step < 0 ? 0 : maximums.get(step);
            if (step >= 0) {
                finalCounts.set(step, count);
            }
            largestOverrun = Math.max(largestOverrun, count - maximum);
        }

        @Override
        public void updateStatus(final String status) {
        }
    }

}
