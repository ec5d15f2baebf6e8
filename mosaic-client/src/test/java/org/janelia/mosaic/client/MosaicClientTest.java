package org.janelia.mosaic.client;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;

import org.janelia.mosaic.MosaicJob;
import org.janelia.mosaic.MosaicResult;
import org.janelia.mosaic.MosaicStatistics;
import org.janelia.mosaic.MosaicStrategy;
import org.janelia.mosaic.color.ColorRGB;
import org.janelia.mosaic.image.ImageFormats;
import org.janelia.mosaic.image.ImageIOCodec;
import org.janelia.mosaic.image.PixelBuffer;
import org.janelia.mosaic.client.parameter.CommandLineParameters;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Tests the {@link MosaicClient} class.
 */
public class MosaicClientTest {

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    @Test
    public void testParameterParsing() throws Exception {
        CommandLineParameters.parseHelp(new MosaicClient.Parameters());
    }

    @Test
    public void testBuildJob() throws Exception {

        final MosaicClient.Parameters parameters = new MosaicClient.Parameters();
        final boolean parsed = parameters.parse(new String[] {
                "--master", "/images/master.jpg",
                "--candidates", "/images/pool", "/images/extra.png",
                "--out", "/images/mosaic.png",
                "--tileWidth", "15",
                "--strategy", "HUE_OVERLAY",
                "--alpha", "128",
                "--seed", "99",
                "--noFallback"
        }, MosaicClient.class, false);

        Assert.assertTrue("arguments should parse", parsed);

        final MosaicJob job = parameters.buildJob();
        Assert.assertEquals("invalid master", "/images/master.jpg", job.getMasterImagePath());
        Assert.assertEquals("invalid candidates",
                            Arrays.asList("/images/pool", "/images/extra.png"), job.getCandidatePaths());
        Assert.assertEquals("invalid tile width", 15, job.getTileWidth());
        Assert.assertEquals("tile height should use default", 40, job.getTileHeight());
        Assert.assertEquals("invalid strategy", MosaicStrategy.HUE_OVERLAY, job.getStrategy());
        Assert.assertEquals("invalid alpha", 128, job.getOverlayAlpha());
        Assert.assertEquals("invalid seed", Long.valueOf(99), job.getRandomSeed());
        Assert.assertEquals("invalid format", ImageFormats.PNG_FORMAT, job.getOutputFormat());
        Assert.assertFalse("fallback should be disabled", job.isFlatColorFallback());
    }

    @Test
    public void testJobJsonWithOverrides() throws Exception {

        final File jsonFile = temporaryFolder.newFile("job.json");
        final String json = "{ \"masterImagePath\": \"/a/master.png\", \"outputPath\": \"/a/out.jpg\", " +
                            "\"tileWidth\": 12, \"tileHeight\": 12, \"strategy\": \"FLAT_COLOR\" }";
        Files.write(jsonFile.toPath(), json.getBytes(StandardCharsets.UTF_8));

        final MosaicClient.Parameters parameters = new MosaicClient.Parameters();
        parameters.parse(new String[] { "--jobJson", jsonFile.getAbsolutePath(), "--tileHeight", "30" },
                         MosaicClient.class, false);

        final MosaicJob job = parameters.buildJob();
        Assert.assertEquals("json tile width should be kept", 12, job.getTileWidth());
        Assert.assertEquals("command line tile height should override json", 30, job.getTileHeight());
        Assert.assertEquals("invalid strategy", MosaicStrategy.FLAT_COLOR, job.getStrategy());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingOutput() {
        final MosaicClient.Parameters parameters = new MosaicClient.Parameters();
        parameters.parse(new String[] { "--master", "/images/master.jpg" }, MosaicClient.class, false);
        parameters.buildJob();
    }

    @Test
    public void testRun() throws Exception {

        final File directory = temporaryFolder.getRoot();
        final File poolDirectory = temporaryFolder.newFolder("pool");

        final String masterPath = new File(directory, "master.png").getAbsolutePath();
        final int[] masterPixels = new int[60 * 45];
        for (int i = 0; i < masterPixels.length; i++) {
            masterPixels[i] = (i % 60) < 30 ? 0xff0000 : 0x0000ff;
        }
        ImageIOCodec.INSTANCE.encode(new PixelBuffer(60, 45, masterPixels), masterPath, ImageFormats.PNG_FORMAT, 1.0f);

        final ColorRGB[] colors = { new ColorRGB(250, 10, 10), new ColorRGB(10, 10, 250) };
        for (int i = 0; i < colors.length; i++) {
            ImageIOCodec.INSTANCE.encode(PixelBuffer.filled(10, 10, colors[i]),
                                         new File(poolDirectory, "c" + i + ".png").getAbsolutePath(),
                                         ImageFormats.PNG_FORMAT,
                                         1.0f);
        }

        final String outputPath = new File(directory, "result/mosaic.png").getAbsolutePath();
        final String resultJsonPath = new File(directory, "result/statistics.json").getAbsolutePath();

        final MosaicClient.Parameters parameters = new MosaicClient.Parameters();
        parameters.parse(new String[] {
                "--master", masterPath,
                "--candidates", poolDirectory.getAbsolutePath(),
                "--out", outputPath,
                "--tileWidth", "15",
                "--tileHeight", "15",
                "--threads", "2",
                "--resultJson", resultJsonPath
        }, MosaicClient.class, false);

        final MosaicResult result = new MosaicClient(parameters).run();

        final PixelBuffer written = ImageIOCodec.INSTANCE.decode(outputPath);
        Assert.assertEquals("invalid output width", 60, written.getWidth());
        Assert.assertEquals("invalid output height", 45, written.getHeight());
        Assert.assertTrue("written output should match result", result.getOutput().hasSamePixels(written));

        final String statisticsJson = new String(Files.readAllBytes(new File(resultJsonPath).toPath()),
                                                 StandardCharsets.UTF_8);
        final MosaicStatistics statistics = MosaicStatistics.fromJson(statisticsJson);
        Assert.assertEquals("invalid tiles processed", 12, statistics.getTilesProcessed());
        Assert.assertEquals("invalid loaded count", 2, statistics.getCandidatesLoaded());
        Assert.assertEquals("invalid unique count", 2, statistics.getUniqueCandidatesUsed());
    }

    @Test
    public void testRunnerExitCode() {
        final ClientRunner failingRunner = new ClientRunner(new String[0]) {
            @Override
            public void runClient(final String[] args) {
                throw new IllegalStateException("simulated failure");
            }
        };
        Assert.assertEquals("failed client should return error exit code", 1, failingRunner.runAndGetExitCode());

        final ClientRunner successfulRunner = new ClientRunner(new String[0]) {
            @Override
            public void runClient(final String[] args) {
            }
        };
        Assert.assertEquals("successful client should return zero exit code", 0, successfulRunner.runAndGetExitCode());
    }

}
