package org.janelia.mosaic.client;

import com.beust.jcommander.Parameter;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import org.janelia.mosaic.MosaicJob;
import org.janelia.mosaic.MosaicRenderer;
import org.janelia.mosaic.MosaicResult;
import org.janelia.mosaic.MosaicStrategy;
import org.janelia.mosaic.image.ImageIOCodec;
import org.janelia.mosaic.progress.LoggingProgressReporter;
import org.janelia.mosaic.client.parameter.CommandLineParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for building a photomosaic from a master image and a set of candidate images.
 *
 * Candidate paths may be image files or directories (whose supported image files are all used).
 * Job settings can also be loaded from a json file, with explicit command line options taking precedence.
 */
public class MosaicClient {

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--master",
                description = "Path of the master image to rebuild as a mosaic")
        public String masterImagePath;

        @Parameter(
                names = "--candidates",
                description = "Candidate image files or directories containing candidate images",
                variableArity = true)
        public List<String> candidatePaths;

        @Parameter(
                names = "--out",
                description = "Path for the mosaic image (format is derived from the extension unless --format is specified)")
        public String outputPath;

        @Parameter(
                names = "--tileWidth",
                description = "Width of each mosaic tile in pixels (default is 40)")
        public Integer tileWidth;

        @Parameter(
                names = "--tileHeight",
                description = "Height of each mosaic tile in pixels (default is 40)")
        public Integer tileHeight;

        @Parameter(
                names = "--strategy",
                description = "Tile fill strategy (default is PHOTO_MATCH)")
        public MosaicStrategy strategy;

        @Parameter(
                names = "--alpha",
                description = "Alpha (0-255) for the target color overlay drawn on candidate images (default is 210)")
        public Integer overlayAlpha;

        @Parameter(
                names = "--seed",
                description = "Random seed for candidate picks.  Omit to use a generated seed (logged and reported).")
        public Long randomSeed;

        @Parameter(
                names = "--threads",
                description = "Number of threads for loading candidates and extracting tile colors " +
                              "(default is the number of available processors)")
        public Integer numberOfThreads;

        @Parameter(
                names = "--format",
                description = "Format for the mosaic image (e.g. jpg, png, tif)")
        public String outputFormat;

        @Parameter(
                names = "--quality",
                description = "Quality (0.0-1.0) for jpg output (default is 0.85)")
        public Float outputQuality;

        @Parameter(
                names = "--thumbnail",
                description = "If specified, also write a thumbnail (at most 800x600) of the mosaic to this path")
        public String thumbnailPath;

        @Parameter(
                names = "--noFallback",
                description = "Fail instead of filling tiles with their flat target color when no candidates load",
                arity = 0)
        public boolean noFallback = false;

        @Parameter(
                names = "--jobJson",
                description = "Json file containing base job settings")
        public String jobJson;

        @Parameter(
                names = "--resultJson",
                description = "If specified, write job statistics to this json file")
        public String resultJson;

        /**
         * @return job built from the json file (if specified) overridden by any explicit command line options.
         */
        public MosaicJob buildJob() throws IllegalArgumentException {

            final MosaicJob job = jobJson == null ? new MosaicJob() : MosaicJob.parseJson(new File(jobJson));

            if (masterImagePath != null) {
                job.setMasterImagePath(masterImagePath);
            }
            if (candidatePaths != null) {
                job.setCandidatePaths(new ArrayList<>(candidatePaths));
            }
            if (outputPath != null) {
                job.setOutputPath(outputPath);
            }
            if (tileWidth != null) {
                job.setTileWidth(tileWidth);
            }
            if (tileHeight != null) {
                job.setTileHeight(tileHeight);
            }
            if (strategy != null) {
                job.setStrategy(strategy);
            }
            if (overlayAlpha != null) {
                job.setOverlayAlpha(overlayAlpha);
            }
            if (randomSeed != null) {
                job.setRandomSeed(randomSeed);
            }
            if (numberOfThreads != null) {
                job.setNumberOfThreads(numberOfThreads);
            }
            if (outputFormat != null) {
                job.setOutputFormat(outputFormat);
            }
            if (outputQuality != null) {
                job.setOutputQuality(outputQuality);
            }
            if (thumbnailPath != null) {
                job.setThumbnailPath(thumbnailPath);
            }
            if (noFallback) {
                job.setFlatColorFallback(false);
            }

            if (job.getOutputPath() == null) {
                throw new IllegalArgumentException("output path must be specified with --out or in the job json");
            }

            job.validate();

            return job;
        }
    }

    /**
     * @param  args  see {@link Parameters} for command line argument details.
     */
    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args);

                LOG.info("runClient: entry, parameters={}", parameters);

                final MosaicClient client = new MosaicClient(parameters);
                client.run();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;

    public MosaicClient(final Parameters parameters) {
        this.parameters = parameters;
    }

    public MosaicResult run() throws IllegalArgumentException, IOException {

        final MosaicJob job = parameters.buildJob();
        final MosaicRenderer renderer = new MosaicRenderer(ImageIOCodec.INSTANCE,
                                                           new LoggingProgressReporter(),
                                                           null);
        final MosaicResult result = renderer.render(job);

        if (parameters.resultJson != null) {
            final Path resultPath = Paths.get(parameters.resultJson).toAbsolutePath();
            final Path parentPath = resultPath.getParent();
            if (parentPath != null) {
                Files.createDirectories(parentPath);
            }
            Files.write(resultPath, result.getStatistics().toJson().getBytes(StandardCharsets.UTF_8));
            LOG.info("run: wrote statistics to {}", resultPath);
        }

        LOG.info("run: exit, wrote {}", result);

        return result;
    }

    private static final Logger LOG = LoggerFactory.getLogger(MosaicClient.class);
}
