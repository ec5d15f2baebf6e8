package org.janelia.mosaic;

import ij.process.ColorProcessor;
import ij.process.ImageProcessor;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.janelia.mosaic.color.ColorRGB;
import org.janelia.mosaic.image.ImageCodec;
import org.janelia.mosaic.image.ImageFormats;
import org.janelia.mosaic.image.ImageIOCodec;
import org.janelia.mosaic.image.PixelBuffer;
import org.janelia.mosaic.image.RetryingImageCodec;
import org.janelia.mosaic.image.UnreadableImageException;
import org.janelia.mosaic.pool.CandidateImageCache;
import org.janelia.mosaic.pool.CandidatePathCollector;
import org.janelia.mosaic.pool.CandidatePool;
import org.janelia.mosaic.pool.CandidatePoolLoader;
import org.janelia.mosaic.progress.NullProgressReporter;
import org.janelia.mosaic.progress.ProgressReporter;
import org.janelia.mosaic.progress.QueuedProgressReporter;
import org.janelia.mosaic.progress.SharedStepProgressReporter;
import org.janelia.mosaic.tile.TileColorExtractor;
import org.janelia.mosaic.tile.TileGrid;
import org.janelia.mosaic.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a complete mosaic job:
 * the master image is decoded and summarized per tile while the candidate pool loads,
 * then tiles are composited and the result (plus an optional thumbnail) is written.
 * Progress is reported in two steps: loading plus summarizing (candidate files + tiles), then compositing (tiles).
 */
public class MosaicRenderer {

    private final ImageCodec imageCodec;
    private final ProgressReporter progressReporter;
    private final MosaicCancellation cancellation;

    public MosaicRenderer() {
        this(ImageIOCodec.INSTANCE, NullProgressReporter.INSTANCE, new MosaicCancellation());
    }

    /**
     * @param  imageCodec        codec for reading and writing images (wrapped with decode retries per job).
     * @param  progressReporter  receives progress events through a non-blocking queue.
     * @param  cancellation      checked before each candidate file and each tile.
     */
    public MosaicRenderer(final ImageCodec imageCodec,
                          final ProgressReporter progressReporter,
                          final MosaicCancellation cancellation) {
        this.imageCodec = imageCodec == null ? ImageIOCodec.INSTANCE : imageCodec;
        this.progressReporter = progressReporter == null ? NullProgressReporter.INSTANCE : progressReporter;
        this.cancellation = cancellation == null ? new MosaicCancellation() : cancellation;
    }

    /**
     * Renders the job's mosaic and writes it (and its thumbnail) if output paths are specified.
     *
     * @throws IllegalArgumentException
     *   if the job is invalid.
     *
     * @throws UnreadableImageException
     *   if the master image cannot be decoded.
     *
     * @throws IllegalStateException
     *   if no candidates could be loaded for a candidate strategy and flat color fallback is disabled.
     *
     * @throws CancellationException
     *   if the job is cancelled.
     *
     * @throws IOException
     *   if the output cannot be written.
     */
    public MosaicResult render(final MosaicJob job)
            throws IllegalArgumentException, IllegalStateException, CancellationException, IOException {

        job.validate();

        final ProcessTimer timer = new ProcessTimer();
        final long randomSeed = job.getRandomSeed() == null ? new Random().nextLong() : job.getRandomSeed();

        LOG.info("render: entry, job={}, randomSeed={}", job, randomSeed);

        final ImageCodec codec = new RetryingImageCodec(imageCodec,
                                                        job.getMaxDecodeAttempts(),
                                                        job.getDecodeRetryBackoffMillis());

        final PixelBuffer master = codec.decode(job.getMasterImagePath());
        final TileGrid grid = new TileGrid(master.getWidth(), master.getHeight(),
                                           job.getTileWidth(), job.getTileHeight());

        LOG.info("render: decoded master {}, grid is {}", master, grid);

        final MosaicStrategy strategy = job.getStrategy();
        final List<String> candidatePaths = strategy.usesCandidates() ?
                                            CandidatePathCollector.collect(job.getCandidatePaths()) :
                                            Collections.emptyList();

        final OutputCanvas canvas;
        final CandidatePool pool;
        final TileColorExtractor extractor;
        final MosaicCompositor compositor;

        try (final QueuedProgressReporter queuedReporter = new QueuedProgressReporter(progressReporter)) {

            // pool loading and tile extraction run concurrently and count against one combined step
            queuedReporter.setMaximum(candidatePaths.size() + grid.getTileCount());
            final ProgressReporter sharedStepReporter = new SharedStepProgressReporter(queuedReporter);

            final CandidatePoolLoader loader = new CandidatePoolLoader(codec,
                                                                       job.getNumberOfThreads(),
                                                                       sharedStepReporter,
                                                                       cancellation);
            extractor = new TileColorExtractor(job.getNumberOfThreads(), sharedStepReporter, cancellation);

            final ExecutorService poolLoadingService = Executors.newSingleThreadExecutor();
            final ColorRGB[][] tileColors;
            try {
                final Future<CandidatePool> poolFuture = poolLoadingService.submit(() -> loader.loadPool(candidatePaths));
                tileColors = extractor.extract(master, grid);
                pool = waitForPool(poolFuture);
            } finally {
                poolLoadingService.shutdownNow();
            }

            final CandidateImageCache imageCache = new CandidateImageCache(codec, job.getMaxCachedCandidatePixels());
            compositor = new MosaicCompositor(strategy,
                                              job.getOverlayAlpha(),
                                              pool,
                                              imageCache,
                                              new Random(randomSeed),
                                              job.isFlatColorFallback(),
                                              queuedReporter,
                                              cancellation);
            canvas = compositor.compose(master, grid, tileColors);

            LOG.info("render: candidate image cache stats are {}", imageCache.getStats());
        }

        final PixelBuffer output = canvas.toPixelBuffer();

        String outputPath = null;
        if (job.getOutputPath() != null) {
            outputPath = job.getOutputPath();
            codec.encode(output, outputPath, job.getOutputFormat(), job.getOutputQuality());
        }

        String thumbnailPath = null;
        if (job.getThumbnailPath() != null) {
            thumbnailPath = job.getThumbnailPath();
            final PixelBuffer thumbnail = createThumbnail(output,
                                                          job.getThumbnailMaxWidth(),
                                                          job.getThumbnailMaxHeight());
            codec.encode(thumbnail,
                         thumbnailPath,
                         ImageFormats.deriveFormat(thumbnailPath, ImageFormats.JPEG_FORMAT),
                         job.getOutputQuality());
        }

        final MosaicStatistics statistics = new MosaicStatistics();
        statistics.setStrategy(strategy);
        statistics.setGridSize(grid.getColumns(), grid.getRows());
        statistics.setTilesProcessed(grid.getTileCount());
        statistics.setFallbackTileCount(compositor.getFallbackTileCount());
        statistics.setFailedDrawCount(compositor.getFailedDrawCount());
        statistics.setCandidateCounts(pool.getAttemptedCount(), pool.size(), pool.getSkippedCount());
        statistics.setCandidateUsageCounts(strategy == MosaicStrategy.PHOTO_MATCH ?
                                           pool.getUsageCounts() : compositor.getDrawCounts());
        statistics.setAverageColorDistance(compositor.getAverageMatchDistance());
        statistics.setRandomSeed(randomSeed);
        statistics.setElapsedMilliseconds(timer.getElapsedMilliseconds());

        LOG.info("render: exit, completed {} in {}", statistics, timer);

        return new MosaicResult(output, statistics, outputPath, thumbnailPath);
    }

    /**
     * @return copy of the source scaled to fit within the specified bounds (never scaled up).
     */
    public static PixelBuffer createThumbnail(final PixelBuffer source,
                                              final int maxWidth,
                                              final int maxHeight)
            throws IllegalArgumentException {

        if ((maxWidth < 1) || (maxHeight < 1)) {
            throw new IllegalArgumentException("thumbnail bounds " + maxWidth + "x" + maxHeight +
                                               " must be positive");
        }

        final double scale = Math.min(1.0, Math.min((double) maxWidth / source.getWidth(),
                                                    (double) maxHeight / source.getHeight()));
        final int width = Math.max(1, (int) Math.round(source.getWidth() * scale));
        final int height = Math.max(1, (int) Math.round(source.getHeight() * scale));

        if ((width == source.getWidth()) && (height == source.getHeight())) {
            return source;
        }

        final ColorProcessor colorProcessor = source.toColorProcessor();
        colorProcessor.setInterpolationMethod(ImageProcessor.BILINEAR);
        return PixelBuffer.fromImageProcessor(colorProcessor.resize(width, height, true));
    }

    private static CandidatePool waitForPool(final Future<CandidatePool> poolFuture)
            throws CancellationException {
        try {
            return poolFuture.get();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("interrupted while waiting for candidate pool to load");
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("failed to load candidate pool", cause);
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(MosaicRenderer.class);
}
