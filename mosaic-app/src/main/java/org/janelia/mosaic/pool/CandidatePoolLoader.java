package org.janelia.mosaic.pool;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.janelia.mosaic.MosaicCancellation;
import org.janelia.mosaic.color.ColorRGB;
import org.janelia.mosaic.image.ImageCodec;
import org.janelia.mosaic.image.PixelAccessException;
import org.janelia.mosaic.image.PixelBuffer;
import org.janelia.mosaic.image.UnreadableImageException;
import org.janelia.mosaic.progress.NullProgressReporter;
import org.janelia.mosaic.progress.ProgressReporter;
import org.janelia.mosaic.tile.RegionColorSummarizer;
import org.janelia.mosaic.tile.ZeroAreaRegionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes and summarizes candidate images in parallel.
 * Candidates that cannot be decoded or summarized are skipped (and counted) without failing the load.
 */
public class CandidatePoolLoader {

    private final ImageCodec imageCodec;
    private final int numberOfThreads;
    private final ProgressReporter progressReporter;
    private final MosaicCancellation cancellation;

    public CandidatePoolLoader(final ImageCodec imageCodec,
                               final int numberOfThreads,
                               final ProgressReporter progressReporter,
                               final MosaicCancellation cancellation) {
        this.imageCodec = imageCodec;
        this.numberOfThreads = Math.max(1, numberOfThreads);
        this.progressReporter = progressReporter == null ? NullProgressReporter.INSTANCE : progressReporter;
        this.cancellation = cancellation == null ? new MosaicCancellation() : cancellation;
    }

    /**
     * @param  paths  image paths to load.
     *
     * @return pool of successfully loaded candidates (empty, never null, if nothing could be loaded).
     *
     * @throws CancellationException
     *   if the job is cancelled before all paths are processed.
     */
    public CandidatePool loadPool(final List<String> paths)
            throws CancellationException {

        if ((paths == null) || paths.isEmpty()) {
            LOG.info("loadPool: no candidate paths to load");
            return CandidatePool.empty();
        }

        LOG.info("loadPool: entry, loading {} candidates with {} threads", paths.size(), numberOfThreads);

        progressReporter.updateStatus("Loading candidate images");
        progressReporter.setMaximum(paths.size());

        final Queue<CandidateImage> loadedCandidates = new ConcurrentLinkedQueue<>();
        final AtomicInteger completedCount = new AtomicInteger(0);
        final AtomicInteger skippedCount = new AtomicInteger(0);

        final ExecutorService executorService =
                Executors.newFixedThreadPool(Math.min(numberOfThreads, paths.size()));

        try {
            final List<Future<?>> futures = new ArrayList<>(paths.size());
            for (int i = 0; i < paths.size(); i++) {
                final int sourceIndex = i;
                final String path = paths.get(i);
                futures.add(executorService.submit(
                        () -> loadCandidate(sourceIndex, path, loadedCandidates, completedCount, skippedCount)));
            }

            for (final Future<?> future : futures) {
                waitFor(future);
            }
        } finally {
            executorService.shutdownNow();
        }

        final CandidatePool pool = new CandidatePool(loadedCandidates, completedCount.get(), skippedCount.get());

        progressReporter.updateStatus("Skipped " + skippedCount.get() + " of " + paths.size() + " candidates");

        LOG.info("loadPool: exit, returning {}", pool);

        return pool;
    }

    /**
     * @return summary of the image at the specified path.
     *
     * @throws UnreadableImageException
     *   if the image cannot be decoded.
     */
    public CandidateImage summarize(final int sourceIndex,
                                    final String path)
            throws UnreadableImageException {
        final PixelBuffer buffer = imageCodec.decode(path);
        final ColorRGB averageColor = RegionColorSummarizer.averageColor(buffer);
        return new CandidateImage(path, averageColor, sourceIndex);
    }

    private void loadCandidate(final int sourceIndex,
                               final String path,
                               final Queue<CandidateImage> loadedCandidates,
                               final AtomicInteger completedCount,
                               final AtomicInteger skippedCount)
            throws CancellationException {

        cancellation.throwIfCancelled(path);

        try {
            loadedCandidates.add(summarize(sourceIndex, path));
        } catch (final UnreadableImageException | PixelAccessException | ZeroAreaRegionException e) {
            skippedCount.incrementAndGet();
            LOG.warn("loadCandidate: skipping {}, {}", path, e.getMessage());
        } finally {
            completedCount.incrementAndGet();
            progressReporter.increment();
        }
    }

    private static void waitFor(final Future<?> future)
            throws CancellationException {
        try {
            future.get();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("interrupted while waiting for candidates to load");
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("failed to load candidates", cause);
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(CandidatePoolLoader.class);
}
