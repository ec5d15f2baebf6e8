package org.janelia.mosaic.tile;

import java.awt.Rectangle;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.janelia.mosaic.MosaicCancellation;
import org.janelia.mosaic.color.ColorRGB;
import org.janelia.mosaic.image.PixelBuffer;
import org.janelia.mosaic.progress.NullProgressReporter;
import org.janelia.mosaic.progress.ProgressReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives the target (average) color for every tile of a master image.
 * Each tile covers a disjoint rectangle, so rows of tiles are summarized in parallel
 * when more than one thread is requested.
 *
 * Pixels are read from an already decoded {@link PixelBuffer}, so pixel layout problems
 * surface (as {@link org.janelia.mosaic.image.PixelAccessException}) when the master is decoded,
 * never while tiles are summarized.
 */
public class TileColorExtractor {

    private final int numberOfThreads;
    private final ProgressReporter progressReporter;
    private final MosaicCancellation cancellation;

    public TileColorExtractor(final int numberOfThreads,
                              final ProgressReporter progressReporter,
                              final MosaicCancellation cancellation) {
        this.numberOfThreads = Math.max(1, numberOfThreads);
        this.progressReporter = progressReporter == null ? NullProgressReporter.INSTANCE : progressReporter;
        this.cancellation = cancellation == null ? new MosaicCancellation() : cancellation;
    }

    /**
     * Single threaded convenience method.
     *
     * @return target colors indexed by [column][row].
     */
    public static ColorRGB[][] extractTileColors(final PixelBuffer master,
                                                 final int tileWidth,
                                                 final int tileHeight)
            throws IllegalArgumentException {
        final TileColorExtractor extractor = new TileColorExtractor(1, null, null);
        return extractor.extract(master,
                                 new TileGrid(master.getWidth(), master.getHeight(), tileWidth, tileHeight));
    }

    /**
     * @return tiles for the specified grid and colors in row-major order.
     */
    public static List<Tile> toTiles(final TileGrid grid,
                                     final ColorRGB[][] tileColors) {
        final List<Tile> tiles = new ArrayList<>(grid.getTileCount());
        for (int row = 0; row < grid.getRows(); row++) {
            for (int column = 0; column < grid.getColumns(); column++) {
                tiles.add(new Tile(column, row, grid.getTileRectangle(column, row), tileColors[column][row]));
            }
        }
        return tiles;
    }

    /**
     * @return target colors indexed by [column][row].
     *
     * @throws IllegalArgumentException
     *   if the grid does not match the master image dimensions.
     *
     * @throws CancellationException
     *   if the job is cancelled before all tiles are processed.
     */
    public ColorRGB[][] extract(final PixelBuffer master,
                                final TileGrid grid)
            throws IllegalArgumentException, CancellationException {

        if ((master.getWidth() != grid.getMasterWidth()) || (master.getHeight() != grid.getMasterHeight())) {
            throw new IllegalArgumentException(grid + " does not match " + master);
        }

        LOG.info("extract: entry, {}, numberOfThreads={}", grid, numberOfThreads);

        final ColorRGB[][] tileColors = new ColorRGB[grid.getColumns()][grid.getRows()];

        progressReporter.updateStatus("Calculating average color of tiles");
        progressReporter.setMaximum(grid.getTileCount());

        if ((numberOfThreads == 1) || (grid.getRows() == 1)) {
            for (int row = 0; row < grid.getRows(); row++) {
                extractRow(master, grid, row, tileColors);
            }
        } else {
            extractRowsInParallel(master, grid, tileColors);
        }

        LOG.info("extract: exit, summarized {} tiles", grid.getTileCount());

        return tileColors;
    }

    private void extractRowsInParallel(final PixelBuffer master,
                                       final TileGrid grid,
                                       final ColorRGB[][] tileColors)
            throws CancellationException {

        final ExecutorService executorService =
                Executors.newFixedThreadPool(Math.min(numberOfThreads, grid.getRows()));

        try {
            final List<Future<?>> futures = new ArrayList<>(grid.getRows());
            for (int row = 0; row < grid.getRows(); row++) {
                final int finalRow = row;
                futures.add(executorService.submit(() -> extractRow(master, grid, finalRow, tileColors)));
            }

            for (final Future<?> future : futures) {
                waitFor(future);
            }
        } finally {
            executorService.shutdownNow();
        }
    }

    private void extractRow(final PixelBuffer master,
                            final TileGrid grid,
                            final int row,
                            final ColorRGB[][] tileColors)
            throws CancellationException {

        for (int column = 0; column < grid.getColumns(); column++) {

            cancellation.throwIfCancelled("tile (" + column + ", " + row + ")");

            final Rectangle tileRectangle = grid.getTileRectangle(column, row);
            tileColors[column][row] = RegionColorSummarizer.averageColor(master, tileRectangle);

            progressReporter.increment();
        }
    }

    private static void waitFor(final Future<?> future)
            throws CancellationException {
        try {
            future.get();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("interrupted while waiting for tile colors");
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("failed to extract tile colors", cause);
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(TileColorExtractor.class);
}
