package org.janelia.mosaic;

import java.awt.Rectangle;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CancellationException;

import org.janelia.mosaic.color.ColorRGB;
import org.janelia.mosaic.image.PixelAccessException;
import org.janelia.mosaic.image.PixelBuffer;
import org.janelia.mosaic.image.UnreadableImageException;
import org.janelia.mosaic.pool.CandidateImage;
import org.janelia.mosaic.pool.CandidateImageCache;
import org.janelia.mosaic.pool.CandidatePool;
import org.janelia.mosaic.pool.MatchSelector;
import org.janelia.mosaic.progress.NullProgressReporter;
import org.janelia.mosaic.progress.ProgressReporter;
import org.janelia.mosaic.tile.TileGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fills every tile of an output canvas according to a {@link MosaicStrategy}.
 * Tiles are composited sequentially in row-major order so that match selection
 * and random picks are reproducible.
 */
public class MosaicCompositor {

    private final MosaicStrategy strategy;
    private final int overlayAlpha;
    private final CandidatePool pool;
    private final CandidateImageCache imageCache;
    private final Random random;
    private final boolean flatColorFallback;
    private final ProgressReporter progressReporter;
    private final MosaicCancellation cancellation;

    private final Map<String, Integer> drawCounts;
    private int fallbackTileCount;
    private int failedDrawCount;
    private int matchedTileCount;
    private double totalMatchDistance;

    public MosaicCompositor(final MosaicStrategy strategy,
                            final int overlayAlpha,
                            final CandidatePool pool,
                            final CandidateImageCache imageCache,
                            final Random random,
                            final boolean flatColorFallback,
                            final ProgressReporter progressReporter,
                            final MosaicCancellation cancellation)
            throws IllegalArgumentException {

        if (strategy == null) {
            throw new IllegalArgumentException("strategy must be specified");
        }
        if ((overlayAlpha < 0) || (overlayAlpha > 255)) {
            throw new IllegalArgumentException("overlayAlpha " + overlayAlpha + " must be between 0 and 255");
        }
        if (strategy.usesCandidates() && (imageCache == null)) {
            throw new IllegalArgumentException("imageCache must be specified for " + strategy + " strategy");
        }

        this.strategy = strategy;
        this.overlayAlpha = overlayAlpha;
        this.pool = pool == null ? CandidatePool.empty() : pool;
        this.imageCache = imageCache;
        this.random = random == null ? new Random() : random;
        this.flatColorFallback = flatColorFallback;
        this.progressReporter = progressReporter == null ? NullProgressReporter.INSTANCE : progressReporter;
        this.cancellation = cancellation == null ? new MosaicCancellation() : cancellation;

        this.drawCounts = new LinkedHashMap<>();
        this.fallbackTileCount = 0;
        this.failedDrawCount = 0;
        this.matchedTileCount = 0;
        this.totalMatchDistance = 0.0;
    }

    /**
     * @param  master      master image (copied, never modified).
     * @param  grid        tile grid for the master.
     * @param  tileColors  target colors indexed by [column][row].
     *
     * @return the composited canvas.
     *
     * @throws IllegalStateException
     *   if the strategy requires candidates, the pool is empty, and flat color fallback is disabled.
     *
     * @throws CancellationException
     *   if the job is cancelled before all tiles are drawn.
     */
    public OutputCanvas compose(final PixelBuffer master,
                                final TileGrid grid,
                                final ColorRGB[][] tileColors)
            throws IllegalStateException, CancellationException {

        if ((master.getWidth() != grid.getMasterWidth()) || (master.getHeight() != grid.getMasterHeight())) {
            throw new IllegalArgumentException("master " + master + " does not match grid " + grid);
        }

        if (strategy.usesCandidates() && pool.isEmpty()) {
            if (flatColorFallback) {
                LOG.warn("compose: candidate pool is empty, {} tiles will be filled without candidate images",
                         strategy);
            } else {
                throw new IllegalStateException("candidate pool is empty and flat color fallback is disabled for " +
                                                strategy + " strategy");
            }
        }

        LOG.info("compose: entry, strategy={}, grid={}, poolSize={}", strategy, grid, pool.size());

        final OutputCanvas canvas = new OutputCanvas(master);
        progressReporter.setMaximum(grid.getTileCount());
        progressReporter.updateStatus("compositing " + grid.getTileCount() + " tiles");

        for (int row = 0; row < grid.getRows(); row++) {
            for (int column = 0; column < grid.getColumns(); column++) {
                cancellation.throwIfCancelled("tile (" + column + "," + row + ")");
                drawTile(canvas, grid.getTileRectangle(column, row), tileColors[column][row]);
                progressReporter.increment();
            }
        }

        LOG.info("compose: exit, fallbackTileCount={}, failedDrawCount={}, uniqueCandidatesDrawn={}",
                 fallbackTileCount, failedDrawCount, drawCounts.size());

        return canvas;
    }

    public MosaicStrategy getStrategy() {
        return strategy;
    }

    /**
     * @return number of tiles filled with their flat target color (or overlay only) because no candidate was drawn.
     */
    public int getFallbackTileCount() {
        return fallbackTileCount;
    }

    /**
     * @return number of tiles where a selected candidate could not be drawn.
     */
    public int getFailedDrawCount() {
        return failedDrawCount;
    }

    /**
     * @return number of times each candidate was drawn, in first drawn order.
     */
    public Map<String, Integer> getDrawCounts() {
        return new LinkedHashMap<>(drawCounts);
    }

    /**
     * @return average distance between tile target colors and matched candidate colors
     *         (Photo-Match only, null if nothing was matched).
     */
    public Double getAverageMatchDistance() {
        return matchedTileCount == 0 ? null : totalMatchDistance / matchedTileCount;
    }

    private void drawTile(final OutputCanvas canvas,
                          final Rectangle region,
                          final ColorRGB targetColor) {
        switch (strategy) {
            case FLAT_COLOR:
                canvas.fillRectangle(region, targetColor);
                break;
            case HUE_OVERLAY:
                drawHueOverlayTile(canvas, region, targetColor);
                break;
            case PHOTO_MATCH:
                drawPhotoMatchTile(canvas, region, targetColor);
                break;
            default:
                throw new IllegalStateException("unsupported strategy " + strategy);
        }
    }

    private void drawHueOverlayTile(final OutputCanvas canvas,
                                    final Rectangle region,
                                    final ColorRGB targetColor) {
        if (pool.isEmpty()) {
            // overlay only so that the tile is still tinted
            canvas.overlayRectangle(region, targetColor.withAlpha(overlayAlpha));
            fallbackTileCount++;
            return;
        }

        final CandidateImage candidate = pool.get(random.nextInt(pool.size()));
        if (drawCandidate(canvas, region, candidate)) {
            canvas.overlayRectangle(region, targetColor.withAlpha(overlayAlpha));
        } else {
            canvas.fillRectangle(region, targetColor);
            fallbackTileCount++;
        }
    }

    private void drawPhotoMatchTile(final OutputCanvas canvas,
                                    final Rectangle region,
                                    final ColorRGB targetColor) {

        final CandidateImage candidate = MatchSelector.selectClosest(targetColor, pool);

        if (candidate == null) {
            canvas.fillRectangle(region, targetColor);
            fallbackTileCount++;
            return;
        }

        matchedTileCount++;
        totalMatchDistance += candidate.distanceTo(targetColor);

        if (drawCandidate(canvas, region, candidate)) {
            canvas.overlayRectangle(region, targetColor.withAlpha(overlayAlpha));
        } else {
            canvas.fillRectangle(region, targetColor);
            fallbackTileCount++;
        }
    }

    /**
     * @return true if the candidate was drawn; false if it could not be loaded.
     */
    private boolean drawCandidate(final OutputCanvas canvas,
                                  final Rectangle region,
                                  final CandidateImage candidate) {
        boolean drawn = false;
        try {
            final PixelBuffer resized = imageCache.getResized(candidate.getFilePath(), region.width, region.height);
            canvas.drawImage(region, resized);
            drawCounts.merge(candidate.getFilePath(), 1, Integer::sum);
            drawn = true;
        } catch (final UnreadableImageException | PixelAccessException e) {
            failedDrawCount++;
            LOG.warn("drawCandidate: failed to draw {} in region {}, filling with target color instead",
                     candidate.getFilePath(), region, e);
        }
        return drawn;
    }

    private static final Logger LOG = LoggerFactory.getLogger(MosaicCompositor.class);
}
