package org.janelia.mosaic;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

import org.janelia.mosaic.image.ImageFormats;
import org.janelia.mosaic.image.RetryingImageCodec;
import org.janelia.mosaic.json.JsonUtils;
import org.janelia.mosaic.pool.CandidateImageCache;
import org.janelia.mosaic.tile.TileGrid;
import org.janelia.mosaic.tile.ZeroAreaRegionException;

/**
 * Configuration for building one mosaic.
 */
public class MosaicJob implements Serializable {

    public static final int DEFAULT_TILE_SIZE = 40;
    public static final int DEFAULT_OVERLAY_ALPHA = 210;
    public static final float DEFAULT_OUTPUT_QUALITY = 0.85f;
    public static final int DEFAULT_THUMBNAIL_MAX_WIDTH = 800;
    public static final int DEFAULT_THUMBNAIL_MAX_HEIGHT = 600;

    private String masterImagePath;
    private List<String> candidatePaths;
    private String outputPath;
    private String outputFormat;
    private Float outputQuality;
    private Integer tileWidth;
    private Integer tileHeight;
    private MosaicStrategy strategy;
    private Integer overlayAlpha;
    private Long randomSeed;
    private Integer numberOfThreads;
    private Integer maxDecodeAttempts;
    private Long decodeRetryBackoffMillis;
    private Long maxCachedCandidatePixels;
    private Boolean flatColorFallback;
    private String thumbnailPath;
    private Integer thumbnailMaxWidth;
    private Integer thumbnailMaxHeight;

    public MosaicJob() {
        this.candidatePaths = new ArrayList<>();
    }

    public MosaicJob(final String masterImagePath,
                     final List<String> candidatePaths,
                     final String outputPath,
                     final MosaicStrategy strategy) {
        this();
        this.masterImagePath = masterImagePath;
        setCandidatePaths(candidatePaths);
        this.outputPath = outputPath;
        this.strategy = strategy;
    }

    /**
     * @throws IllegalArgumentException
     *   if the json cannot be parsed.
     */
    public static MosaicJob parseJson(final String json)
            throws IllegalArgumentException {
        return JSON_HELPER.fromJson(json);
    }

    /**
     * @throws IllegalArgumentException
     *   if the file cannot be read or parsed.
     */
    public static MosaicJob parseJson(final File jsonFile)
            throws IllegalArgumentException {

        if (! jsonFile.canRead()) {
            throw new IllegalArgumentException("mosaic job json file " + jsonFile.getAbsolutePath() +
                                               " does not exist or is not readable");
        }

        try (final Reader reader = new FileReader(jsonFile)) {
            return JSON_HELPER.fromJson(reader);
        } catch (final FileNotFoundException e) {
            throw new IllegalArgumentException("mosaic job json file " + jsonFile.getAbsolutePath() +
                                               " does not exist", e);
        } catch (final IOException e) {
            throw new IllegalArgumentException("failed to read mosaic job json file " +
                                               jsonFile.getAbsolutePath(), e);
        }
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    /**
     * @throws ZeroAreaRegionException
     *   if the tile width or height is not positive.
     *
     * @throws IllegalArgumentException
     *   if any other parameter is invalid.
     */
    public void validate()
            throws IllegalArgumentException {

        if ((masterImagePath == null) || masterImagePath.trim().isEmpty()) {
            throw new IllegalArgumentException("masterImagePath must be specified");
        }

        TileGrid.validateTileSize(getTileWidth(), getTileHeight());

        checkRange("overlayAlpha", getOverlayAlpha(), 0, 255);
        checkRange("numberOfThreads", getNumberOfThreads(), 1, Integer.MAX_VALUE);
        checkRange("maxDecodeAttempts", getMaxDecodeAttempts(), 1, Integer.MAX_VALUE);
        checkRange("thumbnailMaxWidth", getThumbnailMaxWidth(), 1, Integer.MAX_VALUE);
        checkRange("thumbnailMaxHeight", getThumbnailMaxHeight(), 1, Integer.MAX_VALUE);

        final float quality = getOutputQuality();
        if ((quality < 0.0f) || (quality > 1.0f)) {
            throw new IllegalArgumentException("outputQuality " + quality + " must be between 0.0 and 1.0");
        }

        if (getDecodeRetryBackoffMillis() < 0) {
            throw new IllegalArgumentException("decodeRetryBackoffMillis must not be negative");
        }

        if (getMaxCachedCandidatePixels() < 0) {
            throw new IllegalArgumentException("maxCachedCandidatePixels must not be negative");
        }

        for (final String path : candidatePaths) {
            if (path == null) {
                throw new IllegalArgumentException("candidatePaths must not contain null values");
            }
        }
    }

    public String getMasterImagePath() {
        return masterImagePath;
    }

    public void setMasterImagePath(final String masterImagePath) {
        this.masterImagePath = masterImagePath;
    }

    public List<String> getCandidatePaths() {
        return candidatePaths;
    }

    public void setCandidatePaths(final List<String> candidatePaths) {
        this.candidatePaths = candidatePaths == null ? new ArrayList<>() : new ArrayList<>(candidatePaths);
    }

    public String getOutputPath() {
        return outputPath;
    }

    public void setOutputPath(final String outputPath) {
        this.outputPath = outputPath;
    }

    /**
     * @return explicitly specified output format or the format derived from the output path's extension.
     */
    public String getOutputFormat() {
        if (outputFormat != null) {
            return outputFormat;
        }
        return outputPath == null ? ImageFormats.JPEG_FORMAT :
               ImageFormats.deriveFormat(outputPath, ImageFormats.JPEG_FORMAT);
    }

    public void setOutputFormat(final String outputFormat) {
        this.outputFormat = outputFormat;
    }

    public float getOutputQuality() {
        return outputQuality == null ? DEFAULT_OUTPUT_QUALITY : outputQuality;
    }

    public void setOutputQuality(final Float outputQuality) {
        this.outputQuality = outputQuality;
    }

    public int getTileWidth() {
        return tileWidth == null ? DEFAULT_TILE_SIZE : tileWidth;
    }

    public void setTileWidth(final Integer tileWidth) {
        this.tileWidth = tileWidth;
    }

    public int getTileHeight() {
        return tileHeight == null ? DEFAULT_TILE_SIZE : tileHeight;
    }

    public void setTileHeight(final Integer tileHeight) {
        this.tileHeight = tileHeight;
    }

    public MosaicStrategy getStrategy() {
        return strategy == null ? MosaicStrategy.PHOTO_MATCH : strategy;
    }

    public void setStrategy(final MosaicStrategy strategy) {
        this.strategy = strategy;
    }

    public int getOverlayAlpha() {
        return overlayAlpha == null ? DEFAULT_OVERLAY_ALPHA : overlayAlpha;
    }

    public void setOverlayAlpha(final Integer overlayAlpha) {
        this.overlayAlpha = overlayAlpha;
    }

    /**
     * @return explicitly specified random seed or null if a seed should be generated.
     */
    public Long getRandomSeed() {
        return randomSeed;
    }

    public void setRandomSeed(final Long randomSeed) {
        this.randomSeed = randomSeed;
    }

    public int getNumberOfThreads() {
        return numberOfThreads == null ? Runtime.getRuntime().availableProcessors() : numberOfThreads;
    }

    public void setNumberOfThreads(final Integer numberOfThreads) {
        this.numberOfThreads = numberOfThreads;
    }

    public int getMaxDecodeAttempts() {
        return maxDecodeAttempts == null ? RetryingImageCodec.DEFAULT_MAX_ATTEMPTS : maxDecodeAttempts;
    }

    public void setMaxDecodeAttempts(final Integer maxDecodeAttempts) {
        this.maxDecodeAttempts = maxDecodeAttempts;
    }

    public long getDecodeRetryBackoffMillis() {
        return decodeRetryBackoffMillis == null ? RetryingImageCodec.DEFAULT_BACKOFF_MILLIS :
               decodeRetryBackoffMillis;
    }

    public void setDecodeRetryBackoffMillis(final Long decodeRetryBackoffMillis) {
        this.decodeRetryBackoffMillis = decodeRetryBackoffMillis;
    }

    public long getMaxCachedCandidatePixels() {
        return maxCachedCandidatePixels == null ? CandidateImageCache.DEFAULT_MAX_CACHED_PIXELS :
               maxCachedCandidatePixels;
    }

    public void setMaxCachedCandidatePixels(final Long maxCachedCandidatePixels) {
        this.maxCachedCandidatePixels = maxCachedCandidatePixels;
    }

    /**
     * @return true (default) if tiles should be filled with their target color when no candidate is available;
     *         false if the job should fail instead.
     */
    public boolean isFlatColorFallback() {
        return flatColorFallback == null || flatColorFallback;
    }

    public void setFlatColorFallback(final Boolean flatColorFallback) {
        this.flatColorFallback = flatColorFallback;
    }

    public String getThumbnailPath() {
        return thumbnailPath;
    }

    public void setThumbnailPath(final String thumbnailPath) {
        this.thumbnailPath = thumbnailPath;
    }

    public int getThumbnailMaxWidth() {
        return thumbnailMaxWidth == null ? DEFAULT_THUMBNAIL_MAX_WIDTH : thumbnailMaxWidth;
    }

    public void setThumbnailMaxWidth(final Integer thumbnailMaxWidth) {
        this.thumbnailMaxWidth = thumbnailMaxWidth;
    }

    public int getThumbnailMaxHeight() {
        return thumbnailMaxHeight == null ? DEFAULT_THUMBNAIL_MAX_HEIGHT : thumbnailMaxHeight;
    }

    public void setThumbnailMaxHeight(final Integer thumbnailMaxHeight) {
        this.thumbnailMaxHeight = thumbnailMaxHeight;
    }

    @Override
    public String toString() {
        return toJson();
    }

    private static void checkRange(final String name,
                                   final int value,
                                   final int min,
                                   final int max)
            throws IllegalArgumentException {
        if ((value < min) || (value > max)) {
            throw new IllegalArgumentException(name + " " + value + " must be between " + min + " and " + max);
        }
    }

    private static final JsonUtils.Helper<MosaicJob> JSON_HELPER =
            new JsonUtils.Helper<>(MosaicJob.class);
}
