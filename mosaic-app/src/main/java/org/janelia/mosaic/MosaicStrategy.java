package org.janelia.mosaic;

/**
 * Supported ways to fill mosaic tiles.
 */
public enum MosaicStrategy {

    /** Fill each tile with its target color. */
    FLAT_COLOR(false),

    /** Draw a randomly chosen candidate in each tile and tint it toward the tile's target color. */
    HUE_OVERLAY(true),

    /** Draw the candidate that best matches each tile's target color and tint it toward that color. */
    PHOTO_MATCH(true);

    private final boolean usesCandidates;

    MosaicStrategy(final boolean usesCandidates) {
        this.usesCandidates = usesCandidates;
    }

    public boolean usesCandidates() {
        return usesCandidates;
    }
}
