package org.janelia.mosaic.progress;

/**
 * Side channel for reporting progress of long running mosaic steps.
 * Implementations are called from worker threads and must not block them.
 */
public interface ProgressReporter {

    /**
     * Starts a new step with the specified number of units.
     */
    void setMaximum(final int maximum);

    /**
     * Records completion of one unit (one candidate file or one tile).
     */
    void increment();

    void updateStatus(final String status);

}
