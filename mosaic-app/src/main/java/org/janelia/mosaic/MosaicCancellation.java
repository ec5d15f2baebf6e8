package org.janelia.mosaic;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation flag for a mosaic job.
 * Workers check the flag before each file or tile, never in the middle of one.
 */
public class MosaicCancellation {

    private final AtomicBoolean cancelled;

    public MosaicCancellation() {
        this.cancelled = new AtomicBoolean(false);
    }

    public void cancel() {
        cancelled.set(true);
    }

    /**
     * @param  nextUnit  description of the unit that would be processed next (for the exception message).
     *
     * @throws CancellationException
     *   if the job has been cancelled.
     */
    public void throwIfCancelled(final String nextUnit)
            throws CancellationException {
        if (cancelled.get()) {
            throw new CancellationException("mosaic job cancelled before processing " + nextUnit);
        }
    }
}
