package org.janelia.mosaic.util;

/**
 * Tracks elapsed time for a process and (optionally) whether a logging interval has passed.
 *
 * @author Eric Trautman
 */
public class ProcessTimer {

    public static final long DEFAULT_INTERVAL = 5000;

    private final long interval;
    private final long start;
    private long lastIntervalStart;

    public ProcessTimer() {
        this(DEFAULT_INTERVAL);
    }

    public ProcessTimer(final long interval) {
        this.interval = interval;
        this.start = System.currentTimeMillis();
        this.lastIntervalStart = this.start;
    }

    /**
     * @return true (and starts a new interval) if the current interval has passed.
     */
    public synchronized boolean hasIntervalPassed() {
        final long now = System.currentTimeMillis();
        final boolean hasPassed = (now - lastIntervalStart) > interval;
        if (hasPassed) {
            lastIntervalStart = now;
        }
        return hasPassed;
    }

    public long getElapsedMilliseconds() {
        return System.currentTimeMillis() - start;
    }

    @Override
    public String toString() {
        final long totalMilliseconds = getElapsedMilliseconds();
        final long totalSeconds = totalMilliseconds / 1000;
        final long minutes = totalSeconds / 60;
        final long seconds = totalSeconds % 60;
        return minutes + " minutes, " + seconds + "." + String.format("%03d", totalMilliseconds % 1000) +
               " seconds";
    }
}
