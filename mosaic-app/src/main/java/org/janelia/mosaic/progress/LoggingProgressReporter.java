package org.janelia.mosaic.progress;

import java.util.concurrent.atomic.AtomicInteger;

import org.janelia.mosaic.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports progress through the application log.
 * Increments are logged at most once per interval (and when a step completes) to keep logs readable.
 */
public class LoggingProgressReporter
        implements ProgressReporter {

    private final long intervalMilliseconds;
    private final AtomicInteger current;

    private volatile int maximum;
    private volatile String status;
    private volatile ProcessTimer stepTimer;

    public LoggingProgressReporter() {
        this(ProcessTimer.DEFAULT_INTERVAL);
    }

    public LoggingProgressReporter(final long intervalMilliseconds) {
        this.intervalMilliseconds = intervalMilliseconds;
        this.current = new AtomicInteger(0);
        this.maximum = 0;
        this.status = "";
        this.stepTimer = new ProcessTimer(intervalMilliseconds);
    }

    @Override
    public void setMaximum(final int maximum) {
        this.maximum = maximum;
        this.current.set(0);
        this.stepTimer = new ProcessTimer(intervalMilliseconds);
    }

    @Override
    public void increment() {
        final int count = current.incrementAndGet();
        final int max = maximum;
        if ((count == max) || stepTimer.hasIntervalPassed()) {
            final double percent = max > 0 ? (count * 100.0) / max : 0.0;
            LOG.info("{}: {} of {} units processed ({}%) after {}",
                     status, count, max, String.format("%.1f", percent), stepTimer);
        }
    }

    @Override
    public void updateStatus(final String status) {
        this.status = status;
        LOG.info(status);
    }

    public int getCurrent() {
        return current.get();
    }

    public int getMaximum() {
        return maximum;
    }

    private static final Logger LOG = LoggerFactory.getLogger(LoggingProgressReporter.class);
}
