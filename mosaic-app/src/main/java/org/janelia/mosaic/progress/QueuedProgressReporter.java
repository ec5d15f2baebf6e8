package org.janelia.mosaic.progress;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decouples workers from a (possibly slow or failing) reporter.
 * Worker threads hand events to a bounded queue with a non-blocking offer
 * and a single consumer thread forwards them to the wrapped reporter.
 * Events that do not fit in the queue are dropped and counted.
 * Failures of the wrapped reporter are logged but never reach the workers.
 */
public class QueuedProgressReporter
        implements ProgressReporter, AutoCloseable {

    public static final int DEFAULT_CAPACITY = 10000;

    private static final long POLL_MILLISECONDS = 50;

    private final ProgressReporter delegate;
    private final BlockingQueue<Consumer<ProgressReporter>> events;
    private final AtomicLong droppedEventCount;
    private final AtomicLong failedEventCount;
    private final Thread consumerThread;

    private volatile boolean closed;

    public QueuedProgressReporter(final ProgressReporter delegate) {
        this(delegate, DEFAULT_CAPACITY);
    }

    public QueuedProgressReporter(final ProgressReporter delegate,
                                  final int capacity) {
        this.delegate = delegate;
        this.events = new ArrayBlockingQueue<>(capacity);
        this.droppedEventCount = new AtomicLong(0);
        this.failedEventCount = new AtomicLong(0);
        this.closed = false;

        this.consumerThread = new Thread(this::forwardEvents, "progress-reporter");
        this.consumerThread.setDaemon(true);
        this.consumerThread.start();
    }

    @Override
    public void setMaximum(final int maximum) {
        enqueue(reporter -> reporter.setMaximum(maximum));
    }

    @Override
    public void increment() {
        enqueue(ProgressReporter::increment);
    }

    @Override
    public void updateStatus(final String status) {
        enqueue(reporter -> reporter.updateStatus(status));
    }

    public long getDroppedEventCount() {
        return droppedEventCount.get();
    }

    public long getFailedEventCount() {
        return failedEventCount.get();
    }

    /**
     * Stops accepting events and waits (briefly) for queued events to be forwarded.
     */
    @Override
    public void close() {
        closed = true;
        try {
            consumerThread.join(TimeUnit.SECONDS.toMillis(5));
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("close: interrupted while waiting for queued events to be forwarded");
        }

        if ((droppedEventCount.get() > 0) || (failedEventCount.get() > 0)) {
            LOG.warn("close: dropped {} events because queue was full, {} events failed in reporter",
                     droppedEventCount.get(), failedEventCount.get());
        }
    }

    private void enqueue(final Consumer<ProgressReporter> event) {
        if (closed || (! events.offer(event))) {
            droppedEventCount.incrementAndGet();
        }
    }

    private void forwardEvents() {
        while ((! closed) || (! events.isEmpty())) {
            final Consumer<ProgressReporter> event;
            try {
                event = events.poll(POLL_MILLISECONDS, TimeUnit.MILLISECONDS);
            } catch (final InterruptedException e) {
                LOG.warn("forwardEvents: interrupted, {} events not forwarded", events.size());
                return;
            }
            if (event != null) {
                try {
                    event.accept(delegate);
                } catch (final RuntimeException e) {
                    // only log the first failure to avoid flooding the log when a reporter is broken
                    if (failedEventCount.incrementAndGet() == 1) {
                        LOG.warn("forwardEvents: reporter failed, subsequent failures will only be counted", e);
                    }
                }
            }
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(QueuedProgressReporter.class);
}
