package org.janelia.mosaic.progress;

/**
 * View of a reporter for one of several phases that run concurrently within a single step.
 * The owner of the step sets the combined maximum on the wrapped reporter,
 * so maximum changes from the phases are ignored while increments and status updates are forwarded.
 */
public class SharedStepProgressReporter
        implements ProgressReporter {

    private final ProgressReporter delegate;

    public SharedStepProgressReporter(final ProgressReporter delegate) {
        this.delegate = delegate;
    }

    @Override
    public void setMaximum(final int maximum) {
        // step maximum is owned by the caller that created this view
    }

    @Override
    public void increment() {
        delegate.increment();
    }

    @Override
    public void updateStatus(final String status) {
        delegate.updateStatus(status);
    }
}
