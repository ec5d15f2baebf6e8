package org.janelia.mosaic.progress;

/**
 * Reporter that ignores everything, used when no one is listening.
 */
public class NullProgressReporter
        implements ProgressReporter {

    public static final NullProgressReporter INSTANCE = new NullProgressReporter();

    private NullProgressReporter() {
    }

    @Override
    public void setMaximum(final int maximum) {
    }

    @Override
    public void increment() {
    }

    @Override
    public void updateStatus(final String status) {
    }
}
