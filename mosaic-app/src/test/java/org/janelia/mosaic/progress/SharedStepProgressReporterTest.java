package org.janelia.mosaic.progress;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link SharedStepProgressReporter} class.
 */
public class SharedStepProgressReporterTest {

    @Test
    public void testPhasesShareCombinedMaximum() {

        final LoggingProgressReporter delegate = new LoggingProgressReporter();
        delegate.setMaximum(7);

        final SharedStepProgressReporter loadingPhase = new SharedStepProgressReporter(delegate);
        final SharedStepProgressReporter summarizingPhase = new SharedStepProgressReporter(delegate);

        loadingPhase.setMaximum(3);
        for (int i = 0; i < 3; i++) {
            loadingPhase.increment();
        }
        summarizingPhase.setMaximum(4);
        for (int i = 0; i < 4; i++) {
            summarizingPhase.increment();
        }

        Assert.assertEquals("phase maximums should not replace combined maximum", 7, delegate.getMaximum());
        Assert.assertEquals("increments from both phases should be counted", 7, delegate.getCurrent());
    }

}
