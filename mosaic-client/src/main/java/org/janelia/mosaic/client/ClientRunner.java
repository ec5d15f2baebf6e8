package org.janelia.mosaic.client;

import org.janelia.mosaic.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line client wrapper that logs unexpected exceptions
 * and overall process completion events.
 *
 * The process exit code is 0 when the client completes and 1 when it fails,
 * so that scripts driving the client can detect failed jobs.
 *
 * @author Eric Trautman
 */
public abstract class ClientRunner {

    private final String[] args;

    /**
     * @param  args  command line arguments for client.
     */
    public ClientRunner(final String[] args) {
        this.args = args;
    }

    /**
     * Wraps a run with consistent log statements.
     * Absence of the standard exit log message indicates that the client was terminated abnormally.
     */
    public void run() {
        System.exit(runAndGetExitCode());
    }

    /**
     * @return 0 if the client completed successfully, otherwise 1.
     */
    public int runAndGetExitCode() {

        LOG.info("run: entry");

        final ProcessTimer processTimer = new ProcessTimer();

        int exitCode;
        try {
            runClient(args);
            LOG.info("run: exit, processing completed in {}", processTimer);
            exitCode = 0;
        } catch (final Throwable t) {
            LOG.error("run: caught exception", t);
            LOG.info("run: exit, processing failed after {}", processTimer);
            exitCode = 1;
        }

        return exitCode;
    }

    /**
     * This method should contain the specific client implementation to be wrapped.
     *
     * @param  args  command line arguments for client.
     *
     * @throws Exception
     *   if the client fails for any reason.
     */
    public abstract void runClient(final String[] args) throws Exception ;

    private static final Logger LOG = LoggerFactory.getLogger(ClientRunner.class);
}
