package io.edgeenroll.server;

import io.edgeenroll.server.http.EnrollmentApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the enrollment gateway.
 *
 * <p>
 * Delegates to {@link EnrollmentApp#start(String[])}. On failure, logs the
 * error and exits with status 1.
 */
public final class EnrollmentMain {

    private static final Logger LOG = LoggerFactory.getLogger(EnrollmentMain.class);

    private EnrollmentMain() {
        // utility class
    }

    /**
     * @param args command-line arguments (e.g.
     *             {@code --config path/to/edge-enrollment-gateway.yaml})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            EnrollmentApp.start(args);
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
