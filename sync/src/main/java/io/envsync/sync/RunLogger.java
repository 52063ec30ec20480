// file: sync/src/main/java/io/envsync/sync/RunLogger.java
package io.envsync.sync;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Central place for the progress and summary lines of a run.
 */
public final class RunLogger {
    private static final Logger log = Logger.getLogger(RunLogger.class.getName());

    private RunLogger() {
        // utility
    }

    public static void phaseStarted(String operation, Phase phase) {
        log.info(() -> capitalize(operation) + ": " + phase.label() + " resources...");
    }

    /**
     * Log the end-of-run summary.
     *
     * @param completed false when the run was aborted by a fatal error
     */
    public static void logSummary(RunSummary summary, boolean completed) {
        String head = capitalize(summary.operation()) + (completed ? " completed" : " aborted");
        String msg = String.format(
                "%s (ok=%d, skipped=%d, failed=%d) - %s",
                head,
                summary.totalSucceeded(),
                summary.totalSkipped(),
                summary.totalFailed(),
                summary
        );

        if (!completed) {
            log.log(Level.SEVERE, msg);
        } else if (summary.totalSkipped() > 0 || summary.totalFailed() > 0) {
            log.log(Level.WARNING, msg);
        } else {
            log.log(Level.INFO, msg);
        }
    }

    private static String capitalize(String s) {
        return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
