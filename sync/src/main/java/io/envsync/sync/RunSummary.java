// file: sync/src/main/java/io/envsync/sync/RunSummary.java
package io.envsync.sync;

import java.util.EnumMap;
import java.util.Map;

/**
 * Per-phase counters of a backup or restore run.
 * <p>
 * Per phase:
 *  - succeeded: records written (backup) or created / associated (restore),
 *  - skipped:   items dropped on a resolution warning (missing source, missing
 *               mapping entry, malformed record, missing id),
 *  - failed:    backend calls that failed.
 * <p>
 * Not thread-safe; a run is single-threaded.
 */
public final class RunSummary {

    private final String operation;
    private final Map<Phase, PhaseStats> phases = new EnumMap<>(Phase.class);

    public RunSummary(String operation) {
        this.operation = operation;
    }

    public String operation() {
        return operation;
    }

    /** Counters for a phase, created on first use. */
    public PhaseStats phase(Phase phase) {
        return phases.computeIfAbsent(phase, p -> new PhaseStats());
    }

    public Map<Phase, PhaseStats> phases() {
        return Map.copyOf(phases);
    }

    public int totalSucceeded() {
        return phases.values().stream().mapToInt(PhaseStats::succeeded).sum();
    }

    public int totalSkipped() {
        return phases.values().stream().mapToInt(PhaseStats::skipped).sum();
    }

    public int totalFailed() {
        return phases.values().stream().mapToInt(PhaseStats::failed).sum();
    }

    public static final class PhaseStats {
        private int succeeded;
        private int skipped;
        private int failed;

        public void recordSucceeded() { succeeded++; }
        public void recordSkipped()   { skipped++; }
        public void recordFailed()    { failed++; }

        public void recordSkipped(int n) { skipped += n; }

        public void add(int succeeded, int skipped, int failed) {
            this.succeeded += succeeded;
            this.skipped += skipped;
            this.failed += failed;
        }

        public int succeeded() { return succeeded; }
        public int skipped()   { return skipped; }
        public int failed()    { return failed; }

        @Override
        public String toString() {
            return succeeded + " ok, " + skipped + " skipped, " + failed + " failed";
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(operation).append(": ");
        boolean first = true;
        for (Map.Entry<Phase, PhaseStats> e : phases.entrySet()) {
            if (!first) sb.append("; ");
            sb.append(e.getKey().label()).append(' ').append(e.getValue());
            first = false;
        }
        if (first) sb.append("nothing to do");
        return sb.toString();
    }
}
