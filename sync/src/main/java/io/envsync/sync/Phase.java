// file: sync/src/main/java/io/envsync/sync/Phase.java
package io.envsync.sync;

import java.util.Locale;

/**
 * Phases of a run, in execution order.
 * <p>
 * Restore walks all of them: INIT, SINGLETON, FIRST_PASS, SECOND_PASS,
 * ASSOCIATION, DONE. Backup skips ASSOCIATION. A phase only starts once the
 * previous one has completed in full; there is no re-entry and no rollback.
 */
public enum Phase {
    INIT,
    SINGLETON,
    FIRST_PASS,
    SECOND_PASS,
    ASSOCIATION,
    DONE;

    public String label() {
        return name().toLowerCase(Locale.ROOT).replace('_', ' ');
    }
}
