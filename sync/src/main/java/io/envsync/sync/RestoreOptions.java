// file: sync/src/main/java/io/envsync/sync/RestoreOptions.java
package io.envsync.sync;

/**
 * Knobs of a restore run.
 *
 * @param skipMapped do not re-create first-pass records that already have an
 *                   entry in the loaded id mapping (resuming an interrupted
 *                   restore). Off by default: every record is re-attempted.
 */
public record RestoreOptions(boolean skipMapped) {

    public static final RestoreOptions DEFAULTS = new RestoreOptions(false);
}
