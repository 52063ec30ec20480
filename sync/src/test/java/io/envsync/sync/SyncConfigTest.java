// file: sync/src/test/java/io/envsync/sync/SyncConfigTest.java
package io.envsync.sync;

import io.envsync.core.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SyncConfigTest {

    @Test
    void backup_defaults() {
        SyncConfig cfg = SyncConfig.fromArgs(new String[]{"backup"});

        assertEquals(SyncConfig.Command.BACKUP, cfg.command());
        assertNull(cfg.configFile());
        assertNull(cfg.output());
        assertNull(cfg.catalogFile());
        assertEquals("okta-cli-client", cfg.cliBinary());
        assertNull(cfg.timeout());
        assertFalse(cfg.skipMapped());
    }

    @Test
    void backup_with_every_option() {
        SyncConfig cfg = SyncConfig.fromArgs(new String[]{
                "backup", "-c", "okta.yaml", "--output", "out", "--catalog", "cat.json",
                "--cli", "/opt/okta", "--timeout-seconds", "30"});

        assertEquals(Path.of("okta.yaml"), cfg.configFile());
        assertEquals(Path.of("out"), cfg.output());
        assertEquals(Path.of("cat.json"), cfg.catalogFile());
        assertEquals("/opt/okta", cfg.cliBinary());
        assertEquals(Duration.ofSeconds(30), cfg.timeout());
    }

    @Test
    void restore_mapping_defaults_to_the_input_directory() {
        SyncConfig cfg = SyncConfig.fromArgs(new String[]{"restore", "-i", "backup", "--skip-mapped"});

        assertEquals(SyncConfig.Command.RESTORE, cfg.command());
        assertTrue(cfg.skipMapped());
        assertEquals(Path.of("backup", "id_mapping.json"), cfg.effectiveMappingFile());
    }

    @Test
    void explicit_mapping_file_wins() {
        SyncConfig cfg = SyncConfig.fromArgs(new String[]{"restore", "-i", "backup", "--mapping", "m.json"});

        assertEquals(Path.of("m.json"), cfg.effectiveMappingFile());
    }

    @Test
    void restore_requires_input() {
        assertThrows(ConfigurationException.class, () -> SyncConfig.fromArgs(new String[]{"restore"}));
    }

    @Test
    void catalog_requires_output() {
        assertThrows(ConfigurationException.class, () -> SyncConfig.fromArgs(new String[]{"catalog"}));
    }

    @Test
    void restore_only_flags_are_rejected_for_backup() {
        assertThrows(ConfigurationException.class,
                () -> SyncConfig.fromArgs(new String[]{"backup", "--skip-mapped"}));
        assertThrows(ConfigurationException.class,
                () -> SyncConfig.fromArgs(new String[]{"backup", "-i", "dir"}));
    }

    @Test
    void malformed_arguments_are_configuration_errors() {
        assertThrows(ConfigurationException.class, () -> SyncConfig.fromArgs(new String[]{}));
        assertThrows(ConfigurationException.class, () -> SyncConfig.fromArgs(new String[]{"sync"}));
        assertThrows(ConfigurationException.class, () -> SyncConfig.fromArgs(new String[]{"backup", "--bogus"}));
        assertThrows(ConfigurationException.class, () -> SyncConfig.fromArgs(new String[]{"backup", "-o"}));
        assertThrows(ConfigurationException.class,
                () -> SyncConfig.fromArgs(new String[]{"backup", "--timeout-seconds", "soon"}));
        assertThrows(ConfigurationException.class,
                () -> SyncConfig.fromArgs(new String[]{"backup", "--timeout-seconds", "0"}));
    }

    @Test
    void help_wins_over_missing_required_options() {
        assertEquals(SyncConfig.Command.HELP, SyncConfig.fromArgs(new String[]{"restore", "-h"}).command());
        assertEquals(SyncConfig.Command.HELP, SyncConfig.fromArgs(new String[]{"--help"}).command());
    }
}
