// file: sync/src/main/java/io/envsync/sync/Main.java
package io.envsync.sync;

import io.envsync.client.CliBackend;
import io.envsync.client.OrgProfile;
import io.envsync.client.ProcessCommandRunner;
import io.envsync.core.Backend;
import io.envsync.core.CatalogException;
import io.envsync.core.ConfigurationException;
import io.envsync.core.DefaultCatalog;
import io.envsync.core.ResourceCatalog;
import io.envsync.storage.BackupTree;
import io.envsync.storage.CatalogCodec;
import io.envsync.storage.FileIdMappingStore;
import io.envsync.storage.PersistenceException;
import io.envsync.sync.association.AssociationRegistry;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point of the envsync command line.
 *
 * Responsibilities:
 *  - Load logging configuration from the classpath.
 *  - Parse the invocation (SyncConfig).
 *  - Resolve the org profile and refuse anything but a developer org.
 *  - Wire catalog, CLI backend, backup tree and id mapping into an orchestrator.
 *  - Map failures to exit codes: 1 for usage/configuration, 2 for a failed run.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILED = 2;

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        configureLogging();
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        try {
            SyncConfig cfg = SyncConfig.fromArgs(args);
            switch (cfg.command()) {
                case HELP -> out.print(SyncConfig.USAGE);
                case CATALOG -> writeCatalog(cfg, out);
                case BACKUP -> backup(cfg);
                case RESTORE -> restore(cfg);
            }
            return EXIT_OK;
        } catch (ConfigurationException e) {
            err.println("error: " + e.getMessage());
            err.println("Run 'envsync --help' for usage.");
            return EXIT_USAGE;
        } catch (CatalogException | PersistenceException e) {
            log.log(Level.SEVERE, e.getMessage(), e);
            err.println("error: " + e.getMessage());
            return EXIT_FAILED;
        } catch (RuntimeException e) {
            log.log(Level.SEVERE, "Unexpected failure", e);
            e.printStackTrace(err);
            return EXIT_FAILED;
        }
    }

    private static void writeCatalog(SyncConfig cfg, PrintStream out) {
        CatalogCodec.save(catalog(cfg), cfg.output());
        out.println("Catalog written to " + cfg.output());
    }

    private static void backup(SyncConfig cfg) {
        OrgProfile org = OrgProfile.load(cfg.configFile());
        Path destination = cfg.output() != null ? cfg.output() : org.defaultBackupDirectory();
        log.info(() -> "Backing up org " + org.domain() + " to " + destination);

        new BackupOrchestrator(catalog(cfg), backend(cfg, org))
                .backup(new BackupTree(destination));
    }

    private static void restore(SyncConfig cfg) {
        OrgProfile org = OrgProfile.load(cfg.configFile());
        Path mappingFile = cfg.effectiveMappingFile();
        log.info(() -> "Restoring " + cfg.input() + " into org " + org.domain() + ", mapping file " + mappingFile);

        FileIdMappingStore mapping = FileIdMappingStore.load(mappingFile);
        new RestoreOrchestrator(catalog(cfg), backend(cfg, org), AssociationRegistry.defaults(),
                new RestoreOptions(cfg.skipMapped()))
                .restore(new BackupTree(cfg.input()), mapping);
    }

    private static ResourceCatalog catalog(SyncConfig cfg) {
        if (cfg.catalogFile() != null) {
            return CatalogCodec.load(cfg.catalogFile());
        }
        return DefaultCatalog.create().validate();
    }

    private static Backend backend(SyncConfig cfg, OrgProfile org) {
        return new CliBackend(cfg.cliBinary(), org.configFile(), new ProcessCommandRunner(cfg.timeout()));
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Failed to load logging.properties: " + e.getMessage());
        }
    }
}
