// file: sync/src/main/java/io/envsync/sync/SyncConfig.java
package io.envsync.sync;

import io.envsync.client.CliBackend;
import io.envsync.core.ConfigurationException;
import io.envsync.storage.FileIdMappingStore;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Invocation of the tool, parsed from CLI args.
 *
 * Supports:
 *  - command:        backup, restore, catalog or help
 *  - configFile:     Okta CLI config (null: ~/.okta/okta.yaml)
 *  - output:         backup destination or catalog file (null: derived from the org)
 *  - input:          backup directory to restore from
 *  - catalogFile:    JSON catalog replacing the built-in one (optional)
 *  - mappingFile:    id mapping file (null: id_mapping.json inside the input directory)
 *  - cliBinary:      okta-cli-client executable
 *  - timeout:        per-call limit on the CLI (null: none)
 *  - skipMapped:     restore only; do not re-create records that are already mapped
 */
public record SyncConfig(
        Command command,
        Path configFile,
        Path output,
        Path input,
        Path catalogFile,
        Path mappingFile,
        String cliBinary,
        Duration timeout,
        boolean skipMapped
) {

    public enum Command { BACKUP, RESTORE, CATALOG, HELP }

    public static final String USAGE = """
            Usage: envsync <backup|restore|catalog> [options]

            Commands:
              backup    Save the org configuration as JSON files
              restore   Replay a backup into the org, rebuilding references
              catalog   Write the built-in resource catalog as JSON (-o required)

            Options:
              --config,  -c   Okta CLI config file (default: ~/.okta/okta.yaml)
              --output,  -o   Backup directory (default: ~/.okta/<org>) or catalog file
              --input,   -i   Backup directory to restore from (restore, required)
              --catalog       JSON resource catalog (default: built-in)
              --mapping       ID mapping file (default: <input>/id_mapping.json)
              --cli           okta-cli-client executable (default: okta-cli-client)
              --timeout-seconds  Limit for each CLI call (default: none)
              --skip-mapped   Restore: skip records that already have a mapping entry
              --help,    -h   Show this help message
            """;

    /**
     * Parse the command word followed by its flags.
     *
     * @throws ConfigurationException on unknown commands or flags, missing values
     *                                and flags that do not apply to the command
     */
    public static SyncConfig fromArgs(String[] args) {
        if (args.length == 0) {
            throw new ConfigurationException("Missing command");
        }

        Command command = switch (args[0]) {
            case "backup" -> Command.BACKUP;
            case "restore" -> Command.RESTORE;
            case "catalog" -> Command.CATALOG;
            case "help", "--help", "-h" -> Command.HELP;
            default -> throw new ConfigurationException("Unknown command: " + args[0]);
        };

        Path configFile = null;
        Path output = null;
        Path input = null;
        Path catalogFile = null;
        Path mappingFile = null;
        String cliBinary = CliBackend.DEFAULT_BINARY;
        Duration timeout = null;
        boolean skipMapped = false;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> command = Command.HELP;

                case "--config", "-c" -> {
                    ensureValue(args, i);
                    configFile = Path.of(args[++i]);
                }

                case "--output", "-o" -> {
                    ensureValue(args, i);
                    output = Path.of(args[++i]);
                }

                case "--input", "-i" -> {
                    ensureValue(args, i);
                    input = Path.of(args[++i]);
                }

                case "--catalog" -> {
                    ensureValue(args, i);
                    catalogFile = Path.of(args[++i]);
                }

                case "--mapping" -> {
                    ensureValue(args, i);
                    mappingFile = Path.of(args[++i]);
                }

                case "--cli" -> {
                    ensureValue(args, i);
                    cliBinary = args[++i];
                }

                case "--timeout-seconds" -> {
                    ensureValue(args, i);
                    long seconds;
                    try {
                        seconds = Long.parseLong(args[++i]);
                    } catch (NumberFormatException e) {
                        throw new ConfigurationException("Invalid timeout-seconds: " + args[i]);
                    }
                    if (seconds <= 0) {
                        throw new ConfigurationException("timeout-seconds must be positive: " + seconds);
                    }
                    timeout = Duration.ofSeconds(seconds);
                }

                case "--skip-mapped" -> skipMapped = true;

                default -> throw new ConfigurationException("Unknown option: " + args[i]);
            }
        }

        if (command == Command.HELP) {
            return help();
        }
        if (command == Command.RESTORE && input == null) {
            throw new ConfigurationException("restore requires --input <backup directory>");
        }
        if (command == Command.CATALOG && output == null) {
            throw new ConfigurationException("catalog requires --output <file>");
        }
        if (command != Command.RESTORE && (input != null || mappingFile != null || skipMapped)) {
            throw new ConfigurationException("--input, --mapping and --skip-mapped only apply to restore");
        }

        return new SyncConfig(
                command,
                configFile,
                output,
                input,
                catalogFile,
                mappingFile,
                cliBinary,
                timeout,
                skipMapped
        );
    }

    public static SyncConfig help() {
        return new SyncConfig(Command.HELP, null, null, null, null, null, CliBackend.DEFAULT_BINARY, null, false);
    }

    /** Mapping file to use for a restore. */
    public Path effectiveMappingFile() {
        if (mappingFile != null) {
            return mappingFile;
        }
        if (input == null) {
            throw new IllegalStateException("no input directory to derive the mapping file from");
        }
        return input.resolve(FileIdMappingStore.DEFAULT_FILE_NAME);
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new ConfigurationException("Missing value for option: " + args[i]);
        }
    }
}
