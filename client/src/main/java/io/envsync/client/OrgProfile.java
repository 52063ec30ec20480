// file: client/src/main/java/io/envsync/client/OrgProfile.java
package io.envsync.client;

import io.envsync.core.ConfigurationException;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The org a run talks to, taken from the CLI client's config file (okta.yaml).
 * <p>
 * Only developer orgs ("dev-123456.okta.com") are supported: the file is
 * scanned line by line for the first such domain and anything else is refused.
 *
 * @param configFile path of the config file that was scanned
 * @param domain     full domain, e.g. "dev-123456.okta.com"
 * @param orgName    org part of the domain, e.g. "dev-123456"
 */
public record OrgProfile(Path configFile, String domain, String orgName) {

    private static final Pattern DEV_ORG = Pattern.compile("(?i)(dev-\\d+)\\.okta\\.com");

    public OrgProfile {
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(domain, "domain");
        Objects.requireNonNull(orgName, "orgName");
    }

    /** ~/.okta/okta.yaml */
    public static Path defaultConfigPath() {
        return Path.of(System.getProperty("user.home"), ".okta", "okta.yaml");
    }

    /**
     * @param configFile config file to scan; null for {@link #defaultConfigPath()}
     * @throws ConfigurationException if the file is missing, unreadable, or names no developer org
     */
    public static OrgProfile load(Path configFile) {
        Path path = configFile != null ? configFile : defaultConfigPath();
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("config file " + path + " does not exist");
        }
        try (BufferedReader reader = Files.newBufferedReader(path)) {
            for (String line; (line = reader.readLine()) != null; ) {
                Matcher m = DEV_ORG.matcher(line);
                if (m.find()) {
                    return new OrgProfile(path, m.group(0), m.group(1));
                }
            }
        } catch (IOException e) {
            throw new ConfigurationException("error reading config file " + path, e);
        }
        throw new ConfigurationException(
                "this tool is only designed for Okta developer accounts (dev-*.okta.com); none found in " + path);
    }

    /** ~/.okta/orgName, where backups go when no output directory is given. */
    public Path defaultBackupDirectory() {
        return Path.of(System.getProperty("user.home"), ".okta", orgName);
    }
}
