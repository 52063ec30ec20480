// file: client/src/main/java/io/envsync/client/CliBackend.java
package io.envsync.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.envsync.core.Backend;
import io.envsync.core.BackendException;
import io.envsync.core.ResourceRecord;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link Backend} that drives the okta-cli-client binary.
 * <p>
 * Invocation:
 *
 *   okta-cli-client [--config file] type command [--param value]... [--data json]
 * <p>
 *  - list / get:   "type command", JSON on stdout (array, object or nothing)
 *  - create:       "type create --data json", created object on stdout
 *  - associate:    "type command --param value...", output ignored
 * <p>
 * A non-zero exit, a failure to start the process, or stdout that is not the
 * expected JSON shape is a {@link BackendException}. stderr mentioning
 * "already exists" marks the exception accordingly.
 */
public final class CliBackend implements Backend {
    private static final Logger log = Logger.getLogger(CliBackend.class.getName());

    public static final String DEFAULT_BINARY = "okta-cli-client";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> FIELDS = new TypeReference<>() {};

    private final String binary;
    private final Path configFile;
    private final CommandRunner runner;

    /**
     * @param binary     program name or path of the CLI client
     * @param configFile org config passed as --config; null to let the client pick its default
     * @param runner     process runner
     */
    public CliBackend(String binary, Path configFile, CommandRunner runner) {
        this.binary = Objects.requireNonNull(binary, "binary");
        this.configFile = configFile;
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    @Override
    public List<ResourceRecord> list(String resourceType, String command, Map<String, String> params)
            throws BackendException {
        JsonNode out = invoke(resourceType, command, params, null);
        if (out == null) {
            return List.of();
        }
        if (out.isObject()) {
            return List.of(toRecord(resourceType, command, out));
        }
        if (!out.isArray()) {
            throw new BackendException(resourceType, command, "expected a JSON array, got " + out.getNodeType());
        }
        List<ResourceRecord> records = new ArrayList<>(out.size());
        for (JsonNode item : out) {
            records.add(toRecord(resourceType, command, item));
        }
        return records;
    }

    @Override
    public ResourceRecord get(String resourceType, String command) throws BackendException {
        return single(resourceType, command, invoke(resourceType, command, Map.of(), null));
    }

    @Override
    public ResourceRecord create(String resourceType, ResourceRecord record, Map<String, String> params)
            throws BackendException {
        return single(resourceType, "create", invoke(resourceType, "create", params, record));
    }

    @Override
    public void associate(String resourceType, String command, Map<String, String> endpointParams,
                          ResourceRecord body) throws BackendException {
        invoke(resourceType, command, endpointParams, body == null || body.isEmpty() ? null : body);
    }

    /** Full argument vector for one call; package-private for tests. */
    List<String> commandLine(String resourceType, String command, Map<String, String> params, ResourceRecord data)
            throws BackendException {
        List<String> args = new ArrayList<>();
        args.add(binary);
        if (configFile != null) {
            args.add("--config");
            args.add(configFile.toString());
        }
        args.add(resourceType);
        args.add(command);
        for (Map.Entry<String, String> p : params.entrySet()) {
            args.add("--" + p.getKey());
            args.add(p.getValue());
        }
        if (data != null) {
            args.add("--data");
            try {
                args.add(MAPPER.writeValueAsString(data.fields()));
            } catch (JsonProcessingException e) {
                throw new BackendException(resourceType, command, "record is not serializable", false, e);
            }
        }
        return args;
    }

    private JsonNode invoke(String resourceType, String command, Map<String, String> params, ResourceRecord data)
            throws BackendException {
        List<String> args = commandLine(resourceType, command, params, data);
        log.fine(() -> "exec " + binary + " " + resourceType + " " + command + " " + params);

        CommandRunner.Result result;
        try {
            result = runner.run(args);
        } catch (IOException e) {
            throw new BackendException(resourceType, command, e.getMessage(), false, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendException(resourceType, command, "interrupted", false, e);
        }

        if (!result.succeeded()) {
            String stderr = result.stderr() == null ? "" : result.stderr().strip();
            boolean exists = stderr.toLowerCase(Locale.ROOT).contains("already exist");
            if (!stderr.isEmpty()) {
                log.log(Level.FINE, "{0} {1} stderr: {2}", new Object[]{resourceType, command, stderr});
            }
            throw new BackendException(resourceType, command,
                    "exit code " + result.exitCode() + (stderr.isEmpty() ? "" : ": " + firstLine(stderr)),
                    exists, null);
        }

        String stdout = result.stdout() == null ? "" : result.stdout().strip();
        if (stdout.isEmpty()) {
            return null;
        }
        try {
            return MAPPER.readTree(stdout);
        } catch (JsonProcessingException e) {
            throw new BackendException(resourceType, command, "output is not JSON: " + e.getOriginalMessage(),
                    false, e);
        }
    }

    private static ResourceRecord single(String resourceType, String command, JsonNode out)
            throws BackendException {
        if (out == null) {
            throw new BackendException(resourceType, command, "no output");
        }
        if (out.isArray() && out.size() == 1) {
            return toRecord(resourceType, command, out.get(0));
        }
        return toRecord(resourceType, command, out);
    }

    private static ResourceRecord toRecord(String resourceType, String command, JsonNode node)
            throws BackendException {
        if (!node.isObject()) {
            throw new BackendException(resourceType, command, "expected a JSON object, got " + node.getNodeType());
        }
        return new ResourceRecord(MAPPER.convertValue(node, FIELDS));
    }

    private static String firstLine(String s) {
        int nl = s.indexOf('\n');
        return nl < 0 ? s : s.substring(0, nl);
    }
}
