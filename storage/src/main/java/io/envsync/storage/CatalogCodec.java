// file: storage/src/main/java/io/envsync/storage/CatalogCodec.java
package io.envsync.storage;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.envsync.core.AssignmentSpec;
import io.envsync.core.CatalogException;
import io.envsync.core.DefaultCatalog;
import io.envsync.core.ResourceCatalog;
import io.envsync.core.ResourceDescriptor;
import io.envsync.storage.dto.CatalogJson;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes a {@link ResourceCatalog} as JSON so operators can trim or
 * extend the set of traversed resources without rebuilding.
 * <p>
 * A loaded catalog is validated before it is returned. A second-pass entry
 * without "sourceParameter" gets the default parameter for its source type.
 */
public final class CatalogCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private CatalogCodec() {
        // utility
    }

    public static void save(ResourceCatalog catalog, Path file) {
        CatalogJson json = toJson(catalog);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            MAPPER.writeValue(file.toFile(), json);
        } catch (IOException e) {
            throw new PersistenceException("cannot write catalog to " + file, e);
        }
    }

    /**
     * @throws PersistenceException if the file cannot be read or parsed
     * @throws CatalogException     if the catalog it describes is malformed
     */
    public static ResourceCatalog load(Path file) {
        CatalogJson json;
        try {
            json = MAPPER.readValue(file.toFile(), CatalogJson.class);
        } catch (IOException e) {
            throw new PersistenceException("cannot load catalog from " + file, e);
        }
        if (json == null) {
            throw new PersistenceException("catalog file " + file + " is empty");
        }
        return fromJson(json).validate();
    }

    static CatalogJson toJson(ResourceCatalog catalog) {
        CatalogJson json = new CatalogJson();
        for (ResourceDescriptor d : catalog.singletonResources()) {
            var r = new CatalogJson.ResourceJson();
            r.name = d.name();
            r.getCommand = d.command();
            json.singletonResources.add(r);
        }
        for (ResourceDescriptor d : catalog.independentResources()) {
            var r = new CatalogJson.ResourceJson();
            r.name = d.name();
            r.listCommand = d.command();
            json.firstPassResources.add(r);
        }
        for (ResourceDescriptor d : catalog.dependentResources()) {
            var r = new CatalogJson.ResourceJson();
            r.name = d.name();
            r.listCommand = d.command();
            r.sourceType = d.sourceType();
            r.sourceParameter = d.sourceParameter();
            if (d.isAssignment()) {
                AssignmentSpec a = d.assignment();
                var aj = new CatalogJson.AssignmentJson();
                aj.memberType = a.memberType();
                aj.memberParameter = a.memberParameter();
                aj.resourceType = a.resourceType();
                aj.command = a.command();
                r.assignment = aj;
            }
            json.secondPassResources.add(r);
        }
        return json;
    }

    static ResourceCatalog fromJson(CatalogJson json) {
        List<ResourceDescriptor> out = new ArrayList<>();
        try {
            for (CatalogJson.ResourceJson r : nullToEmpty(json.singletonResources)) {
                out.add(ResourceDescriptor.singleton(r.name, r.getCommand));
            }
            for (CatalogJson.ResourceJson r : nullToEmpty(json.firstPassResources)) {
                out.add(ResourceDescriptor.independent(r.name, r.listCommand));
            }
            for (CatalogJson.ResourceJson r : nullToEmpty(json.secondPassResources)) {
                String param = r.sourceParameter != null
                        ? r.sourceParameter
                        : (r.sourceType == null ? null : DefaultCatalog.parameterFor(r.sourceType));
                ResourceDescriptor d = ResourceDescriptor.dependent(r.name, r.listCommand, r.sourceType, param);
                if (r.assignment != null) {
                    var a = r.assignment;
                    d = d.withAssignment(new AssignmentSpec(a.memberType, a.memberParameter, a.resourceType, a.command));
                }
                out.add(d);
            }
        } catch (NullPointerException | IllegalArgumentException e) {
            throw new CatalogException("malformed catalog entry: " + e.getMessage(), e);
        }
        return new ResourceCatalog(out);
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }
}
