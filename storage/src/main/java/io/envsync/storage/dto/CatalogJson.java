// file: storage/src/main/java/io/envsync/storage/dto/CatalogJson.java
package io.envsync.storage.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON shape of a resource catalog file.
 */
public class CatalogJson {
    public List<ResourceJson> singletonResources = new ArrayList<>();
    public List<ResourceJson> firstPassResources = new ArrayList<>();
    public List<ResourceJson> secondPassResources = new ArrayList<>();

    public static class ResourceJson {
        public String name;
        public String listCommand;
        public String getCommand;
        public String sourceType;
        public String sourceParameter;
        public AssignmentJson assignment;
    }

    public static class AssignmentJson {
        public String memberType;
        public String memberParameter;
        public String resourceType;
        public String command;
    }
}
