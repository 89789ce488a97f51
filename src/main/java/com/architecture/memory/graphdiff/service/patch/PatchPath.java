package com.architecture.memory.graphdiff.service.patch;

import com.architecture.memory.graphdiff.model.graph.EntityKind;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed patch path: {@code /{nodes|edges}/{entityId}[/{property}...]}.
 * Segments are escaped as in JSON Pointer ({@code ~0} for '~', {@code ~1} for '/').
 */
@Value
public class PatchPath {

    EntityKind kind;
    String entityId;
    List<String> properties;

    public boolean isEntityPath() {
        return properties.isEmpty();
    }

    public String head() {
        return properties.get(0);
    }

    public static PatchPath of(EntityKind kind, String entityId, List<String> properties) {
        return new PatchPath(kind, entityId, List.copyOf(properties));
    }

    /**
     * @throws IllegalArgumentException if the path is not of the expected form
     */
    public static PatchPath parse(String path) {
        if (path == null || !path.startsWith("/")) {
            throw new IllegalArgumentException("Patch path must start with '/': " + path);
        }

        String[] raw = path.substring(1).split("/", -1);
        if (raw.length < 2) {
            throw new IllegalArgumentException("Patch path must name a collection and an entity id: " + path);
        }

        EntityKind kind = EntityKind.fromCollection(raw[0]);
        String entityId = unescape(raw[1]);
        if (entityId.isEmpty()) {
            throw new IllegalArgumentException("Patch path has an empty entity id: " + path);
        }

        List<String> properties = new ArrayList<>(raw.length - 2);
        for (int i = 2; i < raw.length; i++) {
            properties.add(unescape(raw[i]));
        }
        return of(kind, entityId, properties);
    }

    public String format() {
        StringBuilder sb = new StringBuilder()
                .append('/').append(kind.getCollection())
                .append('/').append(escape(entityId));
        for (String property : properties) {
            sb.append('/').append(escape(property));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return format();
    }

    static String escape(String segment) {
        return segment.replace("~", "~0").replace("/", "~1");
    }

    static String unescape(String segment) {
        return segment.replace("~1", "/").replace("~0", "~");
    }
}
