package com.architecture.memory.graphdiff.service.patch;

import com.architecture.memory.graphdiff.dto.patch.GraphPatch;
import com.architecture.memory.graphdiff.dto.patch.PatchOp;
import com.architecture.memory.graphdiff.dto.patch.PatchOperation;
import com.architecture.memory.graphdiff.exception.InvalidPatchOperationException;
import com.architecture.memory.graphdiff.exception.PatchIntegrityException;
import com.architecture.memory.graphdiff.exception.PatchTargetNotFoundException;
import com.architecture.memory.graphdiff.model.graph.EntityKind;
import com.architecture.memory.graphdiff.model.graph.GraphEdge;
import com.architecture.memory.graphdiff.model.graph.GraphEntity;
import com.architecture.memory.graphdiff.model.graph.GraphNode;
import com.architecture.memory.graphdiff.model.graph.GraphSnapshot;
import com.architecture.memory.graphdiff.service.diff.JsonValues;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Replays a patch against a snapshot and returns the resulting snapshot.
 *
 * The input snapshot is never modified: operations run against a deep working copy
 * in which every entity is held as a mutable document
 * ({@code id, type, [source, target,] data}). The patch checksum is verified before
 * anything is applied. A failing operation stops the replay; the raised exception
 * names the operation and carries the working copy with all earlier operations applied.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PatchApplier {

    private static final String ID = "id";
    private static final String TYPE = "type";
    private static final String SOURCE = "source";
    private static final String TARGET = "target";
    private static final String DATA = "data";
    private static final String CONNECTION = "connection";

    private static final Set<String> NODE_PROPERTIES = Set.of(TYPE, DATA);
    private static final Set<String> EDGE_PROPERTIES = Set.of(TYPE, SOURCE, TARGET, DATA, CONNECTION);

    private final PatchChecksumCalculator checksumCalculator;
    private final ObjectMapper objectMapper;

    /**
     * @throws PatchIntegrityException if the checksum does not match the operations
     * @throws PatchTargetNotFoundException if an operation targets an entity that does not exist
     * @throws InvalidPatchOperationException if an operation is malformed or cannot be applied
     */
    public GraphSnapshot apply(GraphSnapshot snapshot, GraphPatch patch) {
        verify(patch);

        WorkingGraph graph = new WorkingGraph(snapshot);
        List<PatchOperation> operations = patch.getOperations();

        for (int i = 0; i < operations.size(); i++) {
            PatchOperation operation = operations.get(i);
            try {
                applyOperation(operation, graph);
            } catch (MissingTargetException e) {
                log.warn("Patch {} operation #{} ({} {}) targets a missing entity", patch.getId(), i,
                        operation.getOp(), operation.getPath());
                throw new PatchTargetNotFoundException(e.getMessage(), i, operation, graph.toSnapshot());
            } catch (InvalidOperationException | IllegalArgumentException e) {
                log.warn("Patch {} operation #{} ({} {}) rejected: {}", patch.getId(), i,
                        operation.getOp(), operation.getPath(), e.getMessage());
                throw new InvalidPatchOperationException(e.getMessage(), i, operation, graph.toSnapshot());
            }
        }

        GraphSnapshot result = graph.toSnapshot();
        log.info("Applied patch {} ({} operations): {} nodes, {} edges",
                patch.getId(), operations.size(), result.getNodes().size(), result.getEdges().size());
        return result;
    }

    public void verify(GraphPatch patch) {
        String computed = checksumCalculator.calculate(patch.getOperations());
        if (!computed.equals(patch.getChecksum())) {
            log.error("Refusing to apply patch {}: checksum mismatch", patch.getId());
            throw new PatchIntegrityException(patch.getId(), patch.getChecksum(), computed);
        }
    }

    // ========================= DISPATCH =========================

    private void applyOperation(PatchOperation operation, WorkingGraph graph) {
        if (operation.getOp() == null) {
            throw new InvalidOperationException("Missing op");
        }
        PatchPath path = PatchPath.parse(operation.getPath());

        if (path.isEntityPath()) {
            applyEntityOperation(operation, path, graph);
        } else {
            applyPropertyOperation(operation, path, graph);
        }
    }

    private void applyEntityOperation(PatchOperation operation, PatchPath path, WorkingGraph graph) {
        Map<String, Map<String, Object>> entities = graph.collection(path.getKind());

        switch (operation.getOp()) {
            case ADD -> {
                if (entities.containsKey(path.getEntityId())) {
                    throw new InvalidOperationException("Entity already exists: " + path);
                }
                entities.put(path.getEntityId(), toDocument(operation.getValue(), path));
            }
            case REMOVE -> {
                requireEntity(entities, path);
                entities.remove(path.getEntityId());
            }
            case REPLACE -> {
                requireEntity(entities, path);
                entities.put(path.getEntityId(), toDocument(operation.getValue(), path));
            }
            case TEST -> {
                Map<String, Object> current = requireEntity(entities, path);
                Map<String, Object> expected = toDocument(operation.getValue(), path);
                if (!JsonValues.deepEquals(current, expected)) {
                    throw new InvalidOperationException("Test failed for " + path);
                }
            }
            case MOVE, COPY -> throw new InvalidOperationException(
                    operation.getOp().getName() + " is only supported between entity properties");
        }
    }

    private void applyPropertyOperation(PatchOperation operation, PatchPath path, WorkingGraph graph) {
        Map<String, Object> document = requireEntity(graph.collection(path.getKind()), path);

        switch (operation.getOp()) {
            case ADD, REPLACE -> setProperty(document, path, operation.getValue());
            case REMOVE -> removeProperty(document, path);
            case TEST -> {
                Object actual = getProperty(document, path);
                if (!JsonValues.deepEquals(actual, operation.getValue())) {
                    throw new InvalidOperationException("Test failed for " + path + ": expected "
                            + operation.getValue() + " but was " + actual);
                }
            }
            case COPY, MOVE -> {
                PatchPath from = PatchPath.parse(requireFrom(operation));
                if (from.isEntityPath()) {
                    throw new InvalidOperationException("'from' must point at an entity property: " + from);
                }
                Map<String, Object> fromDocument = requireEntity(graph.collection(from.getKind()), from);
                Object value = JsonValues.deepCopy(getProperty(fromDocument, from));
                setProperty(document, path, value);
                if (operation.getOp() == PatchOp.MOVE
                        && !from.equals(path)) {
                    removeProperty(fromDocument, from);
                }
            }
        }
    }

    private static String requireFrom(PatchOperation operation) {
        if (operation.getFrom() == null) {
            throw new InvalidOperationException(operation.getOp().getName() + " requires 'from'");
        }
        return operation.getFrom();
    }

    private static Map<String, Object> requireEntity(Map<String, Map<String, Object>> entities, PatchPath path) {
        Map<String, Object> document = entities.get(path.getEntityId());
        if (document == null) {
            throw new MissingTargetException("No " + path.getKind().name().toLowerCase()
                    + " with id '" + path.getEntityId() + "'");
        }
        return document;
    }

    // ========================= PROPERTY ACCESS =========================

    private Object getProperty(Map<String, Object> document, PatchPath path) {
        List<String> properties = path.getProperties();
        checkProperty(path);

        if (CONNECTION.equals(path.head())) {
            requireLength(path, 1);
            return connectionOf(document);
        }

        Object current = document;
        for (String segment : properties) {
            current = child(current, segment, path);
        }
        return current;
    }

    private void setProperty(Map<String, Object> document, PatchPath path, Object value) {
        checkProperty(path);
        String head = path.head();
        List<String> properties = path.getProperties();

        if (properties.size() == 1) {
            switch (head) {
                case TYPE, SOURCE, TARGET -> {
                    if (value != null && !(value instanceof String)) {
                        throw new InvalidOperationException(head + " must be a string: " + path);
                    }
                    document.put(head, value);
                }
                case CONNECTION -> {
                    if (!(value instanceof Map<?, ?> connection)) {
                        throw new InvalidOperationException("connection must be an object with source and target");
                    }
                    Object source = connection.get(SOURCE);
                    Object target = connection.get(TARGET);
                    if (!(source instanceof String) || !(target instanceof String)) {
                        throw new InvalidOperationException("connection source and target must be strings");
                    }
                    document.put(SOURCE, source);
                    document.put(TARGET, target);
                }
                case DATA -> {
                    if (!(value instanceof Map)) {
                        throw new InvalidOperationException("data must be an object: " + path);
                    }
                    document.put(DATA, JsonValues.deepCopy(value));
                }
                default -> throw new InvalidOperationException("Unsupported property: " + path);
            }
            return;
        }

        if (CONNECTION.equals(head)) {
            throw new InvalidOperationException("connection has no nested properties: " + path);
        }

        // Validate the whole walk before creating any intermediate level.
        walk(document, properties, path, false);
        Object container = walk(document, properties, path, true);
        String last = properties.get(properties.size() - 1);
        write(container, last, JsonValues.deepCopy(value), path);
    }

    private void removeProperty(Map<String, Object> document, PatchPath path) {
        checkProperty(path);
        List<String> properties = path.getProperties();

        if (properties.size() == 1) {
            throw new InvalidOperationException("Cannot remove required property: " + path);
        }

        Object container = document;
        for (String segment : properties.subList(0, properties.size() - 1)) {
            container = child(container, segment, path);
        }

        String last = properties.get(properties.size() - 1);
        if (container instanceof Map<?, ?> map) {
            if (!map.containsKey(last)) {
                throw new InvalidOperationException("No property at " + path);
            }
            map.remove(last);
        } else if (container instanceof List<?> list) {
            list.remove(index(last, list.size(), path));
        } else {
            throw new InvalidOperationException("Cannot remove from a scalar at " + path);
        }
    }

    /**
     * Walks to the container of the last segment. With {@code create} missing levels become
     * empty maps; without it the walk only checks that no scalar blocks the way.
     */
    private Object walk(Map<String, Object> document, List<String> properties, PatchPath path, boolean create) {
        Object current = document;
        for (String segment : properties.subList(0, properties.size() - 1)) {
            if (current == null) {
                return null;    // dry run beyond a missing level
            }
            if (current instanceof Map<?, ?> raw) {
                Map<String, Object> map = JsonValues.asMap(raw);
                Object next = map.get(segment);
                if (next == null && create) {
                    next = new LinkedHashMap<String, Object>();
                    map.put(segment, next);
                }
                current = next;
            } else if (current instanceof List<?> list) {
                current = list.get(index(segment, list.size(), path));
            } else {
                throw new InvalidOperationException("Cannot descend into a scalar at '" + segment + "' in " + path);
            }
        }
        if (current != null && !(current instanceof Map) && !(current instanceof List)) {
            throw new InvalidOperationException("Cannot set a property on a scalar in " + path);
        }
        return current;
    }

    @SuppressWarnings("unchecked")
    private static void write(Object container, String key, Object value, PatchPath path) {
        if (container instanceof Map<?, ?> map) {
            ((Map<String, Object>) map).put(key, value);
        } else if (container instanceof List<?> raw) {
            List<Object> list = (List<Object>) raw;
            if ("-".equals(key)) {
                list.add(value);
            } else {
                list.set(index(key, list.size(), path), value);
            }
        } else {
            throw new InvalidOperationException("No container for " + path);
        }
    }

    private static Object child(Object current, String segment, PatchPath path) {
        if (current instanceof Map<?, ?> map) {
            if (!map.containsKey(segment)) {
                throw new InvalidOperationException("No property '" + segment + "' in " + path);
            }
            return map.get(segment);
        }
        if (current instanceof List<?> list) {
            return list.get(index(segment, list.size(), path));
        }
        throw new InvalidOperationException("Cannot descend into a scalar at '" + segment + "' in " + path);
    }

    private static int index(String segment, int size, PatchPath path) {
        try {
            int index = Integer.parseInt(segment);
            if (index < 0 || index >= size) {
                throw new InvalidOperationException("Index " + index + " out of bounds in " + path);
            }
            return index;
        } catch (NumberFormatException e) {
            throw new InvalidOperationException("Not a list index: '" + segment + "' in " + path);
        }
    }

    private static void checkProperty(PatchPath path) {
        String head = path.head();
        if (ID.equals(head)) {
            throw new InvalidOperationException("Entity ids cannot be patched: " + path);
        }
        Set<String> allowed = path.getKind() == EntityKind.NODE ? NODE_PROPERTIES : EDGE_PROPERTIES;
        if (!allowed.contains(head)) {
            throw new InvalidOperationException("Unsupported property '" + head + "' for "
                    + path.getKind().name().toLowerCase() + ": " + path);
        }
    }

    private static void requireLength(PatchPath path, int length) {
        if (path.getProperties().size() != length) {
            throw new InvalidOperationException("Unexpected nested path: " + path);
        }
    }

    private static Map<String, Object> connectionOf(Map<String, Object> document) {
        Map<String, Object> connection = new LinkedHashMap<>();
        connection.put(SOURCE, document.get(SOURCE));
        connection.put(TARGET, document.get(TARGET));
        return connection;
    }

    // ========================= DOCUMENTS =========================

    private Map<String, Object> toDocument(Object value, PatchPath path) {
        if (value == null) {
            throw new InvalidOperationException("Missing value for " + path);
        }

        GraphEntity entity;
        if (value instanceof GraphEntity graphEntity) {
            entity = graphEntity;
        } else if (path.getKind() == EntityKind.NODE) {
            entity = objectMapper.convertValue(value, GraphNode.class);
        } else {
            entity = objectMapper.convertValue(value, GraphEdge.class);
        }

        if (entity.getKind() != path.getKind()) {
            throw new InvalidOperationException("Value is a " + entity.getKind() + " but path targets " + path);
        }
        if (entity.getId() != null && !entity.getId().equals(path.getEntityId())) {
            throw new InvalidOperationException("Value id '" + entity.getId() + "' does not match " + path);
        }

        Map<String, Object> document = WorkingGraph.document(entity);
        document.put(ID, path.getEntityId());
        return document;
    }

    private static class MissingTargetException extends RuntimeException {
        MissingTargetException(String message) {
            super(message);
        }
    }

    private static class InvalidOperationException extends RuntimeException {
        InvalidOperationException(String message) {
            super(message);
        }
    }

    /**
     * Mutable copy of a snapshot: id-keyed documents per collection, in snapshot order.
     */
    private static final class WorkingGraph {

        private final Map<String, Map<String, Object>> nodes = new LinkedHashMap<>();
        private final Map<String, Map<String, Object>> edges = new LinkedHashMap<>();

        WorkingGraph(GraphSnapshot snapshot) {
            snapshot.getNodes().forEach(node -> nodes.putIfAbsent(node.getId(), document(node)));
            snapshot.getEdges().forEach(edge -> edges.putIfAbsent(edge.getId(), document(edge)));
        }

        Map<String, Map<String, Object>> collection(EntityKind kind) {
            return kind == EntityKind.NODE ? nodes : edges;
        }

        static Map<String, Object> document(GraphEntity entity) {
            Map<String, Object> document = new LinkedHashMap<>();
            document.put(ID, entity.getId());
            document.put(TYPE, entity.getType());
            if (entity instanceof GraphEdge edge) {
                document.put(SOURCE, edge.getSource());
                document.put(TARGET, edge.getTarget());
            }
            document.put(DATA, JsonValues.deepCopyMap(entity.getData()));
            return document;
        }

        GraphSnapshot toSnapshot() {
            GraphSnapshot.GraphSnapshotBuilder builder = GraphSnapshot.builder();
            nodes.values().forEach(document -> builder.node(GraphNode.builder()
                    .id((String) document.get(ID))
                    .type((String) document.get(TYPE))
                    .data(frozenData(document))
                    .build()));
            edges.values().forEach(document -> builder.edge(GraphEdge.builder()
                    .id((String) document.get(ID))
                    .source((String) document.get(SOURCE))
                    .target((String) document.get(TARGET))
                    .type((String) document.get(TYPE))
                    .data(frozenData(document))
                    .build()));
            return builder.build();
        }

        // Each snapshot gets its own copy so later operations cannot leak into it.
        private static Map<String, Object> frozenData(Map<String, Object> document) {
            return Collections.unmodifiableMap(
                    JsonValues.deepCopyMap(JsonValues.asMap(document.get(DATA))));
        }
    }
}
