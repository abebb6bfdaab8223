package com.vidnyan.mesh.domain.graph;

import java.util.Objects;

/**
 * Identity of a graph node. Two ids are equal when kind and name are equal.
 */
public record NodeId(NodeKind kind, String name) implements Comparable<NodeId> {

    public NodeId {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(name, "name");
    }

    public static NodeId of(NodeKind kind, String name) {
        return new NodeId(kind, name);
    }

    public static NodeId field(String entity, String field) {
        return new NodeId(NodeKind.FIELD, entity + "." + field);
    }

    /**
     * Parses the rendered form {@code kind:name}.
     *
     * @throws IllegalArgumentException if the prefix is unknown or the name is empty
     */
    public static NodeId parse(String id) {
        int colon = id == null ? -1 : id.indexOf(':');
        if (colon <= 0 || colon == id.length() - 1) {
            throw new IllegalArgumentException("Malformed node id: " + id);
        }
        String prefix = id.substring(0, colon);
        NodeKind kind = NodeKind.fromPrefix(prefix)
                .orElseThrow(() -> new IllegalArgumentException("Unknown node kind '" + prefix + "' in id: " + id));
        return new NodeId(kind, id.substring(colon + 1));
    }

    @Override
    public int compareTo(NodeId other) {
        int byKind = kind.compareTo(other.kind);
        return byKind != 0 ? byKind : name.compareTo(other.name);
    }

    @Override
    public String toString() {
        return kind.prefix() + ":" + name;
    }
}
