package com.vidnyan.mesh.domain.graph;

/**
 * A node and the specification element it was built from.
 */
public record GraphNode(NodeId id, Object definition) {

    public NodeKind kind() {
        return id.kind();
    }

    public String name() {
        return id.name();
    }
}
