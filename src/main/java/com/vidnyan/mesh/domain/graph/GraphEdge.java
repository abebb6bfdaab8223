package com.vidnyan.mesh.domain.graph;

import com.vidnyan.mesh.domain.expression.Confidence;

/**
 * Directed edge {@code from -> to}. Identity within a graph is {@link #key()};
 * {@code confidence} records whether the target was named explicitly or inferred.
 */
public record GraphEdge(NodeId from, NodeId to, EdgeRelation relation, Confidence confidence) {

    public Key key() {
        return new Key(from, to, relation);
    }

    public record Key(NodeId from, NodeId to, EdgeRelation relation) {
    }

    @Override
    public String toString() {
        return from + " -[" + relation.label() + "]-> " + to;
    }
}
