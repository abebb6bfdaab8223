package com.vidnyan.mesh.domain.graph;

import com.vidnyan.mesh.domain.expression.Confidence;
import com.vidnyan.mesh.domain.spec.Specification;

import java.util.*;

/**
 * Typed dependency graph over every named element of a specification.
 * Immutable once built; use {@link #build(Specification)}.
 */
public final class SpecGraph {

    private final Map<NodeId, GraphNode> nodes;
    private final Map<GraphEdge.Key, GraphEdge> edges;
    private final Map<NodeId, Set<NodeId>> dependencies; // node → nodes it points at
    private final Map<NodeId, Set<NodeId>> dependents;   // node → nodes pointing at it

    SpecGraph(Map<NodeId, GraphNode> nodes, Map<GraphEdge.Key, GraphEdge> edges) {
        Map<NodeId, Set<NodeId>> deps = new LinkedHashMap<>();
        Map<NodeId, Set<NodeId>> revDeps = new LinkedHashMap<>();
        for (GraphEdge edge : edges.values()) {
            deps.computeIfAbsent(edge.from(), k -> new LinkedHashSet<>()).add(edge.to());
            revDeps.computeIfAbsent(edge.to(), k -> new LinkedHashSet<>()).add(edge.from());
        }
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.edges = Collections.unmodifiableMap(new LinkedHashMap<>(edges));
        this.dependencies = Collections.unmodifiableMap(deps);
        this.dependents = Collections.unmodifiableMap(revDeps);
    }

    /**
     * Build the graph of a specification. Same input, same node and edge sets.
     */
    public static SpecGraph build(Specification spec) {
        return new SpecGraphBuilder(spec).build();
    }

    public Collection<GraphNode> nodes() {
        return nodes.values();
    }

    public Collection<GraphEdge> edges() {
        return edges.values();
    }

    public Optional<GraphNode> node(NodeId id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public boolean contains(NodeId id) {
        return nodes.containsKey(id);
    }

    public List<GraphNode> nodesOfKind(NodeKind kind) {
        return nodes.values().stream().filter(n -> n.kind() == kind).toList();
    }

    /**
     * Nodes this node points at (one hop).
     */
    public Set<NodeId> getDependencies(NodeId id) {
        return Collections.unmodifiableSet(dependencies.getOrDefault(id, Set.of()));
    }

    /**
     * Nodes pointing at this node (one hop).
     */
    public Set<NodeId> getDependents(NodeId id) {
        return Collections.unmodifiableSet(dependents.getOrDefault(id, Set.of()));
    }

    public List<GraphEdge> edgesFrom(NodeId id) {
        return edges.values().stream().filter(e -> e.from().equals(id)).toList();
    }

    public List<GraphEdge> edgesTo(NodeId id) {
        return edges.values().stream().filter(e -> e.to().equals(id)).toList();
    }

    public boolean hasEdge(NodeId from, NodeId to, EdgeRelation relation) {
        return edges.containsKey(new GraphEdge.Key(from, to, relation));
    }

    public Optional<GraphEdge> edge(NodeId from, NodeId to, EdgeRelation relation) {
        return Optional.ofNullable(edges.get(new GraphEdge.Key(from, to, relation)));
    }

    /**
     * Mermaid flowchart of the whole graph. Inferred edges are drawn dotted.
     */
    public String toMermaid() {
        StringBuilder out = new StringBuilder("graph LR\n");
        out.append("    classDef entity fill:#e1f5fe\n");
        out.append("    classDef derived fill:#fff3e0\n");
        out.append("    classDef function fill:#e8f5e9\n");
        out.append("    classDef scenario fill:#fce4ec\n");
        out.append("    classDef invariant fill:#f3e5f5\n");
        for (GraphNode node : nodes.values()) {
            out.append("    ").append(mermaidId(node.id()))
                    .append("[\"").append(node.name()).append("\"]:::").append(node.kind().prefix())
                    .append('\n');
        }
        for (GraphEdge edge : edges.values()) {
            String arrow = edge.confidence() == Confidence.INFERRED ? "-.->" : "-->";
            out.append("    ").append(mermaidId(edge.from()))
                    .append(' ').append(arrow).append('|').append(edge.relation().label()).append("| ")
                    .append(mermaidId(edge.to()))
                    .append('\n');
        }
        return out.toString();
    }

    private static String mermaidId(NodeId id) {
        return (id.kind().prefix() + "_" + id.name()).replaceAll("[^A-Za-z0-9_]", "_");
    }

    public Stats stats() {
        Map<NodeKind, Integer> byKind = new EnumMap<>(NodeKind.class);
        for (GraphNode node : nodes.values()) {
            byKind.merge(node.kind(), 1, Integer::sum);
        }
        int inferred = (int) edges.values().stream()
                .filter(e -> e.confidence() == Confidence.INFERRED)
                .count();
        return new Stats(nodes.size(), edges.size(), inferred, byKind);
    }

    public record Stats(int nodeCount, int edgeCount, int inferredEdgeCount, Map<NodeKind, Integer> nodesByKind) {}
}
