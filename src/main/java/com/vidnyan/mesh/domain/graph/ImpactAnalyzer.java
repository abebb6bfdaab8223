package com.vidnyan.mesh.domain.graph;

import com.vidnyan.mesh.domain.spec.Invariant;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.function.Function;

/**
 * Transitive queries over a {@link SpecGraph}: change impact and per-function slices.
 */
@Slf4j
public class ImpactAnalyzer {

    private final SpecGraph graph;

    public ImpactAnalyzer(SpecGraph graph) {
        this.graph = graph;
    }

    /**
     * Everything that transitively depends on {@code (kind, name)}, excluding the target.
     * Only a REMOVE whose closure reaches a function or scenario is breaking.
     */
    public ImpactAnalysis analyzeImpact(NodeKind kind, String name, ChangeType changeType) {
        NodeId target = NodeId.of(kind, name);
        if (!graph.contains(target)) {
            if (changeType != ChangeType.ADD) {
                log.warn("Impact target {} is not declared; nothing depends on it", target);
            }
            return ImpactAnalysis.of(target, changeType, List.of(), List.of());
        }

        Set<NodeId> affected = closure(target, graph::getDependents);
        affected.remove(target);

        List<String> breaking = new ArrayList<>();
        if (changeType == ChangeType.REMOVE) {
            affected.stream()
                    .filter(id -> id.kind() == NodeKind.FUNCTION || id.kind() == NodeKind.SCENARIO)
                    .sorted()
                    .forEach(id -> breaking.add(String.format("%s '%s' depends on removed %s '%s'",
                            id.kind().prefix(), id.name(), kind.prefix(), name)));
        }

        log.debug("Impact of {} {}: {} affected, {} breaking", changeType, target, affected.size(), breaking.size());
        return ImpactAnalysis.of(target, changeType, affected, breaking);
    }

    /**
     * The function's transitive dependencies plus the scenarios that call it, the
     * invariants over its entities and the state machines it triggers.
     *
     * @throws IllegalArgumentException if no such function is declared
     */
    public SpecSlice getSlice(String functionName) {
        NodeId function = NodeId.of(NodeKind.FUNCTION, functionName);
        if (!graph.contains(function)) {
            throw new IllegalArgumentException("Function '" + functionName + "' not found");
        }

        Set<NodeId> deps = closure(function, graph::getDependencies);
        deps.remove(function);

        Set<String> entities = names(deps, NodeKind.ENTITY);

        Set<String> scenarios = new TreeSet<>();
        Set<String> stateMachines = new TreeSet<>();
        for (GraphEdge edge : graph.edgesTo(function)) {
            if (edge.from().kind() == NodeKind.SCENARIO) {
                scenarios.add(edge.from().name());
            } else if (edge.from().kind() == NodeKind.STATE_MACHINE && edge.relation() == EdgeRelation.TRIGGERS) {
                stateMachines.add(edge.from().name());
            }
        }

        Set<String> invariants = new TreeSet<>();
        for (GraphNode node : graph.nodesOfKind(NodeKind.INVARIANT)) {
            Invariant invariant = (Invariant) node.definition();
            if (invariant.entity() != null && entities.contains(invariant.entity())) {
                invariants.add(node.name());
            }
        }

        return new SpecSlice(
                functionName,
                entities,
                names(deps, NodeKind.FIELD),
                names(deps, NodeKind.DERIVED),
                names(deps, NodeKind.FUNCTION),
                names(deps, NodeKind.EVENT),
                Collections.unmodifiableSet(scenarios),
                Collections.unmodifiableSet(invariants),
                Collections.unmodifiableSet(stateMachines));
    }

    /**
     * Breadth-first closure over {@code next}, including {@code start}.
     */
    private Set<NodeId> closure(NodeId start, Function<NodeId, Set<NodeId>> next) {
        Set<NodeId> visited = new LinkedHashSet<>();
        Queue<NodeId> queue = new ArrayDeque<>();
        queue.add(start);

        while (!queue.isEmpty()) {
            NodeId current = queue.poll();
            if (!visited.add(current)) continue;
            for (NodeId neighbour : next.apply(current)) {
                if (!visited.contains(neighbour)) {
                    queue.add(neighbour);
                }
            }
        }
        return visited;
    }

    private static Set<String> names(Set<NodeId> ids, NodeKind kind) {
        Set<String> names = new TreeSet<>();
        ids.stream().filter(id -> id.kind() == kind).forEach(id -> names.add(id.name()));
        return Collections.unmodifiableSet(names);
    }
}
