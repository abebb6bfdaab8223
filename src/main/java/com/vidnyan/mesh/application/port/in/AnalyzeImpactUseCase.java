package com.vidnyan.mesh.application.port.in;

import com.vidnyan.mesh.domain.graph.ChangeType;
import com.vidnyan.mesh.domain.graph.ImpactAnalysis;
import com.vidnyan.mesh.domain.graph.NodeId;
import com.vidnyan.mesh.domain.graph.NodeKind;
import com.vidnyan.mesh.domain.graph.SpecSlice;
import com.vidnyan.mesh.domain.spec.Specification;

import java.util.Set;

/**
 * Queries over the dependency graph of a specification.
 */
public interface AnalyzeImpactUseCase {

    /**
     * Everything that transitively depends on the named element.
     */
    ImpactAnalysis analyzeImpact(Specification spec, NodeKind kind, String name, ChangeType changeType);

    /**
     * The minimal part of the specification a function needs.
     *
     * @throws IllegalArgumentException if the function is not declared
     */
    SpecSlice slice(Specification spec, String function);

    /**
     * The definitions behind {@link #slice}, as a self-contained specification.
     *
     * @throws IllegalArgumentException if the function is not declared
     */
    Specification sliceSpecification(Specification spec, String function);

    Set<NodeId> dependencies(Specification spec, NodeId node);

    Set<NodeId> dependents(Specification spec, NodeId node);
}
