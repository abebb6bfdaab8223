package com.vidnyan.mesh.application.service;

import com.vidnyan.mesh.application.port.in.AnalyzeImpactUseCase;
import com.vidnyan.mesh.domain.graph.*;
import com.vidnyan.mesh.domain.spec.Specification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Set;

/**
 * Builds the dependency graph per request and answers queries over it.
 */
@Slf4j
@Service
public class ImpactAnalysisService implements AnalyzeImpactUseCase {

    @Override
    public ImpactAnalysis analyzeImpact(Specification spec, NodeKind kind, String name, ChangeType changeType) {
        ImpactAnalysis analysis = new ImpactAnalyzer(graph(spec)).analyzeImpact(kind, name, changeType);
        log.info("Impact of {} {}:{}: {} affected, breaking={}",
                changeType, kind.prefix(), name, analysis.totalAffected(), analysis.isBreaking());
        return analysis;
    }

    @Override
    public SpecSlice slice(Specification spec, String function) {
        return new ImpactAnalyzer(graph(spec)).getSlice(function);
    }

    @Override
    public Specification sliceSpecification(Specification spec, String function) {
        SpecSlice slice = slice(spec, function);
        Specification sub = slice.toSpecification(spec);
        log.info("Slice of {}: {} entities, {} derived, {} functions",
                function, sub.entities().size(), sub.derived().size(), sub.functions().size());
        return sub;
    }

    @Override
    public Set<NodeId> dependencies(Specification spec, NodeId node) {
        return graph(spec).getDependencies(node);
    }

    @Override
    public Set<NodeId> dependents(Specification spec, NodeId node) {
        return graph(spec).getDependents(node);
    }

    private SpecGraph graph(Specification spec) {
        SpecGraph graph = SpecGraph.build(spec);
        SpecGraph.Stats stats = graph.stats();
        log.debug("Built graph: {} nodes, {} edges ({} inferred)",
                stats.nodeCount(), stats.edgeCount(), stats.inferredEdgeCount());
        return graph;
    }
}
