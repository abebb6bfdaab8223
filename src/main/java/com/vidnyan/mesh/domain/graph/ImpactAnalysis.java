package com.vidnyan.mesh.domain.graph;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.*;

/**
 * Blast radius of a proposed change: every element that transitively depends on
 * the target, bucketed by kind. Computed fresh per query.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ImpactAnalysis(
    String target,
    ChangeType changeType,
    Set<String> affectedEntities,
    Set<String> affectedFields,
    Set<String> affectedDerived,
    Set<String> affectedFunctions,
    Set<String> affectedScenarios,
    Set<String> affectedInvariants,
    Set<String> affectedStateMachines,
    Set<String> affectedEvents,
    Set<String> affectedSubscriptions,
    Set<String> affectedSagas,
    Set<String> affectedRoles,
    Set<String> affectedGateways,
    Set<String> affectedDeadlines,
    Set<String> affectedSchedules,
    Set<String> affectedConstraints,
    List<String> breakingChanges
) {

    static ImpactAnalysis of(NodeId target, ChangeType changeType, Collection<NodeId> affected,
                             List<String> breakingChanges) {
        Map<NodeKind, Set<String>> buckets = new EnumMap<>(NodeKind.class);
        for (NodeKind kind : NodeKind.values()) {
            buckets.put(kind, new TreeSet<>());
        }
        affected.forEach(id -> buckets.get(id.kind()).add(id.name()));
        return new ImpactAnalysis(
                target.toString(),
                changeType,
                frozen(buckets.get(NodeKind.ENTITY)),
                frozen(buckets.get(NodeKind.FIELD)),
                frozen(buckets.get(NodeKind.DERIVED)),
                frozen(buckets.get(NodeKind.FUNCTION)),
                frozen(buckets.get(NodeKind.SCENARIO)),
                frozen(buckets.get(NodeKind.INVARIANT)),
                frozen(buckets.get(NodeKind.STATE_MACHINE)),
                frozen(buckets.get(NodeKind.EVENT)),
                frozen(buckets.get(NodeKind.SUBSCRIPTION)),
                frozen(buckets.get(NodeKind.SAGA)),
                frozen(buckets.get(NodeKind.ROLE)),
                frozen(buckets.get(NodeKind.GATEWAY)),
                frozen(buckets.get(NodeKind.DEADLINE)),
                frozen(buckets.get(NodeKind.SCHEDULE)),
                frozen(buckets.get(NodeKind.CONSTRAINT)),
                List.copyOf(breakingChanges));
    }

    private static Set<String> frozen(Set<String> names) {
        return Collections.unmodifiableSet(names);
    }

    public int totalAffected() {
        return affectedEntities.size() + affectedFields.size() + affectedDerived.size()
                + affectedFunctions.size() + affectedScenarios.size() + affectedInvariants.size()
                + affectedStateMachines.size() + affectedEvents.size() + affectedSubscriptions.size()
                + affectedSagas.size() + affectedRoles.size() + affectedGateways.size()
                + affectedDeadlines.size() + affectedSchedules.size() + affectedConstraints.size();
    }

    public boolean isBreaking() {
        return !breakingChanges.isEmpty();
    }
}
