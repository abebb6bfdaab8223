package com.vidnyan.mesh.domain.graph;

import com.vidnyan.mesh.domain.spec.Specification;

import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Everything one function needs: what it transitively depends on, the scenarios
 * exercising it, invariants over the entities it touches, and the state machines
 * it drives.
 */
public record SpecSlice(
    String function,
    Set<String> entities,
    Set<String> fields,
    Set<String> derived,
    Set<String> functions,
    Set<String> events,
    Set<String> scenarios,
    Set<String> invariants,
    Set<String> stateMachines
) {

    /**
     * The induced sub-specification: the definitions behind every name in this
     * slice, the sliced function first. Names {@code source} does not declare are skipped.
     */
    public Specification toSpecification(Specification source) {
        Specification.Builder builder = Specification.builder();
        if (source.functions().containsKey(function)) {
            builder.function(function, source.functions().get(function));
        }
        copy(functions, source.functions(), builder::function);
        copy(entities, source.entities(), builder::entity);
        copy(derived, source.derived(), builder::derived);
        copy(events, source.events(), builder::event);
        copy(scenarios, source.scenarios(), builder::scenario);
        copy(invariants, source.invariants(), builder::invariant);
        copy(stateMachines, source.stateMachines(), builder::stateMachine);
        return builder.build();
    }

    private static <V> void copy(Set<String> names, Map<String, V> declared, BiConsumer<String, V> sink) {
        for (String name : names) {
            V definition = declared.get(name);
            if (definition != null) {
                sink.accept(name, definition);
            }
        }
    }
}
