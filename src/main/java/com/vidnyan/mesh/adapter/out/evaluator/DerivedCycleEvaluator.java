package com.vidnyan.mesh.adapter.out.evaluator;

import com.vidnyan.mesh.domain.expression.Expression;
import com.vidnyan.mesh.domain.expression.ReferenceCollector;
import com.vidnyan.mesh.domain.graph.CycleDetector;
import com.vidnyan.mesh.domain.rule.Category;
import com.vidnyan.mesh.domain.rule.Severity;
import com.vidnyan.mesh.domain.rule.SpecRule;
import com.vidnyan.mesh.domain.rule.ValidationError;
import com.vidnyan.mesh.domain.spec.DerivedDefinition;
import com.vidnyan.mesh.domain.spec.Specification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Detects derived formulas that reference themselves, directly or through other
 * derived formulas. Cycles are warnings and do not make a specification invalid.
 */
@Slf4j
@Component
public class DerivedCycleEvaluator implements SpecRule {

    public static final String CODE = "LGC-002";

    @Override
    public String id() {
        return "derived-cycle";
    }

    @Override
    public List<ValidationError> check(Specification spec) {
        Map<String, Set<String>> graph = new LinkedHashMap<>();
        spec.derived().forEach((name, def) -> graph.put(name, derivedReferences(spec, def)));

        List<ValidationError> warnings = new ArrayList<>();
        for (List<String> cycle : CycleDetector.findCycles(graph)) {
            String chain = String.join(" -> ", cycle);
            warnings.add(ValidationError.builder()
                    .path("derived." + cycle.get(0) + ".formula")
                    .code(CODE)
                    .category(Category.LOGIC)
                    .severity(Severity.WARNING)
                    .message("Circular derived formula reference: " + chain)
                    .actual(chain)
                    .build());
        }

        log.debug("Derived cycle check over {} formulas found {} cycles", graph.size(), warnings.size());
        return warnings;
    }

    /**
     * Derived names a formula mentions: calls, bare identifiers and {@code self.x}
     * where {@code x} is a derived rather than a field of the owning entity.
     */
    private Set<String> derivedReferences(Specification spec, DerivedDefinition def) {
        Set<String> refs = new LinkedHashSet<>();
        if (def.formula() == null) {
            return refs;
        }
        Map<String, DerivedDefinition> derived = spec.derived();
        ReferenceCollector.References collected = ReferenceCollector.collect(def.formula());

        collected.calls().stream().filter(derived::containsKey).forEach(refs::add);
        collected.inputs().stream().filter(derived::containsKey).forEach(refs::add);
        for (Expression.FieldRef ref : collected.fieldRefs()) {
            if (ref.field().isEmpty() && derived.containsKey(ref.root())) {
                refs.add(ref.root());
            }
        }
        var ownFields = def.entity() != null && spec.entities().containsKey(def.entity())
                ? spec.entities().get(def.entity()).fields().keySet()
                : Set.<String>of();
        collected.selfFields().stream()
                .filter(f -> derived.containsKey(f) && !ownFields.contains(f))
                .forEach(refs::add);
        return refs;
    }
}
