package com.vidnyan.mesh.adapter.out.evaluator;

import com.vidnyan.mesh.domain.graph.CycleDetector;
import com.vidnyan.mesh.domain.rule.Category;
import com.vidnyan.mesh.domain.rule.Severity;
import com.vidnyan.mesh.domain.rule.SpecRule;
import com.vidnyan.mesh.domain.rule.ValidationError;
import com.vidnyan.mesh.domain.spec.Role;
import com.vidnyan.mesh.domain.spec.Specification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reports every cycle in role inheritance. Parents that are not declared roles
 * are skipped here and reported as unknown references.
 */
@Slf4j
@Component
public class RoleInheritanceCycleEvaluator implements SpecRule {

    public static final String CODE = "LGC-001";

    @Override
    public String id() {
        return "role-inheritance-cycle";
    }

    @Override
    public List<ValidationError> check(Specification spec) {
        Map<String, List<String>> inherits = new LinkedHashMap<>();
        for (Map.Entry<String, Role> entry : spec.roles().entrySet()) {
            inherits.put(entry.getKey(), entry.getValue().inherits());
        }

        List<ValidationError> errors = new ArrayList<>();
        for (List<String> cycle : CycleDetector.findCycles(inherits)) {
            String chain = String.join(" -> ", cycle);
            errors.add(ValidationError.builder()
                    .path("roles." + cycle.get(0))
                    .code(CODE)
                    .category(Category.LOGIC)
                    .severity(Severity.ERROR)
                    .message("Circular role inheritance: " + chain)
                    .expected("acyclic role inheritance")
                    .actual(chain)
                    .build());
        }

        log.debug("Role inheritance check over {} roles found {} cycles", inherits.size(), errors.size());
        return errors;
    }
}
