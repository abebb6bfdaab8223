package com.vidnyan.mesh.adapter.out.evaluator;

import com.vidnyan.mesh.domain.rule.Category;
import com.vidnyan.mesh.domain.rule.Severity;
import com.vidnyan.mesh.domain.rule.SpecRule;
import com.vidnyan.mesh.domain.rule.ValidationError;
import com.vidnyan.mesh.domain.spec.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Structural pointers that name undeclared elements.
 * <ul>
 *   <li>REF-001 unknown entity</li>
 *   <li>REF-002 unknown function</li>
 *   <li>REF-003 unknown event</li>
 *   <li>REF-004 unknown role</li>
 *   <li>REF-007 unknown entity field</li>
 * </ul>
 */
@Slf4j
@Component
public class ReferenceIntegrityEvaluator implements SpecRule {

    @Override
    public String id() {
        return "reference-integrity";
    }

    @Override
    public List<ValidationError> check(Specification spec) {
        Checker checker = new Checker(spec);

        spec.entities().forEach((entity, def) -> def.fields().forEach((field, fd) -> {
            if (fd.hasRef()) {
                checker.entity("entities." + entity + ".fields." + field + ".ref", fd.ref());
            }
        }));

        spec.derived().forEach((name, def) -> {
            if (def.entity() != null) {
                checker.entity("derived." + name + ".entity", def.entity());
            }
        });

        spec.functions().forEach((name, fn) -> {
            String base = "functions." + name;
            fn.input().forEach((input, fd) -> {
                if (fd.hasRef()) {
                    checker.entity(base + ".input." + input + ".ref", fd.ref());
                }
            });
            for (int i = 0; i < fn.post().size(); i++) {
                PostAction action = fn.post().get(i);
                String path = base + ".post[" + i + "]." + action.kind().key();
                switch (action.kind()) {
                    case CREATE, UPDATE, DELETE -> checker.entity(path, action.target());
                    case EMIT -> checker.event(path, action.target());
                    case CALL -> checker.function(path, action.target());
                }
            }
        });

        spec.scenarios().forEach((name, scenario) -> {
            if (scenario.call() != null) {
                checker.function("scenarios." + name + ".when.call", scenario.call());
            }
            scenario.given().keySet().forEach(entity -> checker.entity("scenarios." + name + ".given." + entity, entity));
        });

        spec.invariants().forEach((name, inv) -> {
            if (inv.entity() != null) {
                checker.entity("invariants." + name + ".entity", inv.entity());
            }
        });

        spec.stateMachines().forEach((name, sm) -> {
            String base = "stateMachines." + name;
            if (checker.entity(base + ".entity", sm.entity())) {
                checker.field(base + ".field", sm.entity(), sm.field());
            }
        });

        spec.roles().forEach((name, role) -> {
            role.inherits().forEach(parent -> checker.role("roles." + name + ".inherits", parent));
            for (int i = 0; i < role.entityPermissions().size(); i++) {
                checker.entity("roles." + name + ".entityPermissions[" + i + "].entity",
                        role.entityPermissions().get(i).entity());
            }
        });

        spec.events().forEach((name, event) -> event.payload().forEach((field, fd) -> {
            if (fd.hasRef()) {
                checker.entity("events." + name + ".payload." + field + ".ref", fd.ref());
            }
        }));

        spec.subscriptions().forEach((name, sub) -> {
            checker.event("subscriptions." + name + ".event", sub.event());
            checker.function("subscriptions." + name + ".handler", sub.handler());
        });

        spec.sagas().forEach((name, saga) -> {
            for (int i = 0; i < saga.steps().size(); i++) {
                Saga.SagaStep step = saga.steps().get(i);
                String path = "sagas." + name + ".steps[" + i + "]";
                checker.function(path + ".action", step.action());
                if (step.compensation() != null) {
                    checker.function(path + ".compensation", step.compensation());
                }
            }
        });

        spec.gateways().forEach((name, gateway) -> {
            for (int i = 0; i < gateway.flows().size(); i++) {
                checker.function("gateways." + name + ".flows[" + i + "].target", gateway.flows().get(i).target());
            }
        });

        spec.deadlines().forEach((name, deadline) -> {
            String base = "deadlines." + name;
            checker.entity(base + ".entity", deadline.entity());
            if (deadline.action() != null) {
                checker.function(base + ".action", deadline.action());
            }
            if (deadline.escalationEvent() != null) {
                checker.event(base + ".escalationEvent", deadline.escalationEvent());
            }
        });

        spec.schedules().forEach((name, schedule) -> checker.function("schedules." + name + ".action", schedule.action()));

        spec.constraints().forEach((name, constraint) -> {
            String base = "constraints." + name;
            if (checker.entity(base + ".entity", constraint.entity())) {
                for (int i = 0; i < constraint.fields().size(); i++) {
                    checker.field(base + ".fields[" + i + "]", constraint.entity(), constraint.fields().get(i));
                }
            }
        });

        log.debug("Reference integrity check found {} unknown references", checker.errors.size());
        return checker.errors;
    }

    /**
     * Accumulates diagnostics for one pass.
     */
    private static final class Checker {

        private final Specification spec;
        private final EntityResolver resolver;
        private final List<ValidationError> errors = new ArrayList<>();

        Checker(Specification spec) {
            this.spec = spec;
            this.resolver = EntityResolver.of(spec);
        }

        boolean entity(String path, String name) {
            if (name != null && resolver.isKnown(name)) {
                return true;
            }
            errors.add(unknown(path, "REF-001", "entity", name, spec.entities().keySet()));
            return false;
        }

        void field(String path, String entity, String field) {
            String resolved = resolver.resolve(entity).map(EntityResolver.Resolution::entity).orElse(entity);
            Map<String, FieldDefinition> fields = spec.entities().get(resolved).fields();
            if (field == null || !fields.containsKey(field)) {
                errors.add(unknown(path, "REF-007", "field of entity '" + resolved + "'", field, fields.keySet()));
            }
        }

        void function(String path, String name) {
            if (name == null || !spec.functions().containsKey(name)) {
                errors.add(unknown(path, "REF-002", "function", name, spec.functions().keySet()));
            }
        }

        void event(String path, String name) {
            if (name == null || !spec.events().containsKey(name)) {
                errors.add(unknown(path, "REF-003", "event", name, spec.events().keySet()));
            }
        }

        void role(String path, String name) {
            if (name == null || !spec.roles().containsKey(name)) {
                errors.add(unknown(path, "REF-004", "role", name, spec.roles().keySet()));
            }
        }

        private static ValidationError unknown(String path, String code, String what, String name,
                                               Collection<String> declared) {
            return ValidationError.builder()
                    .path(path)
                    .code(code)
                    .category(Category.REFERENCE)
                    .severity(Severity.ERROR)
                    .message(name == null
                            ? "Missing " + what + " reference"
                            : "Unknown " + what + " '" + name + "'")
                    .actual(name)
                    .validOptions(Diagnostics.options(declared))
                    .build();
        }
    }
}
