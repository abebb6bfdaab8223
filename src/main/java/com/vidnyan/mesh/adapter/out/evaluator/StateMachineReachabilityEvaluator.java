package com.vidnyan.mesh.adapter.out.evaluator;

import com.vidnyan.mesh.domain.rule.Category;
import com.vidnyan.mesh.domain.rule.Severity;
import com.vidnyan.mesh.domain.rule.SpecRule;
import com.vidnyan.mesh.domain.rule.ValidationError;
import com.vidnyan.mesh.domain.spec.Specification;
import com.vidnyan.mesh.domain.spec.StateMachine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Structural checks per state machine:
 * <ul>
 *   <li>FSM-001 missing or undeclared initial state (error)</li>
 *   <li>FSM-002 transition from/to an undeclared state (error)</li>
 *   <li>FSM-003 state unreachable from the initial state (warning)</li>
 *   <li>FSM-004 non-final state without outgoing transitions (warning)</li>
 *   <li>REF-005 trigger that names neither a function nor an event (error)</li>
 * </ul>
 */
@Slf4j
@Component
public class StateMachineReachabilityEvaluator implements SpecRule {

    @Override
    public String id() {
        return "state-machine-reachability";
    }

    @Override
    public List<ValidationError> check(Specification spec) {
        List<ValidationError> diagnostics = new ArrayList<>();
        spec.stateMachines().forEach((name, sm) -> checkMachine(spec, name, sm, diagnostics));
        log.debug("State machine check over {} machines found {} diagnostics",
                spec.stateMachines().size(), diagnostics.size());
        return diagnostics;
    }

    private void checkMachine(Specification spec, String name, StateMachine sm, List<ValidationError> out) {
        String base = "stateMachines." + name;
        Set<String> states = sm.states().keySet();

        boolean initialDeclared = sm.initial() != null && states.contains(sm.initial());
        if (!initialDeclared) {
            out.add(ValidationError.builder()
                    .path(base + ".initial")
                    .code("FSM-001")
                    .category(Category.REFERENCE)
                    .severity(Severity.ERROR)
                    .message(sm.initial() == null || sm.initial().isBlank()
                            ? "State machine '" + name + "' has no initial state"
                            : "Initial state '" + sm.initial() + "' is not a declared state")
                    .actual(sm.initial())
                    .validOptions(Diagnostics.options(states))
                    .build());
        }

        for (int i = 0; i < sm.transitions().size(); i++) {
            StateMachine.Transition t = sm.transitions().get(i);
            String path = base + ".transitions[" + i + "]";
            checkEndpoint(path, "source", t.from(), states, out);
            checkEndpoint(path, "target", t.to(), states, out);

            if (t.trigger() != null
                    && !spec.functions().containsKey(t.trigger())
                    && !spec.events().containsKey(t.trigger())) {
                List<String> candidates = new ArrayList<>(spec.functions().keySet());
                candidates.addAll(spec.events().keySet());
                out.add(ValidationError.builder()
                        .path(path + ".trigger")
                        .code("REF-005")
                        .category(Category.REFERENCE)
                        .severity(Severity.ERROR)
                        .message("Transition trigger '" + t.trigger() + "' is neither a function nor an event")
                        .actual(t.trigger())
                        .validOptions(Diagnostics.options(candidates))
                        .build());
            }
        }

        if (initialDeclared) {
            Set<String> reachable = reachableFrom(sm.initial(), sm.transitions());
            for (String state : states) {
                if (!reachable.contains(state)) {
                    out.add(ValidationError.builder()
                            .path(base + ".states." + state)
                            .code("FSM-003")
                            .category(Category.LOGIC)
                            .severity(Severity.WARNING)
                            .message("State '" + state + "' is unreachable from initial state '" + sm.initial() + "'")
                            .build());
                }
            }
        }

        Set<String> withOutgoing = new HashSet<>();
        sm.transitions().forEach(t -> withOutgoing.add(t.from()));
        sm.states().forEach((state, def) -> {
            if (!def.finalState() && !withOutgoing.contains(state)) {
                out.add(ValidationError.builder()
                        .path(base + ".states." + state)
                        .code("FSM-004")
                        .category(Category.LOGIC)
                        .severity(Severity.WARNING)
                        .message("State '" + state + "' has no outgoing transitions and is not marked final")
                        .expected("final: true or an outgoing transition")
                        .build());
            }
        });
    }

    private void checkEndpoint(String path, String role, String state, Set<String> states, List<ValidationError> out) {
        if (state == null || !states.contains(state)) {
            out.add(ValidationError.builder()
                    .path(path)
                    .code("FSM-002")
                    .category(Category.REFERENCE)
                    .severity(Severity.ERROR)
                    .message("Transition " + role + " '" + state + "' is not a declared state")
                    .actual(state)
                    .validOptions(Diagnostics.options(states))
                    .build());
        }
    }

    /**
     * Fixed point over all transitions, starting from {@code initial}.
     */
    static Set<String> reachableFrom(String initial, List<StateMachine.Transition> transitions) {
        Set<String> reachable = new LinkedHashSet<>();
        reachable.add(initial);
        boolean changed = true;
        while (changed) {
            changed = false;
            for (StateMachine.Transition t : transitions) {
                if (reachable.contains(t.from()) && t.to() != null && reachable.add(t.to())) {
                    changed = true;
                }
            }
        }
        return reachable;
    }
}
