package com.vidnyan.mesh.adapter.out.evaluator;

import com.vidnyan.mesh.domain.rule.Category;
import com.vidnyan.mesh.domain.rule.Severity;
import com.vidnyan.mesh.domain.rule.SpecRule;
import com.vidnyan.mesh.domain.rule.ValidationError;
import com.vidnyan.mesh.domain.spec.Specification;
import com.vidnyan.mesh.domain.spec.StateMachine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flags nondeterministic transitions: several transitions leave the same state on
 * the same trigger and at least one of them is unguarded. Groups where every
 * transition is guarded are not flagged, since guard exclusivity is not provable
 * statically.
 */
@Slf4j
@Component
public class TransitionConflictEvaluator implements SpecRule {

    public static final String CODE = "TRANS-001";

    @Override
    public String id() {
        return "transition-conflict";
    }

    @Override
    public List<ValidationError> check(Specification spec) {
        List<ValidationError> errors = new ArrayList<>();

        spec.stateMachines().forEach((name, sm) -> {
            Map<GroupKey, List<Integer>> groups = new LinkedHashMap<>();
            for (int i = 0; i < sm.transitions().size(); i++) {
                StateMachine.Transition t = sm.transitions().get(i);
                if (t.trigger() == null) {
                    continue;
                }
                groups.computeIfAbsent(new GroupKey(t.from(), t.trigger()), k -> new ArrayList<>()).add(i);
            }

            groups.forEach((key, indices) -> {
                if (indices.size() < 2) {
                    return;
                }
                List<Integer> unguarded = indices.stream()
                        .filter(i -> !sm.transitions().get(i).isGuarded())
                        .toList();
                if (!unguarded.isEmpty()) {
                    long guarded = indices.size() - unguarded.size();
                    errors.add(ValidationError.builder()
                            .path("stateMachines." + name + ".transitions[" + unguarded.get(0) + "]")
                            .code(CODE)
                            .category(Category.LOGIC)
                            .severity(Severity.ERROR)
                            .message("Multiple transitions " + indices + " from '" + key.from() + "' on '"
                                    + key.trigger() + "' with unguarded transitions " + unguarded)
                            .expected("mutually exclusive guards or single transition")
                            .actual(indices.size() + " transitions, " + guarded + " guarded")
                            .build());
                }
            });
        });

        log.debug("Transition conflict check found {} conflicts", errors.size());
        return errors;
    }

    private record GroupKey(String from, String trigger) {
    }
}
