package com.vidnyan.mesh.adapter.out.evaluator;

import com.vidnyan.mesh.SpecFixtures;
import com.vidnyan.mesh.domain.rule.Category;
import com.vidnyan.mesh.domain.rule.ValidationError;
import com.vidnyan.mesh.domain.spec.Specification;
import com.vidnyan.mesh.domain.spec.StateMachine;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.vidnyan.mesh.SpecFixtures.transition;
import static org.junit.jupiter.api.Assertions.*;

class TransitionConflictEvaluatorTest {

    private final TransitionConflictEvaluator evaluator = new TransitionConflictEvaluator();

    private static Specification orderSpec(StateMachine.Transition... transitions) {
        return Specification.builder()
                .entity("Order", SpecFixtures.entity("status", "string", "total", "decimal"))
                .stateMachine("order_flow", new StateMachine("Order", "status",
                        Map.of("pending", new StateMachine.StateDefinition(false),
                                "approved", new StateMachine.StateDefinition(true),
                                "review", new StateMachine.StateDefinition(true)),
                        "pending", List.of(transitions)))
                .build();
    }

    @Test
    void check_ShouldFlagUnguardedTransitionSharingSourceAndTrigger() {
        // Arrange
        Specification spec = orderSpec(
                transition("pending", "approved", "approve", null),
                transition("pending", "review", "approve", "self.total > 1000"));

        // Act
        List<ValidationError> errors = evaluator.check(spec);

        // Assert
        assertEquals(1, errors.size());
        ValidationError error = errors.get(0);
        assertEquals("TRANS-001", error.code());
        assertEquals(Category.LOGIC, error.category());
        assertEquals("stateMachines.order_flow.transitions[0]", error.path());
        assertEquals("mutually exclusive guards or single transition", error.expected());
        assertEquals("2 transitions, 1 guarded", error.actual());
    }

    @Test
    void check_ShouldPointAtUnguardedMemberOfGroup() {
        Specification spec = orderSpec(
                transition("pending", "review", "approve", "self.total > 1000"),
                transition("pending", "approved", "approve", null));

        List<ValidationError> errors = evaluator.check(spec);

        assertEquals(1, errors.size());
        assertEquals("stateMachines.order_flow.transitions[1]", errors.get(0).path());
        assertTrue(errors.get(0).message().contains("unguarded transitions [1]"));
        assertEquals("2 transitions, 1 guarded", errors.get(0).actual());
    }

    @Test
    void check_ShouldAcceptFullyGuardedGroups() {
        Specification spec = orderSpec(
                transition("pending", "approved", "approve", "self.total <= 1000"),
                transition("pending", "review", "approve", "self.total > 1000"));

        assertTrue(evaluator.check(spec).isEmpty());
    }

    @Test
    void check_ShouldIgnoreDifferentTriggersAndMissingTriggers() {
        Specification spec = orderSpec(
                transition("pending", "approved", "approve", null),
                transition("pending", "review", "escalate", null),
                transition("pending", "review", null, null),
                transition("pending", "approved", null, null));

        assertTrue(evaluator.check(spec).isEmpty());
    }
}
