package com.vidnyan.mesh.adapter.out.evaluator;

import com.vidnyan.mesh.SpecFixtures;
import com.vidnyan.mesh.domain.rule.Severity;
import com.vidnyan.mesh.domain.rule.ValidationError;
import com.vidnyan.mesh.domain.spec.DerivedDefinition;
import com.vidnyan.mesh.domain.spec.Specification;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.vidnyan.mesh.SpecFixtures.expr;
import static org.junit.jupiter.api.Assertions.*;

class DerivedCycleEvaluatorTest {

    private final DerivedCycleEvaluator evaluator = new DerivedCycleEvaluator();

    @Test
    void check_ShouldReportMutuallyRecursiveFormulas() {
        // Arrange
        Specification spec = Specification.builder()
                .entity("Order", SpecFixtures.entity("total", "decimal"))
                .derived("net", new DerivedDefinition("Order", expr("gross - tax"), "decimal"))
                .derived("gross", new DerivedDefinition("Order", expr("net(1) + 5"), "decimal"))
                .derived("tax", new DerivedDefinition("Order", expr("self.total * 0.2"), "decimal"))
                .build();

        // Act
        List<ValidationError> errors = evaluator.check(spec);

        // Assert
        assertEquals(1, errors.size());
        assertEquals("LGC-002", errors.get(0).code());
        assertEquals(Severity.WARNING, errors.get(0).severity());
        assertEquals("derived.net.formula", errors.get(0).path());
        assertEquals("net -> gross -> net", errors.get(0).actual());
    }

    @Test
    void check_ShouldNotConfuseOwnFieldWithDerivedOfSameName() {
        Specification spec = Specification.builder()
                .entity("Order", SpecFixtures.entity("total", "decimal"))
                .derived("total", new DerivedDefinition("Order", expr("self.total + 1"), "decimal"))
                .build();

        assertTrue(evaluator.check(spec).isEmpty());
    }

    @Test
    void check_ShouldAcceptBillingChain() {
        assertTrue(evaluator.check(SpecFixtures.billing()).isEmpty());
    }
}
