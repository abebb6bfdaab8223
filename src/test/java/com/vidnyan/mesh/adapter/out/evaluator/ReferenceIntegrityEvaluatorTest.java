package com.vidnyan.mesh.adapter.out.evaluator;

import com.vidnyan.mesh.SpecFixtures;
import com.vidnyan.mesh.domain.rule.Category;
import com.vidnyan.mesh.domain.rule.ValidationError;
import com.vidnyan.mesh.domain.spec.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceIntegrityEvaluatorTest {

    private final ReferenceIntegrityEvaluator evaluator = new ReferenceIntegrityEvaluator();

    @Test
    void check_ShouldAcceptConsistentSpecification() {
        assertTrue(evaluator.check(SpecFixtures.billing()).isEmpty());
    }

    @Test
    void check_ShouldReportUnknownTargetsWithOptions() {
        // Arrange
        Specification spec = SpecFixtures.billingBuilder()
                .function("refund", SpecFixtures.function(Map.of(), List.of(), List.of(
                        new PostAction(PostAction.Kind.DELETE, "Payment", null, Map.of()),
                        new PostAction(PostAction.Kind.EMIT, "Refunded", null, Map.of()),
                        new PostAction(PostAction.Kind.CALL, "notify", null, Map.of()))))
                .role("clerk", new Role(List.of("manager"), List.of(), List.of()))
                .build();

        // Act
        List<ValidationError> errors = evaluator.check(spec);

        // Assert
        ValidationError entity = find(errors, "functions.refund.post[0].delete");
        assertEquals("REF-001", entity.code());
        assertEquals(Category.REFERENCE, entity.category());
        assertEquals("Payment", entity.actual());
        assertEquals(List.of("Customer", "Invoice", "LineItem"), entity.validOptions());

        assertEquals("REF-003", find(errors, "functions.refund.post[1].emit").code());
        assertEquals("REF-002", find(errors, "functions.refund.post[2].call").code());
        assertEquals("REF-004", find(errors, "roles.clerk.inherits").code());
        assertEquals(4, errors.size());
    }

    @Test
    void check_ShouldResolvePluralAndCaseVariantsOfEntities() {
        Specification spec = SpecFixtures.billingBuilder()
                .invariant("INV-002", new Invariant("INV-002", "invoices", SpecFixtures.expr("true")))
                .build();

        assertTrue(evaluator.check(spec).isEmpty());
    }

    @Test
    void check_ShouldReportUnknownFieldsOfKnownEntities() {
        Specification spec = SpecFixtures.billingBuilder()
                .constraint("unique_email", new Constraint("unique", "Customer", List.of("email", "phone")))
                .build();

        List<ValidationError> errors = evaluator.check(spec);

        assertEquals(1, errors.size());
        assertEquals("REF-007", errors.get(0).code());
        assertEquals("constraints.unique_email.fields[1]", errors.get(0).path());
        assertEquals("phone", errors.get(0).actual());
    }

    @Test
    void check_ShouldCoverSubscriptionsSagasAndSchedules() {
        Specification spec = SpecFixtures.billingBuilder()
                .subscription("on_created", new Subscription("InvoiceCreated", "send_mail"))
                .saga("checkout", new Saga(List.of(new Saga.SagaStep("bill", "create_invoice", "void_invoice"))))
                .schedule("nightly", new Schedule("0 0 * * *", "pay_invoice"))
                .build();

        List<ValidationError> errors = evaluator.check(spec);

        assertEquals(List.of("subscriptions.on_created.handler", "sagas.checkout.steps[0].compensation"),
                errors.stream().map(ValidationError::path).toList());
    }

    private static ValidationError find(List<ValidationError> errors, String path) {
        return errors.stream()
                .filter(e -> e.path().equals(path))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No diagnostic at " + path + " in " + errors));
    }
}
