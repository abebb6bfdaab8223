package com.vidnyan.mesh;

import com.vidnyan.mesh.domain.expression.Expression;
import com.vidnyan.mesh.domain.expression.ExpressionParser;
import com.vidnyan.mesh.domain.spec.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared specifications for tests.
 */
public final class SpecFixtures {

    private static final ExpressionParser PARSER = new ExpressionParser();

    private SpecFixtures() {
    }

    public static Expression expr(String formula) {
        return PARSER.parse(formula);
    }

    public static EntityDefinition entity(Object... nameTypePairs) {
        Map<String, FieldDefinition> fields = new LinkedHashMap<>();
        for (int i = 0; i < nameTypePairs.length; i += 2) {
            Object def = nameTypePairs[i + 1];
            fields.put((String) nameTypePairs[i],
                    def instanceof FieldDefinition fd ? fd : FieldDefinition.of((String) def));
        }
        return new EntityDefinition(fields);
    }

    public static FunctionDefinition function(Map<String, FieldDefinition> input, List<String> pre, List<PostAction> post) {
        return new FunctionDefinition(input, pre.stream().map(SpecFixtures::expr).toList(), post, List.of());
    }

    public static StateMachine.Transition transition(String from, String to, String trigger, String guard) {
        return new StateMachine.Transition(from, to, trigger, guard == null ? null : expr(guard));
    }

    /**
     * Customers, invoices and line items with two derived values, three functions,
     * one scenario, one invariant and an invoice lifecycle.
     */
    public static Specification billing() {
        return billingBuilder().build();
    }

    public static Specification.Builder billingBuilder() {
        Map<String, StateMachine.StateDefinition> states = new LinkedHashMap<>();
        states.put("draft", new StateMachine.StateDefinition(false));
        states.put("open", new StateMachine.StateDefinition(false));
        states.put("paid", new StateMachine.StateDefinition(true));

        return Specification.builder()
                .entity("Customer", entity("name", "string", "email", "string"))
                .entity("Invoice", entity("customerId", "string", "total", "decimal", "status", "string"))
                .entity("LineItem", entity(
                        "invoice_ref", FieldDefinition.reference("string", "Invoice"),
                        "quantity", "integer",
                        "unitPrice", "decimal"))
                .derived("invoice_total", new DerivedDefinition("Invoice",
                        expr("sum(lineItems.quantity * lineItems.unitPrice)"), "decimal"))
                .derived("invoice_with_tax", new DerivedDefinition("Invoice",
                        expr("invoice_total * 1.2"), "decimal"))
                .function("create_invoice", function(
                        Map.of("customerId", FieldDefinition.of("string")),
                        List.of("customer.email is not null"),
                        List.of(
                                new PostAction(PostAction.Kind.CREATE, "Invoice", null,
                                        Map.of("total", expr("invoice_with_tax"))),
                                new PostAction(PostAction.Kind.EMIT, "InvoiceCreated", null, Map.of()))))
                .function("pay_invoice", function(
                        Map.of(),
                        List.of("invoice.status = 'open'"),
                        List.of(new PostAction(PostAction.Kind.UPDATE, "Invoice", null,
                                Map.of("status", expr("'paid'"))))))
                .function("archive_customer", function(Map.of(), List.of("customer.name is not null"), List.of()))
                .event("InvoiceCreated", new EventDefinition(Map.of("invoiceId", FieldDefinition.of("string"))))
                .scenario("SC-001", new Scenario(
                        Map.of("Customer", Map.of("name", "Ada")),
                        "create_invoice",
                        List.of(expr("result.total > 0"))))
                .invariant("INV-001", new Invariant("INV-001", "Invoice", expr("self.total >= 0")))
                .stateMachine("invoice_lifecycle", new StateMachine("Invoice", "status", states, "draft", List.of(
                        transition("draft", "open", "create_invoice", null),
                        transition("open", "paid", "pay_invoice", null))));
    }
}
