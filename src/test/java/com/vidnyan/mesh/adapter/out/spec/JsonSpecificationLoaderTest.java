package com.vidnyan.mesh.adapter.out.spec;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.mesh.application.port.out.SpecificationLoadException;
import com.vidnyan.mesh.application.port.out.SpecificationLoader.LoadedSpecification;
import com.vidnyan.mesh.domain.expression.*;
import com.vidnyan.mesh.domain.rule.ValidationError;
import com.vidnyan.mesh.domain.spec.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonSpecificationLoaderTest {

    @TempDir
    Path tempDir;

    private final JsonSpecificationLoader loader = new JsonSpecificationLoader(new ObjectMapper(), new ExpressionParser());

    private static String resource(String name) throws IOException {
        return Files.readString(Path.of("src/test/resources/specs", name));
    }

    @Test
    void load_ShouldReadEverySection() throws IOException {
        // Arrange
        Path file = tempDir.resolve("billing.json");
        Files.writeString(file, resource("billing.json"));

        // Act
        LoadedSpecification loaded = loader.load(file);

        // Assert
        Specification spec = loaded.specification();
        assertTrue(loaded.diagnostics().isEmpty(), () -> "Unexpected diagnostics " + loaded.diagnostics());
        assertEquals(List.of("Customer", "Invoice", "LineItem"), List.copyOf(spec.entities().keySet()));
        assertEquals("billing", spec.meta().get("name"));
        assertEquals(2, spec.functions().size());
        assertEquals(1, spec.invariants().size());
        assertEquals(2, spec.roles().size());
        assertEquals("30d", spec.deadlines().get("pay_within_30").duration());
        assertEquals("InvoiceCreated", spec.deadlines().get("pay_within_30").escalationEvent());
        assertEquals(List.of("email"), spec.constraints().get("unique_email").fields());
    }

    @Test
    void parse_ShouldReadFieldTypesAndBounds() throws IOException {
        Specification spec = loader.parse(resource("billing.json")).specification();

        FieldDefinition name = spec.entities().get("Customer").fields().get("name");
        assertTrue(name.required());
        assertEquals(1, name.minLength());
        assertEquals(80, name.maxLength());
        assertEquals("string", spec.entities().get("Customer").fields().get("email").type());

        FieldDefinition invoice = spec.entities().get("LineItem").fields().get("invoice");
        assertEquals("Invoice", invoice.ref());
        assertEquals(List.of("draft", "open", "paid"), spec.entities().get("Invoice").fields().get("status").enumValues());
        assertEquals(0, BigDecimal.ONE.compareTo(spec.entities().get("LineItem").fields().get("quantity").min()));
    }

    @Test
    void parse_ShouldAcceptStringAndStructuredFormulas() throws IOException {
        Specification spec = loader.parse(resource("billing.json")).specification();

        Expression.Aggregation total = assertInstanceOf(Expression.Aggregation.class,
                spec.derived().get("invoice_total").formula());
        assertEquals("LineItem", total.from());

        Expression expected = new Expression.Binary(BinaryOperator.MUL,
                new Expression.Call("invoice_total", List.of()),
                Expression.Literal.of(new BigDecimal("1.2")));
        assertEquals(expected, spec.derived().get("invoice_with_tax").formula());
    }

    @Test
    void parse_ShouldReadFunctionsScenariosAndStateMachines() throws IOException {
        Specification spec = loader.parse(resource("billing.json")).specification();

        FunctionDefinition create = spec.functions().get("create_invoice");
        assertEquals(2, create.pre().size());
        assertEquals(PostAction.Kind.CREATE, create.post().get(0).kind());
        assertEquals(new Expression.InputRef("invoice_with_tax"), create.post().get(0).values().get("total"));
        assertEquals(PostAction.Kind.EMIT, create.post().get(1).kind());
        assertEquals("NO_CUSTOMER", create.error().get(0).code());

        PostAction update = spec.functions().get("pay_invoice").post().get(0);
        assertEquals(PostAction.Kind.UPDATE, update.kind());
        assertEquals(Expression.Literal.of("paid"), update.values().get("status"));

        Scenario scenario = spec.scenarios().get("SC-001");
        assertEquals("create_invoice", scenario.call());
        assertEquals(1, scenario.assertions().size());

        StateMachine lifecycle = spec.stateMachines().get("invoice_lifecycle");
        assertTrue(lifecycle.states().get("paid").finalState());
        assertEquals("create_invoice", lifecycle.transitions().get(0).trigger());
        assertTrue(lifecycle.transitions().get(1).isGuarded());

        Role clerk = spec.roles().get("clerk");
        assertEquals(List.of("viewer"), clerk.inherits());
        assertEquals(List.of("create", "update"), clerk.entityPermissions().get(0).operations());
        assertEquals("Invoice", spec.roles().get("viewer").entityPermissions().get(0).entity());
    }

    @Test
    void parse_ShouldKeepGoingPastBrokenFormulas() throws IOException {
        // Act
        LoadedSpecification loaded = loader.parse(resource("broken.json"));

        // Assert
        List<ValidationError> diagnostics = loaded.diagnostics();
        assertEquals(List.of("derived.bad_formula.formula", "derived.bad_tree.formula"),
                diagnostics.stream().map(ValidationError::path).toList());
        assertTrue(diagnostics.stream().allMatch(d -> d.code().equals(JsonSpecificationLoader.PARSE_ERROR_CODE)));
        assertEquals("total +", diagnostics.get(0).actual());
        assertTrue(diagnostics.get(0).message().contains("position 7"));

        Specification spec = loaded.specification();
        assertNull(spec.derived().get("bad_formula").formula());
        assertNotNull(spec.derived().get("good").formula());
    }

    @Test
    void parse_ShouldAcceptStateAliasAndListedStates() {
        String json = """
                {
                  "state": { "Door": { "fields": { "position": "string" } } },
                  "stateMachines": {
                    "door": { "entity": "Door", "field": "position", "initial": "closed",
                              "states": ["closed", "open"],
                              "transitions": [ { "from": "closed", "to": "open", "trigger_event": "Pushed" } ] }
                  }
                }
                """;

        Specification spec = loader.parse(json).specification();

        assertTrue(spec.entities().containsKey("Door"));
        assertEquals(List.of("closed", "open"), List.copyOf(spec.stateMachines().get("door").states().keySet()));
        assertEquals("Pushed", spec.stateMachines().get("door").transitions().get(0).trigger());
    }

    @Test
    void parse_ShouldReportPostActionWithoutKind() {
        String json = """
                { "functions": { "noop": { "post": [ { "action": { "launch": "Rocket" } } ] } } }
                """;

        LoadedSpecification loaded = loader.parse(json);

        assertEquals(1, loaded.diagnostics().size());
        assertEquals("VAL-002", loaded.diagnostics().get(0).code());
        assertTrue(loaded.specification().functions().get("noop").post().isEmpty());
    }

    @Test
    void parse_ShouldRejectMalformedDocuments() {
        assertThrows(SpecificationLoadException.class, () -> loader.parse("{ not json"));
        assertThrows(SpecificationLoadException.class, () -> loader.parse("[1, 2]"));
    }

    @Test
    void load_ShouldWrapMissingFile() {
        SpecificationLoadException e = assertThrows(SpecificationLoadException.class,
                () -> loader.load(tempDir.resolve("missing.json")));
        assertTrue(e.getMessage().contains("missing.json"));
    }
}
