package com.vidnyan.mesh.domain.graph;

import com.vidnyan.mesh.SpecFixtures;
import com.vidnyan.mesh.domain.spec.Specification;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SpecSliceTest {

    @Test
    void toSpecification_ShouldCarryDefinitionsOfSlicedElementsOnly() {
        // Arrange
        Specification billing = SpecFixtures.billing();
        SpecSlice slice = new ImpactAnalyzer(SpecGraph.build(billing)).getSlice("create_invoice");

        // Act
        Specification sub = slice.toSpecification(billing);

        // Assert
        assertEquals(List.of("create_invoice"), List.copyOf(sub.functions().keySet()));
        assertSame(billing.functions().get("create_invoice"), sub.functions().get("create_invoice"));
        assertEquals(Set.of("Customer", "Invoice", "LineItem"), sub.entities().keySet());
        assertSame(billing.entities().get("LineItem"), sub.entities().get("LineItem"));
        assertEquals(Set.of("invoice_total", "invoice_with_tax"), sub.derived().keySet());
        assertSame(billing.derived().get("invoice_total"), sub.derived().get("invoice_total"));
        assertEquals(Set.of("InvoiceCreated"), sub.events().keySet());
        assertEquals(Set.of("SC-001"), sub.scenarios().keySet());
        assertEquals(Set.of("INV-001"), sub.invariants().keySet());
        assertEquals(Set.of("invoice_lifecycle"), sub.stateMachines().keySet());
        assertTrue(sub.roles().isEmpty());
    }

    @Test
    void toSpecification_ShouldSkipNamesTheSourceDoesNotDeclare() {
        SpecSlice slice = new SpecSlice("ghost", Set.of("Invoice", "Missing"), Set.of(), Set.of(), Set.of(),
                Set.of(), Set.of(), Set.of(), Set.of());

        Specification sub = slice.toSpecification(SpecFixtures.billing());

        assertTrue(sub.functions().isEmpty());
        assertEquals(Set.of("Invoice"), sub.entities().keySet());
    }
}
