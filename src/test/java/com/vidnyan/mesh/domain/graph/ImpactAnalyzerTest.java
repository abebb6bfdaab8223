package com.vidnyan.mesh.domain.graph;

import com.vidnyan.mesh.SpecFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ImpactAnalyzerTest {

    private ImpactAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new ImpactAnalyzer(SpecGraph.build(SpecFixtures.billing()));
    }

    @Test
    void analyzeImpact_RemovingEntityShouldBreakDependentFunctionsAndScenarios() {
        // Act
        ImpactAnalysis impact = analyzer.analyzeImpact(NodeKind.ENTITY, "Invoice", ChangeType.REMOVE);

        // Assert
        assertEquals("entity:Invoice", impact.target());
        assertEquals(Set.of("create_invoice", "pay_invoice"), impact.affectedFunctions());
        assertEquals(Set.of("SC-001"), impact.affectedScenarios());
        assertEquals(Set.of("invoice_total", "invoice_with_tax"), impact.affectedDerived());
        assertEquals(Set.of("INV-001"), impact.affectedInvariants());
        assertEquals(Set.of("invoice_lifecycle"), impact.affectedStateMachines());
        assertEquals(Set.of("InvoiceCreated"), impact.affectedEvents());
        assertTrue(impact.affectedFields().contains("LineItem.invoice_ref"));
        assertFalse(impact.affectedEntities().contains("Invoice"));
        assertEquals(List.of(
                "function 'create_invoice' depends on removed entity 'Invoice'",
                "function 'pay_invoice' depends on removed entity 'Invoice'",
                "scenario 'SC-001' depends on removed entity 'Invoice'"), impact.breakingChanges());
        assertTrue(impact.isBreaking());
    }

    @Test
    void analyzeImpact_ModifyShouldReportSameClosureWithoutBreakingChanges() {
        ImpactAnalysis removal = analyzer.analyzeImpact(NodeKind.ENTITY, "Invoice", ChangeType.REMOVE);
        ImpactAnalysis modification = analyzer.analyzeImpact(NodeKind.ENTITY, "Invoice", ChangeType.MODIFY);

        assertEquals(removal.affectedFunctions(), modification.affectedFunctions());
        assertEquals(removal.totalAffected(), modification.totalAffected());
        assertTrue(modification.breakingChanges().isEmpty());
        assertFalse(modification.isBreaking());
    }

    @Test
    void analyzeImpact_ShouldNotReachUnrelatedElements() {
        ImpactAnalysis impact = analyzer.analyzeImpact(NodeKind.ENTITY, "Invoice", ChangeType.MODIFY);

        assertFalse(impact.affectedFunctions().contains("archive_customer"));
    }

    @Test
    void analyzeImpact_RemovingDerivedShouldFollowDerivationChain() {
        ImpactAnalysis impact = analyzer.analyzeImpact(NodeKind.DERIVED, "invoice_total", ChangeType.REMOVE);

        assertEquals(Set.of("invoice_with_tax"), impact.affectedDerived());
        assertEquals(Set.of("create_invoice"), impact.affectedFunctions());
        assertEquals(Set.of("SC-001"), impact.affectedScenarios());
        assertEquals(2, impact.breakingChanges().size());
    }

    @Test
    void analyzeImpact_UnknownTargetShouldBeEmpty() {
        ImpactAnalysis added = analyzer.analyzeImpact(NodeKind.ENTITY, "Refund", ChangeType.ADD);
        ImpactAnalysis removed = analyzer.analyzeImpact(NodeKind.ENTITY, "Refund", ChangeType.REMOVE);

        assertEquals(0, added.totalAffected());
        assertEquals(0, removed.totalAffected());
        assertFalse(removed.isBreaking());
    }

    @Test
    void getSlice_ShouldCollectEverythingTheFunctionNeeds() {
        // Act
        SpecSlice slice = analyzer.getSlice("create_invoice");

        // Assert
        assertEquals("create_invoice", slice.function());
        assertEquals(Set.of("Customer", "Invoice", "LineItem"), slice.entities());
        assertEquals(Set.of("invoice_total", "invoice_with_tax"), slice.derived());
        assertEquals(Set.of("InvoiceCreated"), slice.events());
        assertTrue(slice.fields().contains("Customer.email"));
        assertTrue(slice.fields().contains("LineItem.unitPrice"));
        assertEquals(Set.of("SC-001"), slice.scenarios());
        assertEquals(Set.of("INV-001"), slice.invariants());
        assertEquals(Set.of("invoice_lifecycle"), slice.stateMachines());
        assertTrue(slice.functions().isEmpty());
    }

    @Test
    void getSlice_ShouldRejectUnknownFunction() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> analyzer.getSlice("refund"));
        assertEquals("Function 'refund' not found", e.getMessage());
    }
}
