package com.vidnyan.mesh.adapter.in.cli;

import com.vidnyan.mesh.config.MeshProperties;
import com.vidnyan.mesh.domain.rule.Severity;
import com.vidnyan.mesh.domain.rule.ValidationError;
import com.vidnyan.mesh.domain.rule.ValidationReport;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ValidationCliRunnerTest {

    private static final ValidationError WARNING = ValidationError.builder()
            .code("LGC-003").severity(Severity.WARNING).message("Cannot infer aggregation source").build();
    private static final ValidationError ERROR = ValidationError.builder()
            .code("REF-001").message("Unknown entity").build();

    @Test
    void exitCode_ShouldFailOnErrors() {
        ValidationCliRunner runner = runner(new MeshProperties());

        assertEquals(1, runner.exitCode(ValidationReport.of(List.of(ERROR), List.of(), 0)));
        assertEquals(0, runner.exitCode(ValidationReport.of(List.of(), List.of(), 0)));
    }

    @Test
    void exitCode_ShouldTolerateWarningsUnlessConfigured() {
        MeshProperties strict = new MeshProperties();
        strict.setFailOnWarnings(true);
        ValidationReport report = ValidationReport.of(List.of(WARNING), List.of(), 0);

        assertEquals(0, runner(new MeshProperties()).exitCode(report));
        assertEquals(1, runner(strict).exitCode(report));
    }

    private static ValidationCliRunner runner(MeshProperties properties) {
        return new ValidationCliRunner(null, null, properties, null, null);
    }
}
