package com.vidnyan.mesh.adapter.in.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.mesh.application.port.in.ValidateSpecUseCase;
import com.vidnyan.mesh.application.port.out.SpecificationLoadException;
import com.vidnyan.mesh.application.port.out.SpecificationLoader;
import com.vidnyan.mesh.application.port.out.SpecificationLoader.LoadedSpecification;
import com.vidnyan.mesh.config.MeshProperties;
import com.vidnyan.mesh.domain.rule.Severity;
import com.vidnyan.mesh.domain.rule.ValidationError;
import com.vidnyan.mesh.domain.rule.ValidationReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * CLI runner for validating a specification file.
 * Runs when the mesh.validate.path property is set and exits with 1 when the
 * specification is invalid.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ValidationCliRunner implements CommandLineRunner {

    private final SpecificationLoader specificationLoader;
    private final ValidateSpecUseCase validateSpecUseCase;
    private final MeshProperties properties;
    private final ObjectMapper objectMapper;
    private final ConfigurableApplicationContext context;

    @Value("${mesh.validate.path:}")
    private String specPath;

    @Value("${mesh.validate.report:}")
    private String reportPath;

    @Override
    public void run(String... args) {
        if (specPath == null || specPath.isBlank()) {
            log.info("No specification path specified. Set mesh.validate.path property.");
            return;
        }

        int exitCode = 1;
        try {
            log.info("╔══════════════════════════════════════════════════════════════╗");
            log.info("║           MESH - Specification Integrity Engine              ║");
            log.info("╠══════════════════════════════════════════════════════════════╣");
            log.info("║ Validating: {}", truncatePath(specPath, 48));
            log.info("╚══════════════════════════════════════════════════════════════╝");

            LoadedSpecification loaded = specificationLoader.load(Path.of(specPath));
            ValidationReport report = validateSpecUseCase.validate(loaded);

            printReport(report);
            writeReport(report);

            exitCode = exitCode(report);
            log.info("");
            log.info("Validation complete! Exit code {}", exitCode);
        } catch (SpecificationLoadException e) {
            log.error("Cannot load specification: {}", e.getMessage());
        } finally {
            int code = exitCode;
            System.exit(SpringApplication.exit(context, () -> code));
        }
    }

    int exitCode(ValidationReport report) {
        if (!report.valid()) {
            return 1;
        }
        return properties.isFailOnWarnings() && !report.warnings().isEmpty() ? 1 : 0;
    }

    private void printReport(ValidationReport report) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" VALIDATION RESULTS");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Rules run:  {}", report.ruleResults().size());
        log.info(" Duration:   {}ms", report.durationMs());
        log.info("───────────────────────────────────────────────────────────────");
        log.info(" DIAGNOSTICS:");
        log.info("   Critical: {}", report.count(Severity.CRITICAL));
        log.info("   Errors:   {}", report.count(Severity.ERROR));
        log.info("   Warnings: {}", report.count(Severity.WARNING));
        log.info("═══════════════════════════════════════════════════════════════");

        List<ValidationError> all = report.all();
        if (all.isEmpty()) {
            log.info("");
            log.info("No diagnostics. The specification is consistent.");
            return;
        }

        log.info("");
        log.info(" DETAILS:");
        log.info("───────────────────────────────────────────────────────────────");

        int limit = properties.getMaxReportedDiagnostics();
        for (int i = 0; i < all.size(); i++) {
            if (i >= limit) {
                log.info(" ... and {} more diagnostics", all.size() - limit);
                break;
            }
            ValidationError d = all.get(i);
            log.info("");
            log.info(" {} [{}] {}", d.severity().wireName().toUpperCase(), d.code(), d.path());
            log.info(" Message:  {}", d.message());
            if (d.expected() != null || d.actual() != null) {
                log.info(" Expected: {} / Actual: {}", d.expected(), d.actual());
            }
            if (d.validOptions() != null && !d.validOptions().isEmpty()) {
                log.info(" Options:  {}", String.join(", ", d.validOptions()));
            }
        }
    }

    private void writeReport(ValidationReport report) {
        if (reportPath == null || reportPath.isBlank()) {
            return;
        }
        try {
            objectMapper.writeValue(Path.of(reportPath).toFile(), report);
            log.info("Report written to {}", reportPath);
        } catch (IOException e) {
            log.warn("Could not write report to {}: {}", reportPath, e.getMessage());
        }
    }

    private String truncatePath(String path, int maxLen) {
        if (path.length() <= maxLen)
            return path;
        return "..." + path.substring(path.length() - maxLen + 3);
    }
}
