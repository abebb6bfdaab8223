package com.vidnyan.mesh.application.service;

import com.vidnyan.mesh.application.port.in.ValidateSpecUseCase;
import com.vidnyan.mesh.application.port.out.SpecificationLoader.LoadedSpecification;
import com.vidnyan.mesh.config.MeshProperties;
import com.vidnyan.mesh.domain.rule.*;
import com.vidnyan.mesh.domain.spec.Specification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs every enabled rule over a specification and assembles the report.
 * Validation is exhaustive: a failing rule is recorded and the rest still run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SpecValidationService implements ValidateSpecUseCase {

    public static final String RULE_FAILURE_CODE = "VAL-999";

    private final List<SpecRule> rules;
    private final MeshProperties properties;

    @Override
    public ValidationReport validate(LoadedSpecification loaded) {
        Instant startTime = Instant.now();
        Specification spec = loaded.specification();
        log.info("Starting validation: {} entities, {} functions, {} state machines",
                spec.entities().size(), spec.functions().size(), spec.stateMachines().size());

        List<ValidationError> diagnostics = new ArrayList<>(loaded.diagnostics());
        if (!loaded.diagnostics().isEmpty()) {
            log.info("Carrying {} diagnostics from loading", loaded.diagnostics().size());
        }

        List<RuleResult> ruleResults = new ArrayList<>();
        for (SpecRule rule : rules) {
            if (properties.getDisabledRules().contains(rule.id())) {
                log.debug("  Skipping disabled rule: {}", rule.id());
                ruleResults.add(RuleResult.skipped(rule.id(), "Disabled by configuration"));
                continue;
            }

            log.debug("  Running rule: {}", rule.id());
            Instant ruleStart = Instant.now();
            try {
                List<ValidationError> found = rule.check(spec);
                ruleResults.add(RuleResult.success(rule.id(), found, Duration.between(ruleStart, Instant.now())));
                diagnostics.addAll(found);
                if (!found.isEmpty()) {
                    log.info("  {} found {} diagnostics", rule.id(), found.size());
                }
            } catch (RuntimeException e) {
                log.error("Error running rule {}: {}", rule.id(), e.getMessage(), e);
                ValidationError failure = ValidationError.builder()
                        .path("")
                        .code(RULE_FAILURE_CODE)
                        .category(Category.SCHEMA)
                        .severity(Severity.CRITICAL)
                        .message("Rule '" + rule.id() + "' failed: " + e.getMessage())
                        .build();
                ruleResults.add(RuleResult.error(rule.id(), failure, e.getMessage()));
                diagnostics.add(failure);
            }
        }

        long durationMs = Duration.between(startTime, Instant.now()).toMillis();
        ValidationReport report = ValidationReport.of(diagnostics, ruleResults, durationMs);
        log.info("Validation complete: {} errors, {} warnings in {}ms",
                report.errors().size(), report.warnings().size(), durationMs);
        return report;
    }
}
