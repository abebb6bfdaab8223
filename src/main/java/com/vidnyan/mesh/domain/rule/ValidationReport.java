package com.vidnyan.mesh.domain.rule;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything one validation pass found, split into blocking errors and warnings.
 */
public record ValidationReport(
    boolean valid,
    List<ValidationError> errors,
    List<ValidationError> warnings,
    List<RuleResult> ruleResults,
    long durationMs
) {

    public static ValidationReport of(List<ValidationError> diagnostics, List<RuleResult> ruleResults, long durationMs) {
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationError> warnings = new ArrayList<>();
        for (ValidationError diagnostic : diagnostics) {
            if (diagnostic.isBlocking()) {
                errors.add(diagnostic);
            } else {
                warnings.add(diagnostic);
            }
        }
        return new ValidationReport(errors.isEmpty(), List.copyOf(errors), List.copyOf(warnings),
                List.copyOf(ruleResults), durationMs);
    }

    public List<ValidationError> all() {
        List<ValidationError> all = new ArrayList<>(errors);
        all.addAll(warnings);
        return all;
    }

    public long count(Severity severity) {
        return all().stream().filter(d -> d.severity() == severity).count();
    }

    public boolean hasCode(String code) {
        return all().stream().anyMatch(d -> code.equals(d.code()));
    }
}
