package com.vidnyan.mesh.domain.rule;

import java.time.Duration;
import java.util.List;

/**
 * Result of running one rule against a specification.
 */
public record RuleResult(
    String ruleId,
    List<ValidationError> diagnostics,
    Duration executionTime,
    Status status,
    String errorMessage
) {

    public enum Status {
        SUCCESS,
        ERROR,
        SKIPPED
    }

    public static RuleResult success(String ruleId, List<ValidationError> diagnostics, Duration duration) {
        return new RuleResult(ruleId, List.copyOf(diagnostics), duration, Status.SUCCESS, null);
    }

    public static RuleResult error(String ruleId, ValidationError diagnostic, String message) {
        return new RuleResult(ruleId, List.of(diagnostic), Duration.ZERO, Status.ERROR, message);
    }

    public static RuleResult skipped(String ruleId, String reason) {
        return new RuleResult(ruleId, List.of(), Duration.ZERO, Status.SKIPPED, reason);
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }
}
