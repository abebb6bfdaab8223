package com.vidnyan.mesh.domain.rule;

import com.vidnyan.mesh.domain.spec.Specification;

import java.util.List;

/**
 * A validation rule over a whole specification.
 * Implementations are stateless and return a fresh list on every call.
 */
public interface SpecRule {

    /**
     * Stable identifier used to enable or disable the rule.
     */
    String id();

    /**
     * All diagnostics this rule finds. Never throws for malformed input.
     */
    List<ValidationError> check(Specification spec);

    /**
     * Get the rule name for logging.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
