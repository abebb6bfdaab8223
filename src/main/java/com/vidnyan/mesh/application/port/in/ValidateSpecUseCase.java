package com.vidnyan.mesh.application.port.in;

import com.vidnyan.mesh.application.port.out.SpecificationLoader.LoadedSpecification;
import com.vidnyan.mesh.domain.rule.ValidationReport;

/**
 * Primary use case: check a specification for broken references, cycles,
 * unreachable states and conflicting transitions.
 */
public interface ValidateSpecUseCase {

    /**
     * Run every enabled rule. Diagnostics raised while loading are included in the report.
     */
    ValidationReport validate(LoadedSpecification loaded);
}
