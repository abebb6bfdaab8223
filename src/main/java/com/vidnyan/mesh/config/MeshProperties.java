package com.vidnyan.mesh.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Validation settings.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "mesh.validation")
public class MeshProperties {

    /**
     * Rule ids to skip, e.g. {@code transition-conflict}.
     */
    private List<String> disabledRules = new ArrayList<>();

    /**
     * Treat warnings as failures in the CLI exit code.
     */
    private boolean failOnWarnings = false;

    /**
     * Reject aggregations whose source collection cannot be inferred instead of
     * recording them as "Unknown".
     */
    private boolean strictAggregationSource = false;

    /**
     * How many diagnostics the CLI prints before summarising the rest.
     */
    private int maxReportedDiagnostics = 100;
}
