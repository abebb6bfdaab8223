package com.vidnyan.mesh.application.port.out;

import com.vidnyan.mesh.domain.rule.ValidationError;
import com.vidnyan.mesh.domain.spec.Specification;

import java.nio.file.Path;
import java.util.List;

/**
 * Port for reading specification documents.
 * Implemented by adapters that read JSON, YAML, etc.
 */
public interface SpecificationLoader {

    /**
     * Load and parse a specification file.
     *
     * @throws SpecificationLoadException if the file cannot be read or is not a valid document
     */
    LoadedSpecification load(Path path);

    /**
     * Parse a specification document held in memory.
     *
     * @throws SpecificationLoadException if the content is not a valid document
     */
    LoadedSpecification parse(String content);

    /**
     * A specification plus the diagnostics raised while reading it, such as
     * formulas that failed to parse. Elements with a broken formula are kept
     * with that formula absent.
     */
    record LoadedSpecification(Specification specification, List<ValidationError> diagnostics) {

        public LoadedSpecification {
            diagnostics = List.copyOf(diagnostics);
        }

        public static LoadedSpecification of(Specification specification) {
            return new LoadedSpecification(specification, List.of());
        }
    }
}
