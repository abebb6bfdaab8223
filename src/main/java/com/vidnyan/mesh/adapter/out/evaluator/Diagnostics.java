package com.vidnyan.mesh.adapter.out.evaluator;

import java.util.Collection;
import java.util.List;

/**
 * Helpers shared by the evaluators.
 */
final class Diagnostics {

    static final int MAX_OPTIONS = 10;

    private Diagnostics() {
    }

    /**
     * Declared names offered as fix candidates: sorted, at most {@value #MAX_OPTIONS}.
     */
    static List<String> options(Collection<String> declared) {
        return declared.stream().sorted().limit(MAX_OPTIONS).toList();
    }
}
