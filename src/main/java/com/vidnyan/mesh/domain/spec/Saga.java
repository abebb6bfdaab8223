package com.vidnyan.mesh.domain.spec;

import java.util.List;

public record Saga(List<SagaStep> steps) {

    public Saga {
        steps = List.copyOf(steps);
    }

    /**
     * {@code action} and {@code compensation} name functions; compensation may be null.
     */
    public record SagaStep(String name, String action, String compensation) {
    }
}
