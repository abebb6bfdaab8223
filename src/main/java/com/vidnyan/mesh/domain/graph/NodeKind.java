package com.vidnyan.mesh.domain.graph;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kind of specification element a graph node stands for.
 */
public enum NodeKind {
    ENTITY("entity"),
    FIELD("field"),
    DERIVED("derived"),
    FUNCTION("function"),
    SCENARIO("scenario"),
    INVARIANT("invariant"),
    STATE_MACHINE("state_machine"),
    EVENT("event"),
    SUBSCRIPTION("subscription"),
    SAGA("saga"),
    ROLE("role"),
    GATEWAY("gateway"),
    DEADLINE("deadline"),
    SCHEDULE("schedule"),
    CONSTRAINT("constraint");

    private final String prefix;

    NodeKind(String prefix) {
        this.prefix = prefix;
    }

    /**
     * Stable lower-case name used in rendered ids ({@code entity:Invoice}).
     */
    public String prefix() {
        return prefix;
    }

    public static Optional<NodeKind> fromPrefix(String prefix) {
        return Arrays.stream(values()).filter(k -> k.prefix.equalsIgnoreCase(prefix)).findFirst();
    }
}
