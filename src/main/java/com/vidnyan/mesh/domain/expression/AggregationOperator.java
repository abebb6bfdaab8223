package com.vidnyan.mesh.domain.expression;

import java.util.Arrays;
import java.util.Optional;

public enum AggregationOperator {
    SUM("sum"),
    COUNT("count"),
    AVG("avg"),
    MIN("min"),
    MAX("max"),
    EXISTS("exists");

    private final String wireName;

    AggregationOperator(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * count and exists take a collection name instead of a per-item expression.
     */
    public boolean takesCollection() {
        return this == COUNT || this == EXISTS;
    }

    public static Optional<AggregationOperator> fromWireName(String name) {
        return Arrays.stream(values())
                .filter(op -> op.wireName.equals(name))
                .findFirst();
    }
}
