package com.vidnyan.mesh.domain.expression;

import java.util.Arrays;
import java.util.Optional;

public enum DateOperator {
    DIFF("diff"),
    ADD("add"),
    SUB("sub"),
    NOW("now"),
    TODAY("today"),
    OVERLAPS("overlaps"),
    TRUNCATE("truncate");

    private final String wireName;

    DateOperator(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<DateOperator> fromWireName(String name) {
        return Arrays.stream(values())
                .filter(op -> op.wireName.equals(name))
                .findFirst();
    }
}
