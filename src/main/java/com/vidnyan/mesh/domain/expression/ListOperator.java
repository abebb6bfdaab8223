package com.vidnyan.mesh.domain.expression;

import java.util.Arrays;
import java.util.Optional;

public enum ListOperator {
    CONTAINS("contains"),
    LENGTH("length"),
    FIRST("first"),
    LAST("last"),
    AT("at"),
    SLICE("slice");

    private final String wireName;

    ListOperator(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<ListOperator> fromWireName(String name) {
        return Arrays.stream(values())
                .filter(op -> op.wireName.equals(name))
                .findFirst();
    }
}
