package com.vidnyan.mesh.domain.expression;

import java.util.Arrays;
import java.util.Optional;

public enum UnaryOperator {
    NOT("not"),
    NEG("neg"),
    IS_NULL("is_null"),
    IS_NOT_NULL("is_not_null");

    private final String wireName;

    UnaryOperator(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<UnaryOperator> fromWireName(String name) {
        return Arrays.stream(values())
                .filter(op -> op.wireName.equals(name))
                .findFirst();
    }
}
