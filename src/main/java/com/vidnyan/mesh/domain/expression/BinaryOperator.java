package com.vidnyan.mesh.domain.expression;

import java.util.Arrays;
import java.util.Optional;

/**
 * Infix operators with their binding strength (higher binds tighter).
 */
public enum BinaryOperator {
    OR("or", 1),
    AND("and", 2),
    EQ("eq", 3),
    NE("ne", 3),
    LT("lt", 3),
    LE("le", 3),
    GT("gt", 3),
    GE("ge", 3),
    IN("in", 3),
    NOT_IN("not_in", 3),
    LIKE("like", 3),
    NOT_LIKE("not_like", 3),
    ADD("add", 4),
    SUB("sub", 4),
    MUL("mul", 5),
    DIV("div", 5),
    MOD("mod", 5);

    private final String wireName;
    private final int precedence;

    BinaryOperator(String wireName, int precedence) {
        this.wireName = wireName;
        this.precedence = precedence;
    }

    public String wireName() {
        return wireName;
    }

    public int precedence() {
        return precedence;
    }

    public boolean isComparison() {
        return precedence == 3;
    }

    public static Optional<BinaryOperator> fromWireName(String name) {
        return Arrays.stream(values())
                .filter(op -> op.wireName.equals(name))
                .findFirst();
    }
}
