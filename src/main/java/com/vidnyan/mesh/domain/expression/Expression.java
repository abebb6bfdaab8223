package com.vidnyan.mesh.domain.expression;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A parsed formula.
 * Closed set of immutable node types; consumers dispatch through {@link ExpressionVisitor}.
 */
public sealed interface Expression {

    <R> R accept(ExpressionVisitor<R> visitor);

    /**
     * Constant value: String, Long, BigDecimal, Boolean or null.
     */
    record Literal(Object value) implements Expression {

        public static final Literal NULL = new Literal(null);

        public static Literal of(Object value) {
            return value == null ? NULL : new Literal(value);
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitLiteral(this);
        }
    }

    /**
     * Field of the entity instance the formula is evaluated against ({@code self.total}).
     */
    record SelfRef(String field) implements Expression {

        public SelfRef {
            Objects.requireNonNull(field, "field");
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitSelfRef(this);
        }
    }

    /**
     * Dotted path into a named entity ({@code order.total}).
     */
    record FieldRef(String path) implements Expression {

        public FieldRef {
            Objects.requireNonNull(path, "path");
        }

        /**
         * First path segment, the entity (or alias) the path starts from.
         */
        public String root() {
            int dot = path.indexOf('.');
            String head = dot < 0 ? path : path.substring(0, dot);
            int bracket = head.indexOf('[');
            return bracket < 0 ? head : head.substring(0, bracket);
        }

        /**
         * Second path segment with any index suffix removed, if present.
         */
        public Optional<String> field() {
            String[] parts = path.split("\\.");
            if (parts.length < 2) {
                return Optional.empty();
            }
            String name = parts[1];
            int bracket = name.indexOf('[');
            return Optional.of(bracket < 0 ? name : name.substring(0, bracket));
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitFieldRef(this);
        }
    }

    record InputRef(String name) implements Expression {

        public InputRef {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitInputRef(this);
        }
    }

    record Binary(BinaryOperator op, Expression left, Expression right) implements Expression {

        public Binary {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitBinary(this);
        }
    }

    record Unary(UnaryOperator op, Expression expr) implements Expression {

        public Unary {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(expr, "expr");
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitUnary(this);
        }
    }

    /**
     * Aggregation over a collection entity. {@code expr} is null for count/exists,
     * {@code where} is null when unfiltered.
     */
    record Aggregation(
        AggregationOperator op,
        String from,
        Expression expr,
        Expression where,
        Confidence sourceConfidence
    ) implements Expression {

        public static final String UNKNOWN_SOURCE = "Unknown";

        public Aggregation {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(sourceConfidence, "sourceConfidence");
        }

        public Optional<Expression> item() {
            return Optional.ofNullable(expr);
        }

        public Optional<Expression> filter() {
            return Optional.ofNullable(where);
        }

        public boolean hasUnknownSource() {
            return UNKNOWN_SOURCE.equals(from);
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitAggregation(this);
        }
    }

    /**
     * Application of a built-in function or a derived formula.
     */
    record Call(String name, List<Expression> args) implements Expression {

        public Call {
            Objects.requireNonNull(name, "name");
            args = List.copyOf(args);
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitCall(this);
        }
    }

    record If(Expression cond, Expression then, Expression otherwise) implements Expression {

        public If {
            Objects.requireNonNull(cond, "cond");
            Objects.requireNonNull(then, "then");
            Objects.requireNonNull(otherwise, "otherwise");
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitIf(this);
        }
    }

    record CaseBranch(Expression when, Expression then) {

        public CaseBranch {
            Objects.requireNonNull(when, "when");
            Objects.requireNonNull(then, "then");
        }
    }

    /**
     * First matching branch wins; {@code otherwise} may be null.
     */
    record Case(List<CaseBranch> branches, Expression otherwise) implements Expression {

        public Case {
            branches = List.copyOf(branches);
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitCase(this);
        }
    }

    record ListLiteral(List<Expression> items) implements Expression {

        public ListLiteral {
            items = List.copyOf(items);
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitListLiteral(this);
        }
    }

    /**
     * Date arithmetic; {@code unit} (days, hours, ...) may be null.
     */
    record DateOp(DateOperator op, List<Expression> args, String unit) implements Expression {

        public DateOp {
            Objects.requireNonNull(op, "op");
            args = List.copyOf(args);
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitDateOp(this);
        }
    }

    record ListOp(ListOperator op, Expression list, List<Expression> args) implements Expression {

        public ListOp {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(list, "list");
            args = List.copyOf(args);
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitListOp(this);
        }
    }
}
