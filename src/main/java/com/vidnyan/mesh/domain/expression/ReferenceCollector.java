package com.vidnyan.mesh.domain.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Walks an expression tree and gathers every name it mentions.
 */
public final class ReferenceCollector implements ExpressionVisitor<Void> {

    private final List<Expression.FieldRef> fieldRefs = new ArrayList<>();
    private final Set<String> selfFields = new LinkedHashSet<>();
    private final Set<String> inputs = new LinkedHashSet<>();
    private final Set<String> calls = new LinkedHashSet<>();
    private final List<Expression.Aggregation> aggregations = new ArrayList<>();

    private ReferenceCollector() {
    }

    public static References collect(Expression expression) {
        ReferenceCollector collector = new ReferenceCollector();
        if (expression != null) {
            expression.accept(collector);
        }
        return new References(
                List.copyOf(collector.fieldRefs),
                Collections.unmodifiableSet(collector.selfFields),
                Collections.unmodifiableSet(collector.inputs),
                Collections.unmodifiableSet(collector.calls),
                List.copyOf(collector.aggregations));
    }

    /**
     * Names referenced by one expression. {@code fieldRefs} and {@code aggregations}
     * keep source order and duplicates.
     */
    public record References(
        List<Expression.FieldRef> fieldRefs,
        Set<String> selfFields,
        Set<String> inputs,
        Set<String> calls,
        List<Expression.Aggregation> aggregations
    ) {

        public boolean isEmpty() {
            return fieldRefs.isEmpty() && selfFields.isEmpty() && inputs.isEmpty()
                    && calls.isEmpty() && aggregations.isEmpty();
        }
    }

    @Override
    public Void visitLiteral(Expression.Literal literal) {
        return null;
    }

    @Override
    public Void visitSelfRef(Expression.SelfRef ref) {
        int dot = ref.field().indexOf('.');
        selfFields.add(dot < 0 ? ref.field() : ref.field().substring(0, dot));
        return null;
    }

    @Override
    public Void visitFieldRef(Expression.FieldRef ref) {
        fieldRefs.add(ref);
        return null;
    }

    @Override
    public Void visitInputRef(Expression.InputRef ref) {
        inputs.add(ref.name());
        return null;
    }

    @Override
    public Void visitBinary(Expression.Binary binary) {
        binary.left().accept(this);
        binary.right().accept(this);
        return null;
    }

    @Override
    public Void visitUnary(Expression.Unary unary) {
        unary.expr().accept(this);
        return null;
    }

    @Override
    public Void visitAggregation(Expression.Aggregation aggregation) {
        aggregations.add(aggregation);
        aggregation.item().ifPresent(item -> item.accept(this));
        aggregation.filter().ifPresent(where -> where.accept(this));
        return null;
    }

    @Override
    public Void visitCall(Expression.Call call) {
        calls.add(call.name());
        call.args().forEach(arg -> arg.accept(this));
        return null;
    }

    @Override
    public Void visitIf(Expression.If conditional) {
        conditional.cond().accept(this);
        conditional.then().accept(this);
        conditional.otherwise().accept(this);
        return null;
    }

    @Override
    public Void visitCase(Expression.Case caseExpr) {
        for (Expression.CaseBranch branch : caseExpr.branches()) {
            branch.when().accept(this);
            branch.then().accept(this);
        }
        if (caseExpr.otherwise() != null) {
            caseExpr.otherwise().accept(this);
        }
        return null;
    }

    @Override
    public Void visitListLiteral(Expression.ListLiteral list) {
        list.items().forEach(item -> item.accept(this));
        return null;
    }

    @Override
    public Void visitDateOp(Expression.DateOp dateOp) {
        dateOp.args().forEach(arg -> arg.accept(this));
        return null;
    }

    @Override
    public Void visitListOp(Expression.ListOp listOp) {
        listOp.list().accept(this);
        listOp.args().forEach(arg -> arg.accept(this));
        return null;
    }
}
