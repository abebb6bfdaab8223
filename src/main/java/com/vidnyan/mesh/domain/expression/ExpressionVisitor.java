package com.vidnyan.mesh.domain.expression;

/**
 * One method per {@link Expression} variant.
 */
public interface ExpressionVisitor<R> {

    R visitLiteral(Expression.Literal literal);

    R visitSelfRef(Expression.SelfRef ref);

    R visitFieldRef(Expression.FieldRef ref);

    R visitInputRef(Expression.InputRef ref);

    R visitBinary(Expression.Binary binary);

    R visitUnary(Expression.Unary unary);

    R visitAggregation(Expression.Aggregation aggregation);

    R visitCall(Expression.Call call);

    R visitIf(Expression.If conditional);

    R visitCase(Expression.Case caseExpr);

    R visitListLiteral(Expression.ListLiteral list);

    R visitDateOp(Expression.DateOp dateOp);

    R visitListOp(Expression.ListOp listOp);
}
