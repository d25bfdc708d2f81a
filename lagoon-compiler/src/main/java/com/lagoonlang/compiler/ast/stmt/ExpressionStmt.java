package com.lagoonlang.compiler.ast.stmt;

import com.lagoonlang.compiler.ast.AstNode;
import com.lagoonlang.compiler.ast.AstVisitor;
import com.lagoonlang.compiler.ast.SourceLocation;
import com.lagoonlang.compiler.ast.expr.Expression;

/**
 * 顶层表达式语句
 */
public class ExpressionStmt extends AstNode {
    private final Expression expression;

    public ExpressionStmt(SourceLocation location, Expression expression) {
        super(location);
        this.expression = expression;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitExpressionStmt(this, context);
    }
}
