package com.lagoonlang.compiler.ast.expr;

import com.lagoonlang.compiler.ast.AstVisitor;
import com.lagoonlang.compiler.ast.SourceLocation;

/**
 * 数字字面量
 */
public class NumberLiteral extends Expression {
    private final double value;

    public NumberLiteral(SourceLocation location, double value) {
        super(location);
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitNumberLiteral(this, context);
    }
}
