package com.lagoonlang.compiler.ast.expr;

import com.lagoonlang.compiler.ast.AstVisitor;
import com.lagoonlang.compiler.ast.SourceLocation;

/**
 * 变量引用（在降级时而非解析时对符号表求解）
 */
public class Variable extends Expression {
    private final String name;

    public Variable(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitVariable(this, context);
    }
}
