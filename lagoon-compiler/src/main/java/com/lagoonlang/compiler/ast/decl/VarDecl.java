package com.lagoonlang.compiler.ast.decl;

import com.lagoonlang.compiler.ast.AstVisitor;
import com.lagoonlang.compiler.ast.SourceLocation;
import com.lagoonlang.compiler.ast.expr.Expression;

/**
 * 变量绑定：var name = initializer
 */
public class VarDecl extends Declaration {
    private final Expression initializer;

    public VarDecl(SourceLocation location, String name, Expression initializer) {
        super(location, name);
        this.initializer = initializer;
    }

    public Expression getInitializer() {
        return initializer;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitVarDecl(this, context);
    }
}
