package com.lagoonlang.compiler.ast.expr;

import com.lagoonlang.compiler.ast.AstVisitor;
import com.lagoonlang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 调用表达式（参数按从左到右求值）
 */
public class CallExpr extends Expression {
    private final String callee;
    private final List<Expression> args;

    public CallExpr(SourceLocation location, String callee, List<Expression> args) {
        super(location);
        this.callee = callee;
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    public String getCallee() {
        return callee;
    }

    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCallExpr(this, context);
    }
}
