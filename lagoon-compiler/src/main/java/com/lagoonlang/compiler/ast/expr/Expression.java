package com.lagoonlang.compiler.ast.expr;

import com.lagoonlang.compiler.ast.AstNode;
import com.lagoonlang.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }
}
