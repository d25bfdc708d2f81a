package com.lagoonlang.compiler.ast.decl;

import com.lagoonlang.compiler.ast.AstNode;
import com.lagoonlang.compiler.ast.SourceLocation;

/**
 * 顶层声明基类
 */
public abstract class Declaration extends AstNode {
    protected final String name;

    protected Declaration(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
