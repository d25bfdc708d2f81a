package com.lagoonlang.compiler.ast.decl;

import com.lagoonlang.compiler.ast.AstVisitor;
import com.lagoonlang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 外部函数原型：extern name(a, b)
 *
 * <p>只声明名字和参数个数，函数体由运行时的本地绑定提供。</p>
 */
public class ExternDecl extends Declaration {
    private final List<String> params;

    public ExternDecl(SourceLocation location, String name, List<String> params) {
        super(location, name);
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
    }

    public List<String> getParams() {
        return params;
    }

    public int getArity() {
        return params.size();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitExternDecl(this, context);
    }
}
