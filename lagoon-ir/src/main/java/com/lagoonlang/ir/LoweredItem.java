package com.lagoonlang.ir;

import com.lagoonlang.compiler.ast.AstNode;
import com.lagoonlang.compiler.ast.stmt.ExpressionStmt;
import com.lagoonlang.ir.mir.MirValue;

/**
 * 一个已降级的顶层项及其 MIR 值
 */
public final class LoweredItem {

    private final AstNode node;
    private final MirValue value;

    public LoweredItem(AstNode node, MirValue value) {
        this.node = node;
        this.value = value;
    }

    public AstNode getNode() { return node; }
    public MirValue getValue() { return value; }

    /** 是否为表达式语句（只有表达式语句参与求值输出） */
    public boolean isExpression() {
        return node instanceof ExpressionStmt;
    }
}
