package com.lagoonlang.compiler.ast.expr;

import com.lagoonlang.compiler.ast.AstVisitor;
import com.lagoonlang.compiler.ast.SourceLocation;

/**
 * 二元表达式
 */
public class BinaryExpr extends Expression {
    private final Expression left;
    private final BinaryOp operator;
    private final Expression right;

    public BinaryExpr(SourceLocation location, Expression left, BinaryOp operator, Expression right) {
        super(location);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOp getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBinaryExpr(this, context);
    }

    /**
     * 二元运算符
     *
     * <p>默认运算符表只产生 ADD/SUB；MUL/DIV 保留给扩展的运算符表，降级阶段尚不支持。</p>
     */
    public enum BinaryOp {
        ADD("+"),
        SUB("-"),
        MUL("*"),
        DIV("/");

        private final String source;

        BinaryOp(String source) {
            this.source = source;
        }

        /** 返回源码中对应的运算符 */
        public String toSourceString() {
            return source;
        }
    }
}
