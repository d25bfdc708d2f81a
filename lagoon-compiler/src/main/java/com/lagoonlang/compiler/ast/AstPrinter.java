package com.lagoonlang.compiler.ast;

import com.lagoonlang.compiler.ast.decl.ExternDecl;
import com.lagoonlang.compiler.ast.decl.VarDecl;
import com.lagoonlang.compiler.ast.expr.BinaryExpr;
import com.lagoonlang.compiler.ast.expr.CallExpr;
import com.lagoonlang.compiler.ast.expr.Expression;
import com.lagoonlang.compiler.ast.expr.NumberLiteral;
import com.lagoonlang.compiler.ast.expr.Variable;
import com.lagoonlang.compiler.ast.stmt.ExpressionStmt;

/**
 * 将 AST 打印为 S 表达式，如 {@code (- (- 9 3) 2)}。
 * 用于 verbose 输出和测试断言。
 */
public final class AstPrinter implements AstVisitor<String, Void> {

    private static final AstPrinter INSTANCE = new AstPrinter();

    private AstPrinter() {
    }

    public static String print(AstNode node) {
        return node.accept(INSTANCE, null);
    }

    @Override
    public String visitNumberLiteral(NumberLiteral node, Void ctx) {
        double v = node.getValue();
        if (v == Math.rint(v) && !Double.isInfinite(v) && Math.abs(v) < 1e15) {
            return Long.toString((long) v);
        }
        return Double.toString(v);
    }

    @Override
    public String visitVariable(Variable node, Void ctx) {
        return node.getName();
    }

    @Override
    public String visitBinaryExpr(BinaryExpr node, Void ctx) {
        return "(" + node.getOperator().toSourceString() + " "
                + node.getLeft().accept(this, ctx) + " "
                + node.getRight().accept(this, ctx) + ")";
    }

    @Override
    public String visitCallExpr(CallExpr node, Void ctx) {
        StringBuilder sb = new StringBuilder("(call ").append(node.getCallee());
        for (Expression arg : node.getArgs()) {
            sb.append(' ').append(arg.accept(this, ctx));
        }
        return sb.append(')').toString();
    }

    @Override
    public String visitExternDecl(ExternDecl node, Void ctx) {
        return "(extern " + node.getName() + " (" + String.join(" ", node.getParams()) + "))";
    }

    @Override
    public String visitVarDecl(VarDecl node, Void ctx) {
        return "(var " + node.getName() + " " + node.getInitializer().accept(this, ctx) + ")";
    }

    @Override
    public String visitExpressionStmt(ExpressionStmt node, Void ctx) {
        return node.getExpression().accept(this, ctx);
    }
}
