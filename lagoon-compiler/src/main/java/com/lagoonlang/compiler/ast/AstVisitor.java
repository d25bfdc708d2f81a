package com.lagoonlang.compiler.ast;

import com.lagoonlang.compiler.ast.decl.ExternDecl;
import com.lagoonlang.compiler.ast.decl.VarDecl;
import com.lagoonlang.compiler.ast.expr.BinaryExpr;
import com.lagoonlang.compiler.ast.expr.CallExpr;
import com.lagoonlang.compiler.ast.expr.NumberLiteral;
import com.lagoonlang.compiler.ast.expr.Variable;
import com.lagoonlang.compiler.ast.stmt.ExpressionStmt;

/**
 * AST 访问者接口
 *
 * <p>节点集合是封闭的：所有方法都没有默认实现，新增节点类型时每个实现类都必须补上对应分支。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 表达式 ============

    R visitNumberLiteral(NumberLiteral node, C ctx);

    R visitVariable(Variable node, C ctx);

    R visitBinaryExpr(BinaryExpr node, C ctx);

    R visitCallExpr(CallExpr node, C ctx);

    // ============ 顶层项 ============

    R visitExternDecl(ExternDecl node, C ctx);

    R visitVarDecl(VarDecl node, C ctx);

    R visitExpressionStmt(ExpressionStmt node, C ctx);
}
