package com.lagoonlang.ir.lowering;

import com.lagoonlang.compiler.ast.AstNode;
import com.lagoonlang.compiler.ast.AstVisitor;
import com.lagoonlang.compiler.ast.decl.ExternDecl;
import com.lagoonlang.compiler.ast.decl.VarDecl;
import com.lagoonlang.compiler.ast.expr.BinaryExpr;
import com.lagoonlang.compiler.ast.expr.CallExpr;
import com.lagoonlang.compiler.ast.expr.Expression;
import com.lagoonlang.compiler.ast.expr.NumberLiteral;
import com.lagoonlang.compiler.ast.expr.Variable;
import com.lagoonlang.compiler.ast.stmt.ExpressionStmt;
import com.lagoonlang.ir.mir.MirBuilder;
import com.lagoonlang.ir.mir.MirFunction;
import com.lagoonlang.ir.mir.MirModule;
import com.lagoonlang.ir.mir.MirValue;

import java.util.ArrayList;
import java.util.List;

/**
 * AST → MIR 降级。
 *
 * <p>每个节点在构建器当前插入点生成零或多条指令并返回其值。降级不是幂等的：
 * 对同一节点降级两次会生成两组独立的指令。</p>
 */
public class AstToMirLowering implements AstVisitor<MirValue, SymbolTable> {

    private final CodeGenContext ctx;

    public AstToMirLowering(CodeGenContext ctx) {
        this.ctx = ctx;
    }

    /**
     * 降级一个表达式。
     *
     * @throws LowerException        变量/函数未定义、参数个数不匹配或运算符不支持
     * @throws IllegalStateException 上下文未初始化或已结束
     */
    public MirValue lower(Expression expression, SymbolTable symbols) {
        return lower((AstNode) expression, symbols);
    }

    /**
     * 降级一个顶层项（表达式语句、extern 声明或 var 绑定）。
     * extern 声明返回被声明的函数。
     */
    public MirValue lower(AstNode node, SymbolTable symbols) {
        ctx.ensureWritable();
        return node.accept(this, symbols);
    }

    // ============ 表达式 ============

    @Override
    public MirValue visitNumberLiteral(NumberLiteral node, SymbolTable symbols) {
        return builder().constDouble(node.getValue());
    }

    @Override
    public MirValue visitVariable(Variable node, SymbolTable symbols) {
        MirValue value = symbols.lookup(node.getName());
        if (value == null) {
            throw new LowerException(LowerErrorKind.UNKNOWN_VARIABLE,
                    "Unknown variable name: " + node.getName(), node.getName(), node.getLocation());
        }
        return value;
    }

    @Override
    public MirValue visitBinaryExpr(BinaryExpr node, SymbolTable symbols) {
        BinaryExpr.BinaryOp op = node.getOperator();
        MirValue left = node.getLeft().accept(this, symbols);
        MirValue right = node.getRight().accept(this, symbols);
        switch (op) {
            case ADD:
                return builder().createFAdd(left, right, "addtmp");
            case SUB:
                return builder().createFSub(left, right, "subtmp");
            default:
                throw new LowerException(LowerErrorKind.UNSUPPORTED_OPERATOR,
                        "Unsupported binary operator: " + op.toSourceString(),
                        op.toSourceString(), node.getLocation());
        }
    }

    @Override
    public MirValue visitCallExpr(CallExpr node, SymbolTable symbols) {
        // 先从左到右降级全部实参，再解析被调函数
        List<MirValue> args = new ArrayList<>(node.getArgs().size());
        for (Expression arg : node.getArgs()) {
            args.add(arg.accept(this, symbols));
        }

        // 只能调用 extern 声明；顶层函数等已定义函数不可调用
        MirFunction callee = module().getFunction(node.getCallee());
        if (callee == null || !callee.isDeclaration()) {
            throw new LowerException(LowerErrorKind.UNKNOWN_FUNCTION,
                    "Unknown function referenced: " + node.getCallee(), node.getCallee(), node.getLocation());
        }
        if (callee.getArity() != args.size()) {
            throw new LowerException(LowerErrorKind.ARITY_MISMATCH,
                    "Function " + node.getCallee() + " expects " + callee.getArity()
                            + " arguments but got " + args.size(),
                    node.getCallee(), node.getLocation());
        }
        return builder().createCall(callee, args, "calltmp");
    }

    // ============ 顶层项 ============

    @Override
    public MirValue visitExternDecl(ExternDecl node, SymbolTable symbols) {
        MirFunction existing = module().getFunction(node.getName());
        if (existing != null) {
            if (!existing.isDeclaration()) {
                throw new LowerException(LowerErrorKind.FUNCTION_NAME_CONFLICT,
                        "Function " + node.getName() + " is already defined in module " + module().getName(),
                        node.getName(), node.getLocation());
            }
            if (existing.getArity() == node.getArity()) {
                return existing;
            }
            throw new LowerException(LowerErrorKind.ARITY_MISMATCH,
                    "Function " + node.getName() + " redeclared with " + node.getArity()
                            + " parameters, previously " + existing.getArity(),
                    node.getName(), node.getLocation());
        }
        return module().declareFunction(node.getName(), node.getParams());
    }

    @Override
    public MirValue visitVarDecl(VarDecl node, SymbolTable symbols) {
        if (symbols.contains(node.getName())) {
            throw new LowerException(LowerErrorKind.DUPLICATE_VARIABLE,
                    "Variable already defined: " + node.getName(), node.getName(), node.getLocation());
        }
        MirValue value = node.getInitializer().accept(this, symbols);
        symbols.define(node.getName(), value);
        return value;
    }

    @Override
    public MirValue visitExpressionStmt(ExpressionStmt node, SymbolTable symbols) {
        return node.getExpression().accept(this, symbols);
    }

    private MirBuilder builder() {
        return ctx.builder();
    }

    private MirModule module() {
        return ctx.module();
    }
}
