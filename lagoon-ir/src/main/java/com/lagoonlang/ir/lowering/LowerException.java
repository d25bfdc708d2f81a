package com.lagoonlang.ir.lowering;

import com.lagoonlang.compiler.ast.SourceLocation;

/**
 * AST → MIR 降级失败。已生成的指令保留在模块中，由调用方决定是否丢弃。
 */
public class LowerException extends RuntimeException {

    private final LowerErrorKind kind;
    private final String subject;
    private final SourceLocation location;

    public LowerException(LowerErrorKind kind, String message, String subject, SourceLocation location) {
        super(message);
        this.kind = kind;
        this.subject = subject;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public LowerErrorKind getKind() { return kind; }

    /** 出错的变量名、函数名或运算符 */
    public String getSubject() { return subject; }

    public SourceLocation getLocation() { return location; }

    @Override
    public String getMessage() {
        return super.getMessage() + " at line " + location.getLine() + ", column " + location.getColumn();
    }
}
