package com.lagoonlang.ir.lowering;

/**
 * 降级错误种类
 */
public enum LowerErrorKind {
    UNKNOWN_VARIABLE,
    UNKNOWN_FUNCTION,
    ARITY_MISMATCH,
    UNSUPPORTED_OPERATOR,
    DUPLICATE_VARIABLE,
    /** extern 与模块中已定义（有函数体）的函数同名 */
    FUNCTION_NAME_CONFLICT
}
