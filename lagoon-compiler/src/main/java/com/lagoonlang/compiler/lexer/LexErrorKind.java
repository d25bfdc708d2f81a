package com.lagoonlang.compiler.lexer;

/**
 * 词法错误类别
 */
public enum LexErrorKind {
    /** 数字字面量形状非法（多个小数点、孤立的 '.'） */
    MALFORMED_NUMBER
}
