package com.lagoonlang.compiler.lexer;

/**
 * Lagoon 词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    NUMBER,

    // === 标识符 ===
    IDENTIFIER,

    // === 关键词 ===
    KW_DEF,         // def（函数定义，当前核心不支持）
    KW_EXTERN,      // extern
    KW_VAR,         // var

    // === 操作符 ===
    PLUS,           // +
    MINUS,          // -
    ASSIGN,         // =

    // === 分隔符 ===
    LPAREN,         // (
    RPAREN,         // )
    COMMA,          // ,
    SEMICOLON,      // ;

    // === 特殊 ===
    EOF,
    UNKNOWN;

    /**
     * 是否为关键词
     */
    public boolean isKeyword() {
        return name().startsWith("KW_");
    }
}
