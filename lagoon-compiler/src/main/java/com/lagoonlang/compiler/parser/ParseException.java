package com.lagoonlang.compiler.parser;

import com.lagoonlang.compiler.lexer.Token;

/**
 * 解析异常
 *
 * <p>对当前顶层表达式总是致命的：语法分析器不做错误恢复。</p>
 */
public class ParseException extends RuntimeException {
    private final ParseErrorKind kind;
    private final Token token;
    private final String expected;

    public ParseException(ParseErrorKind kind, String message, Token token, String expected) {
        super(message);
        this.kind = kind;
        this.token = token;
        this.expected = expected;
    }

    public ParseErrorKind getKind() {
        return kind;
    }

    /** 实际遇到的 token */
    public Token getToken() {
        return token;
    }

    public String getExpected() {
        return expected;
    }

    public int getLine() {
        return token != null ? token.getLine() : 0;
    }

    public int getColumn() {
        return token != null ? token.getColumn() : 0;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (token != null) {
            sb.append(" at line ").append(token.getLine());
            sb.append(", column ").append(token.getColumn());
            sb.append(" (found ").append(token.describe()).append(')');
        }
        if (expected != null) {
            sb.append(", expected: ").append(expected);
        }
        return sb.toString();
    }
}
