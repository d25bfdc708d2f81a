package com.lagoonlang.compiler.lexer;

/**
 * 词法异常
 */
public class LexException extends RuntimeException {
    private final LexErrorKind kind;
    private final String text;
    private final int line;
    private final int column;

    public LexException(LexErrorKind kind, String message, String text, int line, int column) {
        super(message);
        this.kind = kind;
        this.text = text;
        this.line = line;
        this.column = column;
    }

    public LexErrorKind getKind() {
        return kind;
    }

    /** 出错的源码片段 */
    public String getText() {
        return text;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public String getMessage() {
        return super.getMessage() + " at line " + line + ", column " + column
                + " (found '" + text + "')";
    }
}
