package com.lagoonlang.compiler.ast;

/**
 * 节点在源码中的位置：起始行列（1 基）与所覆盖 token 的长度。
 */
public final class SourceLocation {

    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", 0, 0, 0);

    private final String file;
    private final int line;
    private final int column;
    private final int length;

    public SourceLocation(String file, int line, int column, int length) {
        this.file = file;
        this.line = line;
        this.column = column;
        this.length = length;
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /** 起始 token 的字符数，未知时为 0 */
    public int getLength() {
        return length;
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
