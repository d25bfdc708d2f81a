package com.lagoonlang.ir;

import com.lagoonlang.compiler.lexer.LexException;
import com.lagoonlang.compiler.parser.ParseException;
import com.lagoonlang.ir.lowering.LowerException;

/**
 * 编译错误：出错阶段、错误码、消息与位置。
 */
public final class CompileError {

    public enum Stage {
        LEX, PARSE, LOWER
    }

    private final Stage stage;
    private final String code;
    private final String message;
    private final String fileName;
    private final int line;
    private final int column;
    private final int length;

    public CompileError(Stage stage, String code, String message, String fileName,
                        int line, int column, int length) {
        this.stage = stage;
        this.code = code;
        this.message = message;
        this.fileName = fileName;
        this.line = line;
        this.column = column;
        this.length = length;
    }

    static CompileError of(LexException e, String fileName) {
        return new CompileError(Stage.LEX, e.getKind().name(), e.getMessage(), fileName,
                e.getLine(), e.getColumn(), e.getText().length());
    }

    static CompileError of(ParseException e, String fileName) {
        return new CompileError(Stage.PARSE, e.getKind().name(), e.getMessage(), fileName,
                e.getLine(), e.getColumn(), e.getToken() != null ? e.getToken().getLexeme().length() : 0);
    }

    static CompileError of(LowerException e, String fileName) {
        return new CompileError(Stage.LOWER, e.getKind().name(), e.getMessage(), fileName,
                e.getLocation().getLine(), e.getLocation().getColumn(), e.getLocation().getLength());
    }

    public Stage getStage() { return stage; }
    public String getCode() { return code; }
    public String getMessage() { return message; }
    public String getFileName() { return fileName; }
    public int getLine() { return line; }
    public int getColumn() { return column; }

    /** 出错源码片段的字符数，没有位置时为 0 */
    public int getLength() { return length; }

    @Override
    public String toString() {
        return stage + " " + code + ": " + message;
    }
}
