package com.lagoonlang.compiler.parser;

/**
 * 语法错误类别
 */
public enum ParseErrorKind {
    /** 当前 token 与语法不符（期望值见 {@link ParseException#getExpected()}） */
    UNEXPECTED_TOKEN,
    /** 调用参数列表在 ')' 之前结束 */
    UNTERMINATED_CALL,
    /** 括号表达式在 ')' 之前结束 */
    UNTERMINATED_GROUP
}
