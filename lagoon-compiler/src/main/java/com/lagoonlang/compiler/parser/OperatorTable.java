package com.lagoonlang.compiler.parser;

import com.lagoonlang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.lagoonlang.compiler.lexer.TokenType;

import java.util.EnumMap;
import java.util.Map;

/**
 * 二元运算符优先级表（全部左结合）。
 *
 * <p>不可变：{@link #with} 返回新表。默认表中 + 与 - 同为 10 级。</p>
 */
public final class OperatorTable {

    public static final int ADDITIVE_PRECEDENCE = 10;

    private static final OperatorTable DEFAULTS = new OperatorTable(new EnumMap<TokenType, Entry>(TokenType.class))
            .with(TokenType.PLUS, BinaryOp.ADD, ADDITIVE_PRECEDENCE)
            .with(TokenType.MINUS, BinaryOp.SUB, ADDITIVE_PRECEDENCE);

    private final Map<TokenType, Entry> entries;

    private OperatorTable(Map<TokenType, Entry> entries) {
        this.entries = entries;
    }

    public static OperatorTable defaults() {
        return DEFAULTS;
    }

    /**
     * 增加或覆盖一个运算符
     *
     * @param precedence 必须为正数；数值越大绑定越紧
     */
    public OperatorTable with(TokenType token, BinaryOp operator, int precedence) {
        if (precedence <= 0) {
            throw new IllegalArgumentException("Operator precedence must be positive: " + precedence);
        }
        Map<TokenType, Entry> copy = new EnumMap<TokenType, Entry>(TokenType.class);
        copy.putAll(entries);
        copy.put(token, new Entry(operator, precedence));
        return new OperatorTable(copy);
    }

    /**
     * token 的优先级，不是二元运算符时返回 -1
     */
    public int precedenceOf(TokenType token) {
        Entry entry = entries.get(token);
        return entry != null ? entry.precedence : -1;
    }

    public boolean isBinaryOperator(TokenType token) {
        return entries.containsKey(token);
    }

    public BinaryOp operatorOf(TokenType token) {
        Entry entry = entries.get(token);
        if (entry == null) {
            throw new IllegalArgumentException("Not a binary operator: " + token);
        }
        return entry.operator;
    }

    private static final class Entry {
        final BinaryOp operator;
        final int precedence;

        Entry(BinaryOp operator, int precedence) {
            this.operator = operator;
            this.precedence = precedence;
        }
    }
}
