package com.lagoonlang.compiler.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lagoon 词法分析器
 *
 * <p>按需逐个产生 token：每次 {@link #nextToken()} 只推进内部游标，不保留历史 token。
 * 到达输入末尾后重复调用始终返回 EOF。</p>
 */
public class Lexer {
    private final String source;
    private final String fileName;

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;

    // 当前 token 起始位置
    private int startLine = 1;
    private int startColumn = 1;

    // 关键词映射表
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("def", TokenType.KW_DEF);
        map.put("extern", TokenType.KW_EXTERN);
        map.put("var", TokenType.KW_VAR);
        KEYWORDS = Collections.unmodifiableMap(map);
    }

    /** 获取所有关键词集合（供 REPL 补全等外部工具使用） */
    public static Set<String> getKeywords() {
        return KEYWORDS.keySet();
    }

    public Lexer(String source, String fileName) {
        this.source = source;
        this.fileName = fileName;
    }

    public Lexer(String source) {
        this(source, "<input>");
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * 获取下一个 Token（流式接口）
     *
     * @return 下一个 Token，输入结束后恒为 EOF
     * @throws LexException 数字字面量形状非法
     */
    public Token nextToken() {
        skipWhitespace();

        start = current;
        startLine = line;
        startColumn = column;

        if (isAtEnd()) {
            return makeToken(TokenType.EOF, null);
        }

        char c = peek();

        if (isAlpha(c)) {
            return identifier();
        }

        if (isDigit(c) || c == '.') {
            return number();
        }

        advance();
        switch (c) {
            case '+': return makeToken(TokenType.PLUS, null);
            case '-': return makeToken(TokenType.MINUS, null);
            case '(': return makeToken(TokenType.LPAREN, null);
            case ')': return makeToken(TokenType.RPAREN, null);
            case ',': return makeToken(TokenType.COMMA, null);
            case ';': return makeToken(TokenType.SEMICOLON, null);
            case '=': return makeToken(TokenType.ASSIGN, null);
            default:
                // 无法识别的字符降级为 UNKNOWN，由语法分析器报错
                return makeToken(TokenType.UNKNOWN, c);
        }
    }

    /**
     * 执行词法分析，返回 Token 列表（末尾恰有一个 EOF）
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.getType() != TokenType.EOF);
        return tokens;
    }

    /** 跳过空白与注释 */
    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\r' || c == '\t') {
                advance();
            } else if (c == '\n') {
                advance();
                newLine();
            } else if (c == '#') {
                // 注释：消费到行尾，换行留给下一轮
                while (!isAtEnd() && peek() != '\n' && peek() != '\r') {
                    advance();
                }
            } else {
                break;
            }
        }
    }

    // === 复杂 Token 扫描 ===

    private Token identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text);
        if (type == null) type = TokenType.IDENTIFIER;
        return makeToken(type, null);
    }

    private Token number() {
        int dots = 0;
        while (isDigit(peek()) || peek() == '.') {
            if (advance() == '.') dots++;
        }

        String text = source.substring(start, current);
        if (dots > 1) {
            throw new LexException(LexErrorKind.MALFORMED_NUMBER,
                    "Malformed number literal: more than one decimal point", text, startLine, startColumn);
        }
        if (text.equals(".")) {
            throw new LexException(LexErrorKind.MALFORMED_NUMBER,
                    "Malformed number literal: no digits", text, startLine, startColumn);
        }
        return makeToken(TokenType.NUMBER, Double.parseDouble(text));
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        column++;
        return c;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private void newLine() {
        line++;
        column = 1;
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return Character.isLetter(c);
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private Token makeToken(TokenType type, Object literal) {
        String lexeme = source.substring(start, current);
        return new Token(type, lexeme, literal, startLine, startColumn, start);
    }
}
