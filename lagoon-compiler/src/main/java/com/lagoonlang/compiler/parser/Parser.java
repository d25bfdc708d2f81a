package com.lagoonlang.compiler.parser;

import com.lagoonlang.compiler.ast.AstNode;
import com.lagoonlang.compiler.ast.SourceLocation;
import com.lagoonlang.compiler.ast.decl.ExternDecl;
import com.lagoonlang.compiler.ast.decl.Program;
import com.lagoonlang.compiler.ast.decl.VarDecl;
import com.lagoonlang.compiler.ast.expr.Expression;
import com.lagoonlang.compiler.ast.stmt.ExpressionStmt;
import com.lagoonlang.compiler.lexer.Lexer;
import com.lagoonlang.compiler.lexer.Token;
import com.lagoonlang.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.lagoonlang.compiler.lexer.TokenType.*;

/**
 * Lagoon 语法分析器（递归下降 + 优先级爬升）
 *
 * <p>只保留一个 lookahead token（{@link #current}），每次消费后显式前进。
 * 任何语法错误都直接抛出 {@link ParseException}，不做重同步。</p>
 */
@SuppressWarnings("this-escape")
public class Parser {

    final Lexer lexer;
    final String fileName;
    final OperatorTable operators;
    Token current;
    Token previous;

    final ExprParser exprParser = new ExprParser(this);

    public Parser(Lexer lexer, String fileName) {
        this(lexer, fileName, OperatorTable.defaults());
    }

    public Parser(Lexer lexer, String fileName, OperatorTable operators) {
        this.lexer = lexer;
        this.fileName = fileName;
        this.operators = operators;
        advance();  // 读取第一个 token
    }

    // ============ 基础方法 ============

    /**
     * 前进到下一个 token，返回被消费的 token
     */
    Token advance() {
        previous = current;
        current = lexer.nextToken();
        return previous;
    }

    /**
     * 检查当前 token 类型
     */
    boolean check(TokenType type) {
        return current.getType() == type;
    }

    /**
     * 如果当前 token 匹配，则前进
     */
    boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * 期望特定 token，否则报 UNEXPECTED_TOKEN
     */
    Token expect(TokenType type, String message, String expected) {
        if (check(type)) {
            return advance();
        }
        throw new ParseException(ParseErrorKind.UNEXPECTED_TOKEN, message, current, expected);
    }

    /**
     * 期望闭合括号；输入提前结束时报 {@code unterminated}，否则报 UNEXPECTED_TOKEN
     */
    Token expectClosing(ParseErrorKind unterminated, String message) {
        if (check(RPAREN)) {
            return advance();
        }
        if (isAtEnd()) {
            throw new ParseException(unterminated, message, current, "')'");
        }
        throw new ParseException(ParseErrorKind.UNEXPECTED_TOKEN, message, current, "')'");
    }

    /**
     * 创建源码位置
     */
    SourceLocation location() {
        return new SourceLocation(fileName, current.getLine(), current.getColumn(),
                current.getLexeme().length());
    }

    /**
     * 从之前的 token 创建位置
     */
    SourceLocation previousLocation() {
        return new SourceLocation(fileName, previous.getLine(), previous.getColumn(),
                previous.getLexeme().length());
    }

    /**
     * 是否到达输入末尾
     */
    public boolean isAtEnd() {
        return check(EOF);
    }

    // ============ 程序解析 ============

    /**
     * 解析整个编译单元
     */
    public Program parse() {
        SourceLocation loc = location();
        List<AstNode> items = new ArrayList<>();
        AstNode item;
        while ((item = parseTopLevel()) != null) {
            items.add(item);
        }
        return new Program(loc, items);
    }

    /**
     * 解析一个顶层项（跳过分隔符）
     *
     * @return 顶层项；到达输入末尾时返回 null
     */
    public AstNode parseTopLevel() {
        while (match(SEMICOLON)) {
            // 跳过分号
        }
        if (isAtEnd()) {
            return null;
        }
        if (check(KW_EXTERN)) {
            return parseExtern();
        }
        if (check(KW_VAR)) {
            return parseVarDecl();
        }
        SourceLocation loc = location();
        return new ExpressionStmt(loc, parseExpression());
    }

    // ============ 声明 ============

    private ExternDecl parseExtern() {
        SourceLocation loc = location();
        expect(KW_EXTERN, "Expected 'extern'", "'extern'");
        String name = expect(IDENTIFIER, "Expected function name after 'extern'", "IDENTIFIER").getLexeme();
        expect(LPAREN, "Expected '(' after function name", "'('");

        List<String> params = new ArrayList<>();
        if (!check(RPAREN)) {
            do {
                params.add(expect(IDENTIFIER, "Expected parameter name", "IDENTIFIER").getLexeme());
            } while (match(COMMA));
        }
        expectClosing(ParseErrorKind.UNEXPECTED_TOKEN, "Expected ')' after parameter list");
        return new ExternDecl(loc, name, params);
    }

    private VarDecl parseVarDecl() {
        SourceLocation loc = location();
        expect(KW_VAR, "Expected 'var'", "'var'");
        String name = expect(IDENTIFIER, "Expected variable name after 'var'", "IDENTIFIER").getLexeme();
        expect(ASSIGN, "Expected '=' after variable name", "'='");
        Expression initializer = parseExpression();
        return new VarDecl(loc, name, initializer);
    }

    // ============ 表达式解析委托 ============

    /**
     * 解析一个表达式：parseBinaryRhs(0, parsePrimary())
     */
    public Expression parseExpression() {
        return exprParser.parseExpression();
    }
}
