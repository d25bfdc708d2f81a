package com.lagoonlang.compiler.parser;

import com.lagoonlang.compiler.ast.SourceLocation;
import com.lagoonlang.compiler.ast.expr.BinaryExpr;
import com.lagoonlang.compiler.ast.expr.CallExpr;
import com.lagoonlang.compiler.ast.expr.Expression;
import com.lagoonlang.compiler.ast.expr.NumberLiteral;
import com.lagoonlang.compiler.ast.expr.Variable;
import com.lagoonlang.compiler.lexer.Token;

import java.util.ArrayList;
import java.util.List;

import static com.lagoonlang.compiler.lexer.TokenType.*;

/**
 * 表达式解析辅助类
 */
class ExprParser {

    final Parser parser;

    ExprParser(Parser parser) {
        this.parser = parser;
    }

    Expression parseExpression() {
        return parseBinaryRhs(0, parsePrimary());
    }

    /**
     * 优先级爬升：只折叠优先级不低于 minPrecedence 的运算符。
     * 同级运算符在循环中向左折叠，因此 a - b - c 解析为 (a - b) - c。
     */
    Expression parseBinaryRhs(int minPrecedence, Expression lhs) {
        OperatorTable operators = parser.operators;
        while (true) {
            int precedence = operators.precedenceOf(parser.current.getType());
            if (precedence < 0 || precedence < minPrecedence) {
                return lhs;
            }

            Token op = parser.advance();
            SourceLocation loc = parser.previousLocation();
            Expression rhs = parsePrimary();

            // 右侧运算符绑定更紧时，先让它吃掉 rhs
            int nextPrecedence = operators.precedenceOf(parser.current.getType());
            if (precedence < nextPrecedence) {
                rhs = parseBinaryRhs(precedence + 1, rhs);
            }

            lhs = new BinaryExpr(loc, lhs, operators.operatorOf(op.getType()), rhs);
        }
    }

    private Expression parsePrimary() {
        SourceLocation loc = parser.location();

        if (parser.check(NUMBER)) {
            Token tok = parser.advance();
            return new NumberLiteral(loc, tok.getNumberValue());
        }

        if (parser.check(IDENTIFIER)) {
            String name = parser.advance().getLexeme();
            if (parser.check(LPAREN)) {
                return parseCall(loc, name);
            }
            return new Variable(loc, name);
        }

        // 括号表达式
        if (parser.match(LPAREN)) {
            if (parser.isAtEnd()) {
                throw new ParseException(ParseErrorKind.UNTERMINATED_GROUP,
                        "Unterminated parenthesized expression", parser.current, "expression");
            }
            Expression expr = parseExpression();
            parser.expectClosing(ParseErrorKind.UNTERMINATED_GROUP, "Expected ')' to close group");
            return expr;
        }

        if (parser.check(KW_DEF)) {
            throw new ParseException(ParseErrorKind.UNEXPECTED_TOKEN,
                    "Function definitions are not supported", parser.current, "expression");
        }

        throw new ParseException(ParseErrorKind.UNEXPECTED_TOKEN,
                "Expected expression", parser.current, "expression");
    }

    private CallExpr parseCall(SourceLocation loc, String callee) {
        parser.advance();  // consume '('
        List<Expression> args = new ArrayList<>();

        if (parser.match(RPAREN)) {
            return new CallExpr(loc, callee, args);
        }

        while (true) {
            if (parser.isAtEnd()) {
                throw new ParseException(ParseErrorKind.UNTERMINATED_CALL,
                        "Unterminated argument list for '" + callee + "'", parser.current, "expression");
            }
            args.add(parseExpression());

            if (parser.match(RPAREN)) {
                return new CallExpr(loc, callee, args);
            }
            if (parser.isAtEnd()) {
                throw new ParseException(ParseErrorKind.UNTERMINATED_CALL,
                        "Unterminated argument list for '" + callee + "'", parser.current, "',' or ')'");
            }
            if (!parser.match(COMMA)) {
                throw new ParseException(ParseErrorKind.UNEXPECTED_TOKEN,
                        "Expected ',' or ')' in argument list", parser.current, "',' or ')'");
            }
        }
    }
}
