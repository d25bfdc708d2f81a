package com.lagoonlang.compiler.parser;

import com.lagoonlang.compiler.ast.AstNode;
import com.lagoonlang.compiler.ast.AstPrinter;
import com.lagoonlang.compiler.ast.decl.ExternDecl;
import com.lagoonlang.compiler.ast.decl.Program;
import com.lagoonlang.compiler.ast.decl.VarDecl;
import com.lagoonlang.compiler.ast.expr.BinaryExpr;
import com.lagoonlang.compiler.ast.expr.BinaryExpr.BinaryOp;
import com.lagoonlang.compiler.ast.expr.CallExpr;
import com.lagoonlang.compiler.ast.expr.Expression;
import com.lagoonlang.compiler.ast.expr.NumberLiteral;
import com.lagoonlang.compiler.ast.expr.Variable;
import com.lagoonlang.compiler.ast.stmt.ExpressionStmt;
import com.lagoonlang.compiler.lexer.Lexer;
import com.lagoonlang.compiler.lexer.TokenType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parser 单元测试
 */
class ParserTest {

    private Parser parser(String source) {
        return new Parser(new Lexer(source, "<test>"), "<test>");
    }

    private Expression parseExpr(String source) {
        return parser(source).parseExpression();
    }

    private Program parse(String source) {
        return parser(source).parse();
    }

    private String sexpr(String source) {
        return AstPrinter.print(parseExpr(source));
    }

    private ParseException parseError(String source) {
        return assertThrows(ParseException.class, () -> parse(source));
    }

    @Nested
    @DisplayName("基本表达式")
    class PrimaryTests {

        @Test
        @DisplayName("数字字面量")
        void testNumber() {
            Expression e = parseExpr("3.5");
            assertTrue(e instanceof NumberLiteral);
            assertEquals(3.5, ((NumberLiteral) e).getValue());
        }

        @Test
        @DisplayName("变量引用在解析阶段不做解析")
        void testVariable() {
            Expression e = parseExpr("undefinedName");
            assertTrue(e instanceof Variable);
            assertEquals("undefinedName", ((Variable) e).getName());
        }

        @Test
        @DisplayName("括号表达式")
        void testGroup() {
            assertEquals("(- 9 (- 3 2))", sexpr("9 - (3 - 2)"));
            assertEquals("x", sexpr("((x))"));
        }

        @Test
        @DisplayName("位置信息")
        void testLocation() {
            Expression e = parseExpr("  \n   foo");
            assertEquals(2, e.getLocation().getLine());
            assertEquals(4, e.getLocation().getColumn());
            assertEquals("<test>", e.getLocation().getFile());
        }
    }

    @Nested
    @DisplayName("二元运算")
    class BinaryTests {

        @Test
        @DisplayName("9 - 3 - 2 左结合")
        void testLeftAssociative() {
            Expression e = parseExpr("9 - 3 - 2");
            assertTrue(e instanceof BinaryExpr);
            BinaryExpr outer = (BinaryExpr) e;
            assertEquals(BinaryOp.SUB, outer.getOperator());
            assertEquals(2.0, ((NumberLiteral) outer.getRight()).getValue());
            BinaryExpr inner = (BinaryExpr) outer.getLeft();
            assertEquals(BinaryOp.SUB, inner.getOperator());
            assertEquals(9.0, ((NumberLiteral) inner.getLeft()).getValue());
            assertEquals(3.0, ((NumberLiteral) inner.getRight()).getValue());
        }

        @Test
        @DisplayName("+ 与 - 同级")
        void testSamePrecedence() {
            assertEquals("(- (+ 3 4) 2)", sexpr("3 + 4 - 2"));
            assertEquals("(+ (- (+ a b) c) d)", sexpr("a + b - c + d"));
        }

        @Test
        @DisplayName("扩展运算符表：更高优先级先结合")
        void testHigherPrecedence() {
            // 测试中借用 UNKNOWN token 充当乘号
            OperatorTable table = OperatorTable.defaults().with(TokenType.UNKNOWN, BinaryOp.MUL, 20);
            Parser p = new Parser(new Lexer("1 + 2 * 3 - 4"), "<test>", table);
            assertEquals("(- (+ 1 (* 2 3)) 4)", AstPrinter.print(p.parseExpression()));
        }

        @Test
        @DisplayName("扩展运算符表：更低优先级后结合")
        void testLowerPrecedence() {
            OperatorTable table = OperatorTable.defaults().with(TokenType.UNKNOWN, BinaryOp.MUL, 5);
            Parser p = new Parser(new Lexer("1 + 2 * 3 - 4"), "<test>", table);
            assertEquals("(* (+ 1 2) (- 3 4))", AstPrinter.print(p.parseExpression()));
        }

        @Test
        @DisplayName("运算符表")
        void testOperatorTable() {
            OperatorTable table = OperatorTable.defaults();
            assertEquals(OperatorTable.ADDITIVE_PRECEDENCE, table.precedenceOf(TokenType.PLUS));
            assertEquals(OperatorTable.ADDITIVE_PRECEDENCE, table.precedenceOf(TokenType.MINUS));
            assertEquals(-1, table.precedenceOf(TokenType.COMMA));
            assertFalse(table.isBinaryOperator(TokenType.UNKNOWN));
            assertThrows(IllegalArgumentException.class, () -> table.operatorOf(TokenType.COMMA));
            assertThrows(IllegalArgumentException.class,
                    () -> table.with(TokenType.UNKNOWN, BinaryOp.MUL, 0));
            // with 不修改原表
            table.with(TokenType.UNKNOWN, BinaryOp.MUL, 20);
            assertFalse(table.isBinaryOperator(TokenType.UNKNOWN));
        }
    }

    @Nested
    @DisplayName("函数调用")
    class CallTests {

        @Test
        @DisplayName("多参数调用")
        void testCall() {
            Expression e = parseExpr("f(1, x + 2, g())");
            assertTrue(e instanceof CallExpr);
            CallExpr call = (CallExpr) e;
            assertEquals("f", call.getCallee());
            assertEquals(3, call.getArgs().size());
            assertEquals("(call f 1 (+ x 2) (call g))", AstPrinter.print(call));
        }

        @Test
        @DisplayName("零参数调用")
        void testZeroArgs() {
            CallExpr call = (CallExpr) parseExpr("now()");
            assertTrue(call.getArgs().isEmpty());
        }

        @Test
        @DisplayName("调用参与二元运算")
        void testCallInBinary() {
            assertEquals("(- (call sin x) 1)", sexpr("sin(x) - 1"));
        }

        @Test
        @DisplayName("f(1, 2 缺少右括号报 UNTERMINATED_CALL")
        void testUnterminatedCall() {
            ParseException e = parseError("f(1, 2");
            assertEquals(ParseErrorKind.UNTERMINATED_CALL, e.getKind());
            assertEquals(TokenType.EOF, e.getToken().getType());
        }

        @Test
        @DisplayName("f( 之后直接结束报 UNTERMINATED_CALL")
        void testUnterminatedAfterParen() {
            assertEquals(ParseErrorKind.UNTERMINATED_CALL, parseError("f(").getKind());
            assertEquals(ParseErrorKind.UNTERMINATED_CALL, parseError("f(1,").getKind());
        }

        @Test
        @DisplayName("参数之间缺少逗号报 UNEXPECTED_TOKEN")
        void testMissingComma() {
            ParseException e = parseError("f(1 2)");
            assertEquals(ParseErrorKind.UNEXPECTED_TOKEN, e.getKind());
            assertEquals("',' or ')'", e.getExpected());
            assertEquals(1, e.getLine());
            assertEquals(5, e.getColumn());
        }
    }

    @Nested
    @DisplayName("错误")
    class ErrorTests {

        @Test
        @DisplayName("括号未闭合报 UNTERMINATED_GROUP")
        void testUnterminatedGroup() {
            assertEquals(ParseErrorKind.UNTERMINATED_GROUP, parseError("(1 + 2").getKind());
            assertEquals(ParseErrorKind.UNTERMINATED_GROUP, parseError("(").getKind());
        }

        @Test
        @DisplayName("括号内多余 token 报 UNEXPECTED_TOKEN")
        void testGroupGarbage() {
            assertEquals(ParseErrorKind.UNEXPECTED_TOKEN, parseError("(1 2)").getKind());
        }

        @Test
        @DisplayName("UNKNOWN token 在语法分析阶段被拒绝")
        void testUnknownRejected() {
            ParseException e = parseError("1 + @");
            assertEquals(ParseErrorKind.UNEXPECTED_TOKEN, e.getKind());
            assertEquals(TokenType.UNKNOWN, e.getToken().getType());
            assertTrue(e.getMessage().contains("'@'"), e.getMessage());
        }

        @Test
        @DisplayName("def 不受支持")
        void testDefRejected() {
            ParseException e = parseError("def f(x) x");
            assertEquals(ParseErrorKind.UNEXPECTED_TOKEN, e.getKind());
            assertEquals(TokenType.KW_DEF, e.getToken().getType());
            assertEquals("expression", e.getExpected());
        }

        @Test
        @DisplayName("缺少右操作数")
        void testMissingOperand() {
            ParseException e = parseError("1 +");
            assertEquals(ParseErrorKind.UNEXPECTED_TOKEN, e.getKind());
            assertTrue(e.getMessage().contains("end of input"), e.getMessage());
        }
    }

    @Nested
    @DisplayName("顶层项")
    class TopLevelTests {

        @Test
        @DisplayName("分号被跳过")
        void testSemicolons() {
            Program program = parse(";; 1 ; 2 ;;");
            assertEquals(2, program.getItems().size());
            assertTrue(program.getItems().get(0) instanceof ExpressionStmt);
        }

        @Test
        @DisplayName("空输入")
        void testEmpty() {
            assertTrue(parse("  # 只有注释\n").getItems().isEmpty());
            assertNull(parser("").parseTopLevel());
        }

        @Test
        @DisplayName("extern 声明")
        void testExtern() {
            AstNode node = parser("extern pow(base, exp)").parseTopLevel();
            assertTrue(node instanceof ExternDecl);
            ExternDecl decl = (ExternDecl) node;
            assertEquals("pow", decl.getName());
            assertEquals(2, decl.getArity());
            assertEquals("(extern pow (base exp))", AstPrinter.print(decl));
            assertEquals(0, ((ExternDecl) parser("extern now()").parseTopLevel()).getArity());
        }

        @Test
        @DisplayName("extern 参数必须是标识符")
        void testExternBadParam() {
            assertEquals(ParseErrorKind.UNEXPECTED_TOKEN, parseError("extern f(1)").getKind());
            assertEquals(ParseErrorKind.UNEXPECTED_TOKEN, parseError("extern f(a").getKind());
        }

        @Test
        @DisplayName("var 绑定")
        void testVar() {
            AstNode node = parser("var x = 1 + 2").parseTopLevel();
            assertTrue(node instanceof VarDecl);
            assertEquals("x", ((VarDecl) node).getName());
            assertEquals("(var x (+ 1 2))", AstPrinter.print(node));
            assertEquals(ParseErrorKind.UNEXPECTED_TOKEN, parseError("var x 1").getKind());
        }

        @Test
        @DisplayName("逐项解析：出错前的项已返回")
        void testIncremental() {
            Parser p = parser("1 + 2\n3 - )");
            assertEquals("(+ 1 2)", AstPrinter.print(p.parseTopLevel()));
            assertThrows(ParseException.class, p::parseTopLevel);
        }

        @Test
        @DisplayName("多行程序")
        void testProgram() {
            Program program = parse("extern sin(x)\nvar a = 1\nsin(a) - a # done");
            assertEquals(3, program.getItems().size());
            assertEquals("(- (call sin a) a)", AstPrinter.print(program.getItems().get(2)));
        }
    }
}
