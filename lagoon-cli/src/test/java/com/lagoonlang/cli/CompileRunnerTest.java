package com.lagoonlang.cli;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.lagoonlang.ir.CompileConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * CompileRunner 测试：退出码、输出与 JSON 诊断
 */
class CompileRunnerTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream outBuf = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBuf = new ByteArrayOutputStream();

    private int run(String file, String output, boolean verbose, boolean eval, boolean json, boolean builtins) {
        CompileConfig config = new CompileConfig();
        config.setBuiltins(builtins);
        CompileRunner runner = new CompileRunner(config, verbose, eval, json,
                new PrintStream(outBuf, true, StandardCharsets.UTF_8), new PrintStream(errBuf, true, StandardCharsets.UTF_8));
        return runner.compileFile(file, output);
    }

    private int run(String file) {
        return run(file, null, false, false, false, false);
    }

    private String write(String name, String source) throws IOException {
        Path file = dir.resolve(name);
        Files.write(file, source.getBytes(StandardCharsets.UTF_8));
        return file.toString();
    }

    private String out() {
        return new String(outBuf.toByteArray(), StandardCharsets.UTF_8);
    }

    private String err() {
        return new String(errBuf.toByteArray(), StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("文件检查")
    class FileTests {

        @Test
        @DisplayName("文件不存在")
        void testMissingFile() {
            assertThat(run(dir.resolve("missing.bl").toString())).isEqualTo(1);
            assertThat(err()).contains("文件不存在");
            assertThat(out()).isEmpty();
        }

        @Test
        @DisplayName("扩展名非法")
        void testBadExtension() throws IOException {
            assertThat(run(write("prog.txt", "1"))).isEqualTo(1);
            assertThat(err()).contains("无效的文件扩展名").contains(".bl, .td, .br");
        }

        @Test
        @DisplayName("三种扩展名都被接受")
        void testExtensions() {
            assertThat(CompileRunner.hasSourceExtension("a.bl")).isTrue();
            assertThat(CompileRunner.hasSourceExtension("a.td")).isTrue();
            assertThat(CompileRunner.hasSourceExtension("dir/a.br")).isTrue();
            assertThat(CompileRunner.hasSourceExtension("a.bl.bak")).isFalse();
        }
    }

    @Nested
    @DisplayName("编译")
    class CompileTests {

        @Test
        @DisplayName("成功时打印模块，退出码 0")
        void testSuccess() throws IOException {
            assertThat(run(write("ok.bl", "9 - 3 - 2"))).isZero();
            assertThat(out()).startsWith("; ModuleID = 'Blue Lagoon JIT'")
                    .contains("%subtmp1 = fsub double %subtmp, 2.0")
                    .contains("ret void");
            assertThat(err()).isEmpty();
        }

        @Test
        @DisplayName("语法错误，退出码 1")
        void testParseError() throws IOException {
            assertThat(run(write("bad.td", "f(1, 2"))).isEqualTo(1);
            assertThat(err()).startsWith("错误: PARSE UNTERMINATED_CALL");
            assertThat(out()).isEmpty();
        }

        @Test
        @DisplayName("降级错误，退出码 1")
        void testLowerError() throws IOException {
            assertThat(run(write("bad.br", "g(1)"))).isEqualTo(1);
            assertThat(err()).contains("LOWER UNKNOWN_FUNCTION");
        }

        @Test
        @DisplayName("--eval 打印每个表达式的值")
        void testEval() throws IOException {
            String file = write("calc.bl", "var x = 10\n3 + 4 - 2\nx - 0.5\npow(2, 10)");
            assertThat(run(file, null, false, true, false, true)).isZero();
            assertThat(out()).contains("(- (+ 3 4) 2) = 5")
                    .contains("(- x 0.5) = 9.5")
                    .contains("(call pow 2 10) = 1024")
                    .doesNotContain("(var x");
        }

        @Test
        @DisplayName("--eval 遇到没有实现的 extern 时失败")
        void testEvalFailure() throws IOException {
            String file = write("ext.bl", "extern mystery(x)\nmystery(1)");
            assertThat(run(file, null, false, true, false, false)).isEqualTo(1);
            assertThat(err()).contains("EVAL").contains("mystery");
        }

        @Test
        @DisplayName("--verbose 打印每个顶层项的 AST 与 IR")
        void testVerbose() throws IOException {
            assertThat(run(write("v.bl", "extern sin(x)\nsin(1) + 2"), null, true, false, false, false)).isZero();
            assertThat(out()).contains("; (extern sin (x))")
                    .contains("declare double @sin(double %x)")
                    .contains("; (+ (call sin 1) 2)")
                    .contains("%addtmp = fadd double %calltmp, 2.0");
        }

        @Test
        @DisplayName("-o 写入文件")
        void testOutput() throws IOException {
            Path target = dir.resolve("out.ll");
            assertThat(run(write("o.bl", "1 + 2"), target.toString(), false, false, false, false)).isZero();
            String written = new String(Files.readAllBytes(target), StandardCharsets.UTF_8);
            assertThat(written).contains("%addtmp = fadd double 1.0, 2.0");
            assertThat(out()).contains("编译成功").doesNotContain("ModuleID");
        }
    }

    @Nested
    @DisplayName("JSON 诊断")
    class JsonTests {

        @Test
        @DisplayName("错误输出为诊断数组，位置为 0 基")
        void testErrorJson() throws IOException {
            assertThat(run(write("j.bl", "1 +\n  @"), null, false, false, true, false)).isEqualTo(1);
            JsonArray diagnostics = JsonParser.parseString(out()).getAsJsonArray();
            assertThat(diagnostics.size()).isEqualTo(1);
            JsonObject diag = diagnostics.get(0).getAsJsonObject();
            assertThat(diag.get("stage").getAsString()).isEqualTo("PARSE");
            assertThat(diag.get("code").getAsString()).isEqualTo("UNEXPECTED_TOKEN");
            assertThat(diag.get("severity").getAsInt()).isEqualTo(1);
            assertThat(diag.get("source").getAsString()).isEqualTo("lagoon");
            JsonObject start = diag.getAsJsonObject("range").getAsJsonObject("start");
            assertThat(start.get("line").getAsInt()).isEqualTo(1);
            assertThat(start.get("character").getAsInt()).isEqualTo(2);
            JsonObject end = diag.getAsJsonObject("range").getAsJsonObject("end");
            assertThat(end.get("line").getAsInt()).isEqualTo(1);
            assertThat(end.get("character").getAsInt()).isEqualTo(3);
            assertThat(err()).isEmpty();
        }

        @Test
        @DisplayName("诊断范围覆盖出错的标识符")
        void testRangeCoversIdentifier() throws IOException {
            assertThat(run(write("r.bl", "1 + foo"), null, false, false, true, false)).isEqualTo(1);
            JsonObject diag = JsonParser.parseString(out()).getAsJsonArray().get(0).getAsJsonObject();
            assertThat(diag.get("code").getAsString()).isEqualTo("UNKNOWN_VARIABLE");
            JsonObject range = diag.getAsJsonObject("range");
            assertThat(range.getAsJsonObject("start").get("character").getAsInt()).isEqualTo(4);
            assertThat(range.getAsJsonObject("end").get("character").getAsInt()).isEqualTo(7);
        }

        @Test
        @DisplayName("成功时输出空数组")
        void testSuccessJson() throws IOException {
            assertThat(run(write("j.bl", "1"), null, false, false, true, false)).isZero();
            assertThat(JsonParser.parseString(out()).getAsJsonArray().size()).isZero();
        }

        @Test
        @DisplayName("文件错误也输出 JSON")
        void testFileErrorJson() {
            assertThat(run(dir.resolve("none.bl").toString(), null, false, false, true, false)).isEqualTo(1);
            JsonObject diag = JsonParser.parseString(out()).getAsJsonArray().get(0).getAsJsonObject();
            assertThat(diag.get("code").getAsString()).isEqualTo("FILE_NOT_FOUND");
        }
    }

    @Test
    @DisplayName("数值格式")
    void testFormatValue() {
        assertThat(CompileRunner.formatValue(4.0)).isEqualTo("4");
        assertThat(CompileRunner.formatValue(-2.0)).isEqualTo("-2");
        assertThat(CompileRunner.formatValue(2.5)).isEqualTo("2.5");
        assertThat(CompileRunner.formatValue(Double.POSITIVE_INFINITY)).isEqualTo("Infinity");
    }
}
