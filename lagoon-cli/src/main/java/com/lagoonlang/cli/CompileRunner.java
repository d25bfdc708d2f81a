package com.lagoonlang.cli;

import com.lagoonlang.compiler.ast.AstPrinter;
import com.lagoonlang.ir.CompileConfig;
import com.lagoonlang.ir.CompileError;
import com.lagoonlang.ir.CompileResult;
import com.lagoonlang.ir.LagoonIrCompiler;
import com.lagoonlang.ir.LoweredItem;
import com.lagoonlang.ir.interp.EvalException;
import com.lagoonlang.ir.interp.MirInterpreter;
import com.lagoonlang.ir.mir.MirVerifier;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

/**
 * 文件编译执行器。所有方法返回进程退出码：0 成功，1 出错。
 */
public class CompileRunner {

    private static final Logger LOG = Logger.getLogger(CompileRunner.class.getName());

    static final List<String> SOURCE_EXTENSIONS = Arrays.asList(".bl", ".td", ".br");

    private final CompileConfig config;
    private final boolean verbose;
    private final boolean eval;
    private final boolean json;
    private final PrintStream out;
    private final PrintStream err;

    public CompileRunner(CompileConfig config, boolean verbose, boolean eval, boolean json,
                         PrintStream out, PrintStream err) {
        this.config = config;
        this.verbose = verbose;
        this.eval = eval;
        this.json = json;
        this.out = out;
        this.err = err;
    }

    /**
     * 编译文件。未指定输出路径时模块文本打印到 stdout（JSON 模式下 stdout 只输出诊断）。
     */
    public int compileFile(String filePath, String outputPath) {
        Path path = Paths.get(filePath);
        if (!Files.isRegularFile(path)) {
            return fileError(filePath, "FILE_NOT_FOUND", "错误: 文件不存在 - " + filePath);
        }
        if (!hasSourceExtension(filePath)) {
            return fileError(filePath, "INVALID_FILE_EXTENSION",
                    "错误: 无效的文件扩展名 - " + filePath + "（支持 " + String.join(", ", SOURCE_EXTENSIONS) + "）");
        }

        LagoonIrCompiler compiler = new LagoonIrCompiler(config);
        CompileResult result;
        try {
            result = compiler.compileFile(path);
        } catch (IOException e) {
            return fileError(filePath, "IO_ERROR", "错误: 读取文件失败 - " + e.getMessage());
        }

        if (!result.isSuccess()) {
            reportError(result.getError());
            return 1;
        }

        List<String> problems = MirVerifier.verify(result.getModule());
        if (!problems.isEmpty()) {
            for (String problem : problems) {
                LOG.severe("IR 校验失败: " + problem);
            }
            return 1;
        }

        if (verbose && !json) {
            for (LoweredItem item : result.getItems()) {
                out.println("; " + AstPrinter.print(item.getNode()));
                out.print(describe(item));
            }
        }

        if (eval && !evaluate(filePath, result, compiler.newInterpreter())) {
            return 1;
        }

        if (outputPath != null) {
            try {
                Files.write(Paths.get(outputPath), result.getModule().print().getBytes(StandardCharsets.UTF_8));
            } catch (IOException e) {
                return fileError(outputPath, "IO_ERROR", "错误: 写入文件失败 - " + e.getMessage());
            }
            if (!json) {
                out.println("编译成功！输出: " + outputPath);
            }
        } else if (!json) {
            out.print(result.getModule().print());
        }

        if (json) {
            out.println(DiagnosticsJson.toJson(DiagnosticsJson.empty()));
        }
        return 0;
    }

    private boolean evaluate(String filePath, CompileResult result, MirInterpreter interpreter) {
        for (LoweredItem item : result.getItems()) {
            if (!item.isExpression()) continue;
            try {
                double value = interpreter.evaluate(item.getValue());
                if (!json) {
                    out.println(AstPrinter.print(item.getNode()) + " = " + formatValue(value));
                }
            } catch (EvalException e) {
                if (json) {
                    out.println(DiagnosticsJson.toJson(DiagnosticsJson.ofFile(
                            filePath, "EVAL", "EVAL_ERROR", e.getMessage())));
                } else {
                    err.println("错误: EVAL: " + e.getMessage());
                }
                return false;
            }
        }
        return true;
    }

    private void reportError(CompileError error) {
        if (json) {
            out.println(DiagnosticsJson.toJson(DiagnosticsJson.of(error)));
        } else {
            err.println("错误: " + error);
        }
    }

    private int fileError(String file, String code, String message) {
        if (json) {
            out.println(DiagnosticsJson.toJson(DiagnosticsJson.ofFile(file, "FILE", code, message)));
        } else {
            err.println(message);
        }
        return 1;
    }

    static boolean hasSourceExtension(String filePath) {
        for (String ext : SOURCE_EXTENSIONS) {
            if (filePath.endsWith(ext)) return true;
        }
        return false;
    }

    /** 一个顶层项的 IR 文本：指令、常量或函数声明 */
    static String describe(LoweredItem item) {
        String text = item.getValue().toString();
        return text.endsWith("\n") ? text : text + "\n";
    }

    /** 整数值不带小数部分 */
    static String formatValue(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
