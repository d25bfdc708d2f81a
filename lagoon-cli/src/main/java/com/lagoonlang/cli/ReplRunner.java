package com.lagoonlang.cli;

import com.lagoonlang.compiler.lexer.Lexer;
import com.lagoonlang.ir.CompilationSession;
import com.lagoonlang.ir.CompileConfig;
import com.lagoonlang.ir.CompileResult;
import com.lagoonlang.ir.LagoonIrCompiler;
import com.lagoonlang.ir.LoweredItem;
import com.lagoonlang.ir.interp.EvalException;
import com.lagoonlang.ir.interp.MirInterpreter;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.reader.impl.completer.StringsCompleter;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * jline REPL 交互模式。每行源码喂入同一个编译会话，出错后会话保留并继续。
 */
public class ReplRunner {

    private static final String VERSION = "0.1.0";
    private static final String REPL_FILE = "<repl>";

    private final LagoonIrCompiler compiler;
    private final boolean eval;
    private final PrintStream out;
    private final PrintStream err;
    private CompilationSession session;
    private MirInterpreter interpreter;

    public ReplRunner(CompileConfig config, boolean eval, PrintStream out, PrintStream err) {
        this.compiler = new LagoonIrCompiler(config);
        this.eval = eval;
        this.out = out;
        this.err = err;
        reset();
    }

    /**
     * 启动 REPL 交互模式
     */
    public void run() {
        out.println("Lagoon v" + VERSION);
        out.println("输入 :help 获取帮助，:quit 退出");
        out.println();

        try {
            Terminal terminal = TerminalBuilder.builder().system(true).build();
            LineReader reader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .parser(new DefaultParser())
                    .completer(new StringsCompleter(Lexer.getKeywords()))
                    .variable(LineReader.SECONDARY_PROMPT_PATTERN, "... ")
                    .build();

            runLoop(reader);
        } catch (IOException e) {
            err.println("终端初始化失败: " + e.getMessage());
            // 回退到简单模式
            runFallbackLoop(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
        }

        out.println("\n再见！");
    }

    private void runLoop(LineReader reader) {
        StringBuilder pending = new StringBuilder();
        while (true) {
            try {
                String line = reader.readLine(pending.length() > 0 ? "... " : "lagoon> ");
                if (line == null) break;
                if (!acceptLine(pending, line)) break;
            } catch (UserInterruptException e) {
                // Ctrl+C: 取消当前输入
                pending.setLength(0);
            } catch (EndOfFileException e) {
                break;
            }
        }
    }

    /**
     * 回退循环（jline 初始化失败时使用 BufferedReader）
     */
    void runFallbackLoop(BufferedReader reader) {
        StringBuilder pending = new StringBuilder();
        while (true) {
            try {
                out.print(pending.length() > 0 ? "... " : "lagoon> ");
                out.flush();
                String line = reader.readLine();
                if (line == null) break;
                if (!acceptLine(pending, line)) break;
            } catch (IOException e) {
                err.println("读取输入时出错: " + e.getMessage());
                break;
            }
        }
    }

    /**
     * 处理一行输入：命令、续行或源码。
     *
     * @return false 表示退出
     */
    boolean acceptLine(StringBuilder pending, String line) {
        if (pending.length() == 0 && line.trim().startsWith(":")) {
            return handleReplCommand(line.trim());
        }
        pending.append(line).append('\n');
        // 未闭合括号自动续行
        if (hasUnclosedParens(pending)) {
            return true;
        }
        String source = pending.toString();
        pending.setLength(0);
        if (!source.trim().isEmpty()) {
            compileAndPrint(source);
        }
        return true;
    }

    private boolean hasUnclosedParens(CharSequence text) {
        int depth = 0;
        boolean comment = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (comment) {
                if (c == '\n') comment = false;
                continue;
            }
            switch (c) {
                case '#': comment = true; break;
                case '(': depth++; break;
                case ')': depth--; break;
                default: break;
            }
        }
        return depth > 0;
    }

    /**
     * @return true 继续循环，false 退出
     */
    private boolean handleReplCommand(String command) {
        if (":quit".equals(command) || ":q".equals(command) || ":exit".equals(command)) {
            return false;
        }
        if (":help".equals(command) || ":h".equals(command)) {
            printReplHelp();
            return true;
        }
        if (":ir".equals(command)) {
            out.print(session.getModule().print());
            return true;
        }
        if (":reset".equals(command)) {
            reset();
            out.println("环境已重置");
            return true;
        }
        out.println("未知命令: " + command);
        out.println("输入 :help 获取帮助");
        return true;
    }

    private void compileAndPrint(String source) {
        CompileResult result = session.feed(source);
        for (LoweredItem item : result.getItems()) {
            out.print(CompileRunner.describe(item));
            if (eval && item.isExpression()) {
                try {
                    out.println("= " + CompileRunner.formatValue(interpreter.evaluate(item.getValue())));
                } catch (EvalException e) {
                    err.println("错误: EVAL: " + e.getMessage());
                }
            }
        }
        if (!result.isSuccess()) {
            err.println("错误: " + result.getError());
        }
    }

    private void reset() {
        session = compiler.openSession(REPL_FILE);
        interpreter = session.newInterpreter();
    }

    CompilationSession getSession() {
        return session;
    }

    private void printReplHelp() {
        out.println("REPL 命令:");
        out.println("  :help, :h        显示此帮助");
        out.println("  :quit, :q, :exit 退出 REPL");
        out.println("  :ir              打印当前模块");
        out.println("  :reset           重置编译会话");
        out.println();
        out.println("示例:");
        out.println("  1 + 2 - 3              顶层表达式");
        out.println("  var x = 4              绑定变量");
        out.println("  extern pow(a, b)       声明外部函数");
        out.println("  # 注释                 到行尾");
        out.println();
        out.println("提示:");
        out.println("  - 未闭合的括号会自动进入多行模式");
    }
}
