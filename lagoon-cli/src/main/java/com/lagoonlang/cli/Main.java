package com.lagoonlang.cli;

import com.lagoonlang.ir.CompileConfig;
import com.lagoonlang.ir.lowering.CodeGenContext;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * Lagoon CLI 入口点（picocli）
 */
@Command(name = "lagoon", version = "Lagoon v0.1.0",
         mixinStandardHelpOptions = true,
         description = "编译 Lagoon 源文件（.bl/.td/.br）为 MIR；不指定文件时进入 REPL")
public class Main implements Callable<Integer> {

    @Option(names = {"-v", "--verbose"}, description = "输出每个顶层项的 AST 与 IR，日志级别降为 FINE")
    boolean verbose;

    @Option(names = {"-e", "--eval"}, description = "对每个顶层表达式求值并打印结果")
    boolean eval;

    @Option(names = {"-o", "--output"}, description = "模块输出路径（默认打印到标准输出）")
    String output;

    @Option(names = "--builtins", description = "预声明数学库函数并绑定 PI、E、TAU、INF")
    boolean builtins;

    @Option(names = "--module-name", description = "模块名（默认 ${DEFAULT-VALUE}）")
    String moduleName = CodeGenContext.DEFAULT_MODULE_NAME;

    @Option(names = "--json", description = "以 JSON 输出诊断信息")
    boolean json;

    @Parameters(arity = "0..1", description = "源文件")
    String file;

    @Override
    public Integer call() {
        LoggingSetup.configure(verbose);

        CompileConfig config = new CompileConfig();
        config.setBuiltins(builtins);
        config.setModuleName(moduleName);

        if (file == null) {
            new ReplRunner(config, eval, System.out, System.err).run();
            return 0;
        }
        return new CompileRunner(config, verbose, eval, json, System.out, System.err)
                .compileFile(file, output);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
