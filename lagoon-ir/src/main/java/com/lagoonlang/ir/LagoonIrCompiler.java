package com.lagoonlang.ir;

import com.lagoonlang.ir.interp.MirInterpreter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 基于 MIR 的编译器门面。
 * 管线：源码 → Lexer → Parser → AST → MIR。
 *
 * <p>各层以类型化异常报告失败，门面在边界处把它们转换为 {@link CompileResult}。</p>
 */
public class LagoonIrCompiler {

    private final CompileConfig config;

    public LagoonIrCompiler() {
        this(new CompileConfig());
    }

    public LagoonIrCompiler(CompileConfig config) {
        this.config = config;
    }

    public CompileConfig getConfig() {
        return config;
    }

    /**
     * 编译源代码。成功时顶层函数已以 {@code ret void} 结束。
     *
     * @param source   源代码
     * @param fileName 文件名
     */
    public CompileResult compile(String source, String fileName) {
        CompilationSession session = openSession(fileName);
        CompileResult result = session.feed(source);
        if (result.isSuccess()) {
            session.finish();
        }
        return result;
    }

    /**
     * 编译文件。
     */
    public CompileResult compileFile(Path file) throws IOException {
        String source = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        return compile(source, file.getFileName().toString());
    }

    /** 创建按配置绑定原生函数的求值器 */
    public MirInterpreter newInterpreter() {
        return new MirInterpreter(config.createNatives());
    }

    /**
     * 打开一个可以多次喂入源码的编译会话（REPL 使用）。
     */
    public CompilationSession openSession(String fileName) {
        return new CompilationSession(config, fileName);
    }
}
