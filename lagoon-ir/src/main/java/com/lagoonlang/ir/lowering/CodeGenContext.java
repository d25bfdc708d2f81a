package com.lagoonlang.ir.lowering;

import com.lagoonlang.ir.mir.BasicBlock;
import com.lagoonlang.ir.mir.MirBuilder;
import com.lagoonlang.ir.mir.MirContext;
import com.lagoonlang.ir.mir.MirFunction;
import com.lagoonlang.ir.mir.MirModule;
import com.lagoonlang.ir.mir.MirParam;
import com.lagoonlang.ir.mir.MirType;

import java.util.Collections;

/**
 * 代码生成上下文：一个编译单元内唯一的 MIR 上下文、构建器与模块，以及符号表。
 *
 * <p>生命周期：{@link #initialize} → 若干次降级 → {@link #finish}。
 * 顶层表达式都被追加到顶层函数的 {@code entry} 块中。</p>
 */
public class CodeGenContext {

    public static final String DEFAULT_MODULE_NAME = "Blue Lagoon JIT";
    public static final String DEFAULT_ENTRY_FUNCTION = "__toplevel";

    private final SymbolTable symbols = new SymbolTable();
    private MirContext context;
    private MirBuilder builder;
    private MirModule module;
    private MirFunction entryFunction;
    private boolean finished;

    public void initialize() {
        initialize(DEFAULT_MODULE_NAME, DEFAULT_ENTRY_FUNCTION);
    }

    /**
     * 创建 context/builder/module 三元组，每个编译单元只能调用一次。
     */
    public void initialize(String moduleName, String entryFunctionName) {
        if (context != null) {
            throw new IllegalStateException("Code generation context is already initialized");
        }
        context = new MirContext();
        module = context.createModule(moduleName);
        builder = context.createBuilder();
        entryFunction = module.addFunction(new MirFunction(entryFunctionName, MirType.ofVoid(),
                Collections.<MirParam>emptyList()));
        BasicBlock entry = entryFunction.appendBlock("entry");
        builder.positionAtEnd(entry);
    }

    public boolean isInitialized() {
        return context != null;
    }

    public boolean isFinished() {
        return finished;
    }

    public MirContext context() {
        ensureInitialized();
        return context;
    }

    public MirBuilder builder() {
        ensureInitialized();
        return builder;
    }

    public MirModule module() {
        ensureInitialized();
        return module;
    }

    public MirFunction entryFunction() {
        ensureInitialized();
        return entryFunction;
    }

    public SymbolTable symbols() {
        return symbols;
    }

    /**
     * 以 {@code ret void} 结束顶层函数，之后不能再降级。
     */
    public void finish() {
        ensureWritable();
        builder.createRetVoid();
        finished = true;
    }

    /** 降级前调用：未初始化或已结束都立即失败 */
    void ensureWritable() {
        ensureInitialized();
        if (finished) {
            throw new IllegalStateException("Code generation context is already finished");
        }
    }

    private void ensureInitialized() {
        if (context == null) {
            throw new IllegalStateException("Code generation context is not initialized");
        }
    }
}
