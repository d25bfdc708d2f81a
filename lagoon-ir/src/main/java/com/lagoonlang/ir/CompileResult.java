package com.lagoonlang.ir;

import com.lagoonlang.ir.mir.MirModule;
import com.lagoonlang.ir.mir.MirValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 编译结果。
 *
 * <p>失败时模块中可能残留出错前已生成的指令，调用方应当丢弃该模块。</p>
 */
public final class CompileResult {

    private final MirModule module;
    private final List<LoweredItem> items;
    private final CompileError error;

    public CompileResult(MirModule module, List<LoweredItem> items, CompileError error) {
        this.module = module;
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
        this.error = error;
    }

    public MirModule getModule() { return module; }

    public List<LoweredItem> getItems() { return items; }

    /** 出错时返回错误，成功时返回 null */
    public CompileError getError() { return error; }

    public boolean isSuccess() {
        return error == null;
    }

    /** 最后一个顶层项的值，没有任何顶层项时返回 null */
    public MirValue getLastValue() {
        return items.isEmpty() ? null : items.get(items.size() - 1).getValue();
    }
}
