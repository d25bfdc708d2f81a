package com.lagoonlang.ir.mir;

import java.util.HashMap;
import java.util.Map;

/**
 * MIR 上下文：持有常量池，并作为模块与构建器的工厂。
 *
 * <p>同一上下文中数值相同的常量是同一个对象。上下文不是线程安全的。</p>
 */
public class MirContext {

    private final Map<Long, MirConstant> doubleConstants = new HashMap<>();
    private final Map<Long, MirConstant> intConstants = new HashMap<>();

    public MirModule createModule(String name) {
        return new MirModule(name);
    }

    public MirBuilder createBuilder() {
        return new MirBuilder(this);
    }

    public MirConstant constDouble(double value) {
        // 以位模式为键，区分 0.0 与 -0.0
        return doubleConstants.computeIfAbsent(Double.doubleToLongBits(value), k -> new MirConstant(value));
    }

    public MirConstant constInt(long value) {
        return intConstants.computeIfAbsent(value, k -> new MirConstant(value));
    }
}
