package com.lagoonlang.ir.lowering;

import com.lagoonlang.ir.mir.MirValue;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 变量名 → 已生成的 MIR 值。
 *
 * <p>只在一个编译单元内有效，没有块作用域，条目不会被移除。</p>
 */
public class SymbolTable {

    private final Map<String, MirValue> values = new LinkedHashMap<>();

    /**
     * 绑定变量。
     *
     * @throws IllegalArgumentException 名称已绑定
     */
    public void define(String name, MirValue value) {
        if (values.containsKey(name)) {
            throw new IllegalArgumentException("Variable already defined: " + name);
        }
        values.put(name, value);
    }

    /** 查找变量，未绑定时返回 null */
    public MirValue lookup(String name) {
        return values.get(name);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public int size() {
        return values.size();
    }
}
