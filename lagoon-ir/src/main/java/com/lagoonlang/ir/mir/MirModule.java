package com.lagoonlang.ir.mir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * MIR 模块（编译单元），按声明顺序保存函数。
 */
public class MirModule {

    private final String name;
    private final Map<String, MirFunction> functions = new LinkedHashMap<>();

    MirModule(String name) {
        this.name = name;
    }

    public String getName() { return name; }

    public List<MirFunction> getFunctions() {
        return Collections.unmodifiableList(new ArrayList<>(functions.values()));
    }

    /** 按名称查找函数，不存在时返回 null */
    public MirFunction getFunction(String functionName) {
        return functions.get(functionName);
    }

    /**
     * 添加函数。
     *
     * @throws IllegalArgumentException 同名函数已存在
     */
    public MirFunction addFunction(MirFunction function) {
        if (functions.containsKey(function.getName())) {
            throw new IllegalArgumentException("Function already exists in module: " + function.getName());
        }
        functions.put(function.getName(), function);
        return function;
    }

    /**
     * 声明一个返回 double、参数均为 double 的外部函数。
     */
    public MirFunction declareFunction(String functionName, List<String> paramNames) {
        List<MirParam> params = new ArrayList<>(paramNames.size());
        for (int i = 0; i < paramNames.size(); i++) {
            params.add(new MirParam(paramNames.get(i), i, MirType.ofDouble()));
        }
        return addFunction(new MirFunction(functionName, MirType.ofDouble(), params));
    }

    /** 输出模块的文本形式 */
    public String print() {
        StringBuilder sb = new StringBuilder();
        sb.append("; ModuleID = '").append(name).append("'\n");
        for (MirFunction function : functions.values()) {
            sb.append('\n').append(function);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return print();
    }
}
