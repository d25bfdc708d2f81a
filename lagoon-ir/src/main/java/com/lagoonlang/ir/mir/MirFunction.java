package com.lagoonlang.ir.mir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * MIR 函数。没有基本块的函数是外部声明（{@code declare}），有基本块的是定义（{@code define}）。
 */
public class MirFunction extends MirValue {

    private final String name;
    private final List<MirParam> params;
    private final List<BasicBlock> blocks = new ArrayList<>();
    /** 名称提示 → 已使用次数，用于生成函数内唯一的值名 */
    private final Map<String, Integer> nameCounters = new HashMap<>();

    public MirFunction(String name, MirType returnType, List<MirParam> params) {
        super(returnType);
        this.name = name;
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
        for (MirParam param : this.params) {
            param.attachTo(this);
            nameCounters.put(param.getName(), 1);
        }
    }

    public String getName() { return name; }
    public MirType getReturnType() { return getType(); }
    public List<MirParam> getParams() { return params; }
    public int getArity() { return params.size(); }

    public List<BasicBlock> getBlocks() {
        return Collections.unmodifiableList(blocks);
    }

    public boolean isDeclaration() {
        return blocks.isEmpty();
    }

    public BasicBlock getEntryBlock() {
        return blocks.isEmpty() ? null : blocks.get(0);
    }

    /** 追加一个新的基本块 */
    public BasicBlock appendBlock(String blockName) {
        BasicBlock block = new BasicBlock(blockName, this);
        blocks.add(block);
        return block;
    }

    /**
     * 生成函数内唯一的值名：首次使用返回提示本身，之后依次追加 1、2……
     */
    String uniqueName(String hint) {
        Integer used = nameCounters.get(hint);
        if (used == null) {
            nameCounters.put(hint, 1);
            return hint;
        }
        String candidate = hint + used;
        while (nameCounters.containsKey(candidate)) {
            used++;
            candidate = hint + used;
        }
        nameCounters.put(hint, used + 1);
        nameCounters.put(candidate, 1);
        return candidate;
    }

    /** 所有基本块中的指令总数 */
    public int instructionCount() {
        int count = 0;
        for (BasicBlock block : blocks) count += block.size();
        return count;
    }

    @Override
    public String getReference() {
        return "@" + name;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(isDeclaration() ? "declare " : "define ");
        sb.append(getReturnType()).append(" @").append(name).append('(');
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(params.get(i).getTypedReference());
        }
        sb.append(')');
        if (isDeclaration()) {
            return sb.append('\n').toString();
        }
        sb.append(" {\n");
        for (int i = 0; i < blocks.size(); i++) {
            if (i > 0) sb.append('\n');
            sb.append(blocks.get(i));
        }
        return sb.append("}\n").toString();
    }
}
