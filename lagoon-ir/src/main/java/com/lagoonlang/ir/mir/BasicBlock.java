package com.lagoonlang.ir.mir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * MIR 基本块。
 */
public class BasicBlock {

    private final String name;
    private final MirFunction parent;
    private final List<MirInst> instructions = new ArrayList<>();

    BasicBlock(String name, MirFunction parent) {
        this.name = name;
        this.parent = parent;
    }

    public String getName() { return name; }

    public MirFunction getParent() { return parent; }

    public List<MirInst> getInstructions() {
        return Collections.unmodifiableList(instructions);
    }

    public int size() {
        return instructions.size();
    }

    void addInstruction(MirInst inst) {
        instructions.add(inst);
        inst.setParent(this);
    }

    /** 最后一条指令若为终止指令则返回之，否则 null */
    public MirInst getTerminator() {
        if (instructions.isEmpty()) return null;
        MirInst last = instructions.get(instructions.size() - 1);
        return last.isTerminator() ? last : null;
    }

    public boolean hasTerminator() {
        return getTerminator() != null;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(name).append(":\n");
        for (MirInst inst : instructions) {
            sb.append("  ").append(inst).append('\n');
        }
        return sb.toString();
    }
}
