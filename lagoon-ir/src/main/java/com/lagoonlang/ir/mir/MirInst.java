package com.lagoonlang.ir.mir;

import java.util.Collections;
import java.util.List;

/**
 * MIR 指令。
 *
 * <p>有结果的指令本身就是一个值，其名称在所属函数内唯一；{@code ret} 无结果、无名称。</p>
 */
public final class MirInst extends MirValue {

    private final MirOp op;
    private final String name;          // null 表示无结果
    private final List<MirValue> operands;
    private final MirFunction callee;   // 仅 CALL 使用
    private BasicBlock parent;

    MirInst(MirOp op, MirType type, String name, List<MirValue> operands, MirFunction callee) {
        super(type);
        this.op = op;
        this.name = name;
        this.operands = Collections.unmodifiableList(operands);
        this.callee = callee;
    }

    public MirOp getOp() { return op; }
    public String getName() { return name; }
    public List<MirValue> getOperands() { return operands; }
    public MirFunction getCallee() { return callee; }
    public BasicBlock getParent() { return parent; }

    void setParent(BasicBlock parent) {
        this.parent = parent;
    }

    public boolean hasResult() {
        return name != null;
    }

    public boolean isTerminator() {
        return op.isTerminator();
    }

    @Override
    public String getReference() {
        return "%" + name;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (hasResult()) sb.append('%').append(name).append(" = ");
        sb.append(op.getMnemonic());
        switch (op) {
            case CALL:
                sb.append(' ').append(getType()).append(" @").append(callee.getName()).append('(');
                for (int i = 0; i < operands.size(); i++) {
                    if (i > 0) sb.append(", ");
                    sb.append(operands.get(i).getTypedReference());
                }
                sb.append(')');
                break;
            case RET:
                if (operands.isEmpty()) {
                    sb.append(" void");
                } else {
                    sb.append(' ').append(operands.get(0).getTypedReference());
                }
                break;
            default:
                sb.append(' ').append(getType());
                for (int i = 0; i < operands.size(); i++) {
                    sb.append(i == 0 ? " " : ", ").append(operands.get(i).getReference());
                }
        }
        return sb.toString();
    }
}
