package com.lagoonlang.ir.mir;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * MIR 构建器：向当前插入点追加指令。
 */
public class MirBuilder {

    private final MirContext context;
    private BasicBlock insertBlock;

    MirBuilder(MirContext context) {
        this.context = context;
    }

    public void positionAtEnd(BasicBlock block) {
        this.insertBlock = block;
    }

    public BasicBlock getInsertBlock() { return insertBlock; }

    // ========== 常量（不产生指令） ==========

    public MirConstant constDouble(double value) {
        return context.constDouble(value);
    }

    public MirConstant constInt(long value) {
        return context.constInt(value);
    }

    // ========== 算术 ==========

    public MirInst createFAdd(MirValue left, MirValue right, String name) {
        return arithmetic(MirOp.FADD, MirType.ofDouble(), left, right, name);
    }

    public MirInst createFSub(MirValue left, MirValue right, String name) {
        return arithmetic(MirOp.FSUB, MirType.ofDouble(), left, right, name);
    }

    public MirInst createAdd(MirValue left, MirValue right, String name) {
        return arithmetic(MirOp.ADD, MirType.ofInt(), left, right, name);
    }

    public MirInst createSub(MirValue left, MirValue right, String name) {
        return arithmetic(MirOp.SUB, MirType.ofInt(), left, right, name);
    }

    // ========== 调用 ==========

    /**
     * 调用函数。
     *
     * @throws IllegalArgumentException 实参个数与被调函数参数个数不一致
     */
    public MirInst createCall(MirFunction callee, List<MirValue> args, String name) {
        if (args.size() != callee.getArity()) {
            throw new IllegalArgumentException("Call to @" + callee.getName() + " expects "
                    + callee.getArity() + " arguments but got " + args.size());
        }
        for (int i = 0; i < args.size(); i++) {
            requireType(args.get(i), callee.getParams().get(i).getType(), "call");
        }
        return emit(new MirInst(MirOp.CALL, callee.getReturnType(), uniqueName(name),
                new ArrayList<>(args), callee));
    }

    // ========== 终止 ==========

    public MirInst createRetVoid() {
        return emit(new MirInst(MirOp.RET, MirType.ofVoid(), null,
                Collections.<MirValue>emptyList(), null));
    }

    public MirInst createRet(MirValue value) {
        return emit(new MirInst(MirOp.RET, MirType.ofVoid(), null,
                Collections.singletonList(value), null));
    }

    // ========== 内部 ==========

    private MirInst arithmetic(MirOp op, MirType type, MirValue left, MirValue right, String name) {
        requireType(left, type, op.getMnemonic());
        requireType(right, type, op.getMnemonic());
        return emit(new MirInst(op, type, uniqueName(name), Arrays.asList(left, right), null));
    }

    private static void requireType(MirValue value, MirType expected, String opName) {
        if (value.getType() != expected) {
            throw new IllegalArgumentException("Operand " + value.getReference() + " of " + opName
                    + " has type " + value.getType() + ", expected " + expected);
        }
    }

    private String uniqueName(String hint) {
        return currentBlock().getParent().uniqueName(hint == null || hint.isEmpty() ? "tmp" : hint);
    }

    private BasicBlock currentBlock() {
        if (insertBlock == null) {
            throw new IllegalStateException("Builder has no insertion point");
        }
        return insertBlock;
    }

    private MirInst emit(MirInst inst) {
        BasicBlock block = currentBlock();
        if (block.hasTerminator()) {
            throw new IllegalStateException("Block '" + block.getName() + "' is already terminated");
        }
        block.addInstruction(inst);
        return inst;
    }
}
