package com.lagoonlang.ir.mir;

/**
 * MIR 指令操作码。
 */
public enum MirOp {
    // 算术
    FADD("fadd"),   // dest = src1 + src2 (double)
    FSUB("fsub"),   // dest = src1 - src2 (double)
    ADD("add"),     // dest = src1 + src2 (i64)
    SUB("sub"),     // dest = src1 - src2 (i64)

    // 调用
    CALL("call"),   // dest = callee(args)

    // 终止
    RET("ret");

    private final String mnemonic;

    MirOp(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    public String getMnemonic() { return mnemonic; }

    public boolean isTerminator() {
        return this == RET;
    }

    public boolean isArithmetic() {
        switch (this) {
            case FADD: case FSUB: case ADD: case SUB: return true;
            default: return false;
        }
    }
}
