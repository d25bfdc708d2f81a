package com.lagoonlang.ir.mir;

/**
 * MIR 值：常量、参数、指令或函数。
 */
public abstract class MirValue {

    private final MirType type;

    protected MirValue(MirType type) {
        this.type = type;
    }

    public MirType getType() { return type; }

    /**
     * 作为操作数时的文本形式，如 {@code %addtmp}、{@code 4.0}、{@code @sin}。
     */
    public abstract String getReference();

    /** 带类型的操作数文本，如 {@code double %x} */
    public String getTypedReference() {
        return type + " " + getReference();
    }
}
