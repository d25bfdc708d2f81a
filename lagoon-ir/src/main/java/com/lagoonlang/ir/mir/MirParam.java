package com.lagoonlang.ir.mir;

/**
 * 函数形参。
 */
public final class MirParam extends MirValue {

    private final String name;
    private final int index;
    private MirFunction function;

    public MirParam(String name, int index, MirType type) {
        super(type);
        this.name = name;
        this.index = index;
    }

    public String getName() { return name; }
    public int getIndex() { return index; }
    public MirFunction getFunction() { return function; }

    void attachTo(MirFunction function) {
        this.function = function;
    }

    @Override
    public String getReference() {
        return "%" + name;
    }

    @Override
    public String toString() {
        return getTypedReference();
    }
}
