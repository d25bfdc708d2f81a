package com.lagoonlang.ir.mir;

/**
 * 常量值。常量不是指令，创建常量不会向基本块追加任何内容。
 */
public final class MirConstant extends MirValue {

    private final double doubleValue;
    private final long longValue;

    MirConstant(double value) {
        super(MirType.ofDouble());
        this.doubleValue = value;
        this.longValue = (long) value;
    }

    MirConstant(long value) {
        super(MirType.ofInt());
        this.doubleValue = value;
        this.longValue = value;
    }

    public double getDoubleValue() { return doubleValue; }

    @Override
    public String getReference() {
        if (getType().isInteger()) {
            return Long.toString(longValue);
        }
        return Double.toString(doubleValue);
    }

    @Override
    public String toString() {
        return getTypedReference();
    }
}
