package com.lagoonlang.ir.mir;

/**
 * MIR 类型。数值一律为 64 位：浮点 double 与整数 i64。
 */
public final class MirType {

    public enum Kind {
        DOUBLE, INT, VOID
    }

    private static final MirType DOUBLE = new MirType(Kind.DOUBLE);
    private static final MirType INT = new MirType(Kind.INT);
    private static final MirType VOID = new MirType(Kind.VOID);

    private final Kind kind;

    private MirType(Kind kind) {
        this.kind = kind;
    }

    public static MirType ofDouble() { return DOUBLE; }
    public static MirType ofInt()    { return INT; }
    public static MirType ofVoid()   { return VOID; }

    public Kind getKind() { return kind; }

    public boolean isFloatingPoint() {
        return kind == Kind.DOUBLE;
    }

    public boolean isInteger() {
        return kind == Kind.INT;
    }

    public boolean isVoid() {
        return kind == Kind.VOID;
    }

    @Override
    public String toString() {
        switch (kind) {
            case DOUBLE: return "double";
            case INT:    return "i64";
            default:     return "void";
        }
    }
}
