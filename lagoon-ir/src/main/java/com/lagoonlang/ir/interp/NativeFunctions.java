package com.lagoonlang.ir.interp;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 原生函数注册表：extern 声明的函数在求值时按名称绑定到这里的实现。
 */
public final class NativeFunctions {

    /**
     * 原生函数的元信息。
     */
    public static final class Entry {
        public final String name;
        public final int arity;
        public final NativeFunction impl;

        Entry(String name, int arity, NativeFunction impl) {
            this.name = name;
            this.arity = arity;
            this.impl = impl;
        }
    }

    private final Map<String, Entry> entries = new LinkedHashMap<>();

    /** 空注册表 */
    public static NativeFunctions empty() {
        return new NativeFunctions();
    }

    /** 数学库：abs / sqrt / pow / gcd / sin / cos / tan / log / ln / floor / ceil / round / min / max */
    public static NativeFunctions math() {
        NativeFunctions natives = new NativeFunctions();
        natives.register("abs", 1, args -> Math.abs(args[0]));
        natives.register("sqrt", 1, args -> Math.sqrt(args[0]));
        natives.register("pow", 2, args -> Math.pow(args[0], args[1]));
        natives.register("gcd", 2, args -> gcd(requireInteger("gcd", args[0]), requireInteger("gcd", args[1])));
        natives.register("sin", 1, args -> Math.sin(args[0]));
        natives.register("cos", 1, args -> Math.cos(args[0]));
        natives.register("tan", 1, args -> Math.tan(args[0]));
        // log(n, base)
        natives.register("log", 2, args -> Math.log(args[0]) / Math.log(args[1]));
        natives.register("ln", 1, args -> Math.log(args[0]));
        natives.register("floor", 1, args -> Math.floor(args[0]));
        natives.register("ceil", 1, args -> Math.ceil(args[0]));
        natives.register("round", 1, args -> roundHalfAwayFromZero(args[0]));
        natives.register("min", 2, args -> Math.min(args[0], args[1]));
        natives.register("max", 2, args -> Math.max(args[0], args[1]));
        return natives;
    }

    /**
     * 注册原生函数，同名时覆盖。
     */
    public NativeFunctions register(String name, int arity, NativeFunction impl) {
        if (arity < 0) {
            throw new IllegalArgumentException("Negative arity for native function " + name);
        }
        entries.put(name, new Entry(name, arity, impl));
        return this;
    }

    /** 按名称查找，不存在时返回 null */
    public Entry lookup(String name) {
        return entries.get(name);
    }

    public boolean contains(String name) {
        return entries.containsKey(name);
    }

    public Collection<Entry> entries() {
        return Collections.unmodifiableCollection(entries.values());
    }

    // 2^63；long 无法表示绝对值不小于它的整数
    private static final double LONG_LIMIT = 0x1p63;

    private static long requireInteger(String fn, double value) {
        if (value != Math.rint(value) || Double.isInfinite(value)) {
            throw new EvalException(fn + "() requires integer arguments, got " + value);
        }
        if (Math.abs(value) >= LONG_LIMIT) {
            throw new EvalException(fn + "() argument out of 64-bit integer range: " + value);
        }
        return (long) value;
    }

    private static double roundHalfAwayFromZero(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return Math.copySign(Math.floor(Math.abs(value) + 0.5), value);
    }

    private static double gcd(long a, long b) {
        a = Math.abs(a);
        b = Math.abs(b);
        while (b != 0) {
            long temp = b;
            b = a % b;
            a = temp;
        }
        return a;
    }
}
