package com.lagoonlang.ir.interp;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 内置数学常量
 */
public final class MathConstants {

    private static final Map<String, Double> CONSTANTS;

    static {
        Map<String, Double> map = new LinkedHashMap<>();
        map.put("PI", Math.PI);
        map.put("E", Math.E);
        map.put("TAU", 2 * Math.PI);
        map.put("INF", Double.POSITIVE_INFINITY);
        CONSTANTS = Collections.unmodifiableMap(map);
    }

    private MathConstants() {}

    public static Map<String, Double> all() {
        return CONSTANTS;
    }
}
