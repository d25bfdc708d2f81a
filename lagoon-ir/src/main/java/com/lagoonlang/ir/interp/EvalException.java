package com.lagoonlang.ir.interp;

/**
 * MIR 求值失败：缺少原生实现、参数个数或类型不符等。
 */
public class EvalException extends RuntimeException {

    public EvalException(String message) {
        super(message);
    }
}
