package com.lagoonlang.ir.interp;

/**
 * 原生函数实现，参数与返回值均为 double。
 */
@FunctionalInterface
public interface NativeFunction {

    double invoke(double[] args);
}
