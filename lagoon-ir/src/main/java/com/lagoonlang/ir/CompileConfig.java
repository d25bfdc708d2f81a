package com.lagoonlang.ir;

import com.lagoonlang.ir.interp.NativeFunctions;
import com.lagoonlang.ir.lowering.CodeGenContext;

/**
 * 编译配置
 */
public class CompileConfig {

    /** 模块名（输出的 ModuleID） */
    private String moduleName = CodeGenContext.DEFAULT_MODULE_NAME;

    /** 承载顶层表达式的函数名 */
    private String topLevelFunctionName = CodeGenContext.DEFAULT_ENTRY_FUNCTION;

    /** 是否预声明数学库函数并绑定数学常量 */
    private boolean builtins = false;

    public String getModuleName() { return moduleName; }
    public void setModuleName(String moduleName) { this.moduleName = moduleName; }

    public String getTopLevelFunctionName() { return topLevelFunctionName; }
    public void setTopLevelFunctionName(String topLevelFunctionName) { this.topLevelFunctionName = topLevelFunctionName; }

    public boolean isBuiltins() { return builtins; }
    public void setBuiltins(boolean builtins) { this.builtins = builtins; }

    /** 按配置创建原生函数注册表：开启内置库时为数学库，否则为空 */
    public NativeFunctions createNatives() {
        return builtins ? NativeFunctions.math() : NativeFunctions.empty();
    }
}
