package com.lagoonlang.ir.mir;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * MIR 结构校验。
 *
 * <p>检查项：</p>
 * <ul>
 *   <li>操作数在使用前已定义于同一函数，参数属于当前函数</li>
 *   <li>被调函数属于本模块且实参个数匹配</li>
 *   <li>终止指令只能出现在基本块末尾，定义的函数每个块都必须终止</li>
 * </ul>
 */
public final class MirVerifier {

    private MirVerifier() {}

    /**
     * 校验模块，返回发现的问题列表（为空表示通过）。
     *
     * @param requireTerminators 是否要求每个块以终止指令结尾（尚未 finish 的模块传 false）
     */
    public static List<String> verify(MirModule module, boolean requireTerminators) {
        List<String> problems = new ArrayList<>();
        for (MirFunction function : module.getFunctions()) {
            verifyFunction(module, function, requireTerminators, problems);
        }
        return problems;
    }

    public static List<String> verify(MirModule module) {
        return verify(module, true);
    }

    private static void verifyFunction(MirModule module, MirFunction function,
                                       boolean requireTerminators, List<String> problems) {
        Map<MirInst, Boolean> defined = new IdentityHashMap<>();
        String where = "@" + function.getName();
        for (BasicBlock block : function.getBlocks()) {
            List<MirInst> insts = block.getInstructions();
            for (int i = 0; i < insts.size(); i++) {
                MirInst inst = insts.get(i);
                if (inst.isTerminator() && i != insts.size() - 1) {
                    problems.add(where + ": terminator in the middle of block '" + block.getName() + "'");
                }
                for (MirValue operand : inst.getOperands()) {
                    checkOperand(function, operand, defined, where, inst, problems);
                }
                if (inst.getOp() == MirOp.CALL) {
                    MirFunction callee = inst.getCallee();
                    if (module.getFunction(callee.getName()) != callee) {
                        problems.add(where + ": call to function outside module: @" + callee.getName());
                    }
                    if (callee.getArity() != inst.getOperands().size()) {
                        problems.add(where + ": call to @" + callee.getName() + " passes "
                                + inst.getOperands().size() + " arguments, expected " + callee.getArity());
                    }
                }
                defined.put(inst, Boolean.TRUE);
            }
            if (requireTerminators && !block.hasTerminator()) {
                problems.add(where + ": block '" + block.getName() + "' has no terminator");
            }
        }
    }

    private static void checkOperand(MirFunction function, MirValue operand, Map<MirInst, Boolean> defined,
                                     String where, MirInst user, List<String> problems) {
        if (operand instanceof MirInst) {
            MirInst def = (MirInst) operand;
            if (!defined.containsKey(def)) {
                problems.add(where + ": " + def.getReference() + " used before definition in '" + user + "'");
            } else if (!def.hasResult()) {
                problems.add(where + ": instruction without result used as operand in '" + user + "'");
            }
        } else if (operand instanceof MirParam) {
            if (((MirParam) operand).getFunction() != function) {
                problems.add(where + ": parameter " + operand.getReference() + " belongs to another function");
            }
        } else if (!(operand instanceof MirConstant)) {
            problems.add(where + ": invalid operand " + operand.getReference() + " in '" + user + "'");
        }
    }

    /** 校验失败时抛出 {@link IllegalStateException} */
    public static void check(MirModule module, boolean requireTerminators) {
        List<String> problems = verify(module, requireTerminators);
        if (!problems.isEmpty()) {
            throw new IllegalStateException("Invalid MIR module '" + module.getName() + "':\n  "
                    + String.join("\n  ", problems));
        }
    }
}
