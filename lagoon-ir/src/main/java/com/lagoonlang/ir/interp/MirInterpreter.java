package com.lagoonlang.ir.interp;

import com.lagoonlang.ir.mir.MirConstant;
import com.lagoonlang.ir.mir.MirFunction;
import com.lagoonlang.ir.mir.MirInst;
import com.lagoonlang.ir.mir.MirValue;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * MIR 值的具体求值器。
 *
 * <p>按指令记忆结果：同一条指令只会计算一次，因此原生函数的副作用也只发生一次。
 * 求值器不持有模块，调用通过 {@link NativeFunctions} 按名称绑定。</p>
 */
public class MirInterpreter {

    private final NativeFunctions natives;
    private final Map<MirInst, Double> results = new IdentityHashMap<>();

    public MirInterpreter(NativeFunctions natives) {
        this.natives = natives;
    }

    public MirInterpreter() {
        this(NativeFunctions.empty());
    }

    /**
     * 求值。
     *
     * @throws EvalException 值不是数值、或调用无法绑定到原生函数
     */
    public double evaluate(MirValue value) {
        if (value instanceof MirConstant) {
            return ((MirConstant) value).getDoubleValue();
        }
        if (value instanceof MirInst) {
            MirInst inst = (MirInst) value;
            Double cached = results.get(inst);
            if (cached != null) {
                return cached;
            }
            double result = execute(inst);
            results.put(inst, result);
            return result;
        }
        if (value instanceof MirFunction) {
            throw new EvalException("Cannot evaluate function " + value.getReference() + " as a number");
        }
        throw new EvalException("Cannot evaluate " + value.getReference() + " without a binding");
    }

    private double execute(MirInst inst) {
        List<MirValue> ops = inst.getOperands();
        switch (inst.getOp()) {
            case FADD:
                return evaluate(ops.get(0)) + evaluate(ops.get(1));
            case FSUB:
                return evaluate(ops.get(0)) - evaluate(ops.get(1));
            case ADD:
                return (long) evaluate(ops.get(0)) + (long) evaluate(ops.get(1));
            case SUB:
                return (long) evaluate(ops.get(0)) - (long) evaluate(ops.get(1));
            case CALL:
                return call(inst.getCallee(), ops);
            default:
                throw new EvalException("Instruction has no value: " + inst);
        }
    }

    private double call(MirFunction callee, List<MirValue> operands) {
        NativeFunctions.Entry entry = natives.lookup(callee.getName());
        if (entry == null) {
            throw new EvalException("No native implementation bound for extern " + callee.getName());
        }
        if (entry.arity != operands.size()) {
            throw new EvalException(callee.getName() + "() takes exactly " + entry.arity
                    + " argument(s) but got " + operands.size());
        }
        double[] args = new double[operands.size()];
        for (int i = 0; i < args.length; i++) {
            args[i] = evaluate(operands.get(i));
        }
        return entry.impl.invoke(args);
    }
}
