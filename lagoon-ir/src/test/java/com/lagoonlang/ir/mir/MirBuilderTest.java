package com.lagoonlang.ir.mir;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MirBuilder / MirModule 单元测试
 */
class MirBuilderTest {

    private MirContext context;
    private MirModule module;
    private MirFunction function;
    private MirBuilder builder;

    @BeforeEach
    void setUp() {
        context = new MirContext();
        module = context.createModule("test");
        function = module.addFunction(new MirFunction("main", MirType.ofVoid(), Collections.<MirParam>emptyList()));
        builder = context.createBuilder();
        builder.positionAtEnd(function.appendBlock("entry"));
    }

    @Nested
    @DisplayName("常量")
    class ConstantTests {

        @Test
        @DisplayName("常量不产生指令")
        void testConstantsAreNotInstructions() {
            MirConstant c = builder.constDouble(2.5);
            builder.constInt(7);
            assertEquals(2.5, c.getDoubleValue());
            assertEquals(0, function.instructionCount());
        }

        @Test
        @DisplayName("同一上下文内常量被复用")
        void testInterning() {
            assertSame(builder.constDouble(1.0), context.constDouble(1.0));
            assertNotSame(context.constDouble(0.0), context.constDouble(-0.0));
            assertNotSame(context.constDouble(1.0), context.constInt(1));
        }

        @Test
        @DisplayName("常量文本")
        void testConstantText() {
            assertEquals("double 4.0", builder.constDouble(4).toString());
            assertEquals("i64 -3", builder.constInt(-3).toString());
        }
    }

    @Nested
    @DisplayName("指令")
    class InstructionTests {

        @Test
        @DisplayName("浮点加减")
        void testFloatArithmetic() {
            MirInst add = builder.createFAdd(builder.constDouble(3), builder.constDouble(4), "addtmp");
            MirInst sub = builder.createFSub(add, builder.constDouble(2), "subtmp");
            assertEquals(MirOp.FADD, add.getOp());
            assertEquals("%addtmp = fadd double 3.0, 4.0", add.toString());
            assertEquals("%subtmp = fsub double %addtmp, 2.0", sub.toString());
            assertEquals(2, function.instructionCount());
            assertSame(function.getEntryBlock(), sub.getParent());
        }

        @Test
        @DisplayName("整数加减")
        void testIntArithmetic() {
            MirInst add = builder.createAdd(builder.constInt(1), builder.constInt(2), "sum");
            assertEquals("%sum = add i64 1, 2", add.toString());
            assertTrue(add.getType().isInteger());
            assertEquals("%diff = sub i64 %sum, 1",
                    builder.createSub(add, builder.constInt(1), "diff").toString());
        }

        @Test
        @DisplayName("操作数类型不符被拒绝")
        void testTypeMismatch() {
            assertThrows(IllegalArgumentException.class,
                    () -> builder.createFAdd(builder.constInt(1), builder.constDouble(2), "bad"));
            assertEquals(0, function.instructionCount());
        }

        @Test
        @DisplayName("名称在函数内唯一")
        void testUniqueNames() {
            MirConstant one = builder.constDouble(1);
            assertEquals("addtmp", builder.createFAdd(one, one, "addtmp").getName());
            assertEquals("addtmp1", builder.createFAdd(one, one, "addtmp").getName());
            assertEquals("addtmp2", builder.createFAdd(one, one, "addtmp").getName());
            assertEquals("tmp", builder.createFAdd(one, one, null).getName());
        }

        @Test
        @DisplayName("调用")
        void testCall() {
            MirFunction pow = module.declareFunction("pow", Arrays.asList("base", "exp"));
            MirInst call = builder.createCall(pow,
                    Arrays.<MirValue>asList(builder.constDouble(2), builder.constDouble(10)), "calltmp");
            assertEquals("%calltmp = call double @pow(double 2.0, double 10.0)", call.toString());
            assertSame(pow, call.getCallee());
        }

        @Test
        @DisplayName("调用参数个数不符被拒绝")
        void testCallArity() {
            MirFunction sin = module.declareFunction("sin", Collections.singletonList("x"));
            assertThrows(IllegalArgumentException.class,
                    () -> builder.createCall(sin, Collections.<MirValue>emptyList(), "calltmp"));
        }

        @Test
        @DisplayName("ret 之后不能再追加指令")
        void testTerminated() {
            MirInst ret = builder.createRetVoid();
            assertEquals("ret void", ret.toString());
            assertFalse(ret.hasResult());
            assertTrue(function.getEntryBlock().hasTerminator());
            assertThrows(IllegalStateException.class,
                    () -> builder.createFAdd(builder.constDouble(1), builder.constDouble(1), "x"));
        }

        @Test
        @DisplayName("没有插入点时报错")
        void testNoInsertionPoint() {
            MirBuilder fresh = context.createBuilder();
            assertNull(fresh.getInsertBlock());
            assertThrows(IllegalStateException.class,
                    () -> fresh.createFAdd(fresh.constDouble(1), fresh.constDouble(1), "x"));
        }
    }

    @Nested
    @DisplayName("模块")
    class ModuleTests {

        @Test
        @DisplayName("按名称查找函数")
        void testLookup() {
            MirFunction sin = module.declareFunction("sin", Collections.singletonList("x"));
            assertSame(sin, module.getFunction("sin"));
            assertNull(module.getFunction("cos"));
            assertTrue(sin.isDeclaration());
            assertEquals(1, sin.getArity());
            assertFalse(function.isDeclaration());
        }

        @Test
        @DisplayName("同名函数不能重复添加")
        void testDuplicate() {
            module.declareFunction("sin", Collections.singletonList("x"));
            assertThrows(IllegalArgumentException.class,
                    () -> module.declareFunction("sin", Collections.singletonList("y")));
        }

        @Test
        @DisplayName("模块文本")
        void testPrint() {
            module.declareFunction("sin", Collections.singletonList("x"));
            MirInst add = builder.createFAdd(builder.constDouble(1), builder.constDouble(2), "addtmp");
            builder.createRet(add);
            String expected = "; ModuleID = 'test'\n"
                    + "\n"
                    + "define void @main() {\n"
                    + "entry:\n"
                    + "  %addtmp = fadd double 1.0, 2.0\n"
                    + "  ret double %addtmp\n"
                    + "}\n"
                    + "\n"
                    + "declare double @sin(double %x)\n";
            assertEquals(expected, module.print());
        }

        @Test
        @DisplayName("参数名参与唯一化")
        void testParamNamesReserved() {
            MirFunction f = module.addFunction(new MirFunction("f", MirType.ofDouble(),
                    Collections.singletonList(new MirParam("x", 0, MirType.ofDouble()))));
            builder.positionAtEnd(f.appendBlock("entry"));
            MirParam x = f.getParams().get(0);
            assertSame(f, x.getFunction());
            assertEquals("x1", builder.createFAdd(x, x, "x").getName());
        }
    }
}
