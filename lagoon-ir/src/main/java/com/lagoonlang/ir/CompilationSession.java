package com.lagoonlang.ir;

import com.lagoonlang.compiler.ast.AstNode;
import com.lagoonlang.compiler.ast.AstPrinter;
import com.lagoonlang.compiler.lexer.LexException;
import com.lagoonlang.compiler.lexer.Lexer;
import com.lagoonlang.compiler.parser.ParseException;
import com.lagoonlang.compiler.parser.Parser;
import com.lagoonlang.ir.interp.MathConstants;
import com.lagoonlang.ir.interp.MirInterpreter;
import com.lagoonlang.ir.interp.NativeFunctions;
import com.lagoonlang.ir.lowering.AstToMirLowering;
import com.lagoonlang.ir.lowering.CodeGenContext;
import com.lagoonlang.ir.lowering.LowerException;
import com.lagoonlang.ir.mir.MirModule;
import com.lagoonlang.ir.mir.MirValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 一个编译单元：持有代码生成上下文，可以多次喂入源码（REPL 每行一次）。
 *
 * <p>驱动循环：解析一个顶层项、降级、再解析下一个；遇到第一个错误即停止。</p>
 */
public class CompilationSession {

    private static final Logger LOG = Logger.getLogger(CompilationSession.class.getName());

    private final String fileName;
    private final CodeGenContext ctx = new CodeGenContext();
    private final AstToMirLowering lowering = new AstToMirLowering(ctx);
    private final NativeFunctions natives;

    public CompilationSession(CompileConfig config, String fileName) {
        this.fileName = fileName;
        this.natives = config.createNatives();
        ctx.initialize(config.getModuleName(), config.getTopLevelFunctionName());
        if (config.isBuiltins()) {
            installBuiltins();
        }
    }

    /**
     * 编译一段源码，结果只包含本段的顶层项。
     */
    public CompileResult feed(String source) {
        List<LoweredItem> items = new ArrayList<>();
        CompileError error = null;
        try {
            Parser parser = new Parser(new Lexer(source, fileName), fileName);
            AstNode node;
            while ((node = parser.parseTopLevel()) != null) {
                MirValue value = lowering.lower(node, ctx.symbols());
                items.add(new LoweredItem(node, value));
                if (LOG.isLoggable(Level.FINE)) {
                    LOG.fine("lowered " + AstPrinter.print(node) + " -> " + value.getReference());
                }
            }
        } catch (LexException e) {
            error = CompileError.of(e, fileName);
        } catch (ParseException e) {
            error = CompileError.of(e, fileName);
        } catch (LowerException e) {
            error = CompileError.of(e, fileName);
        }
        if (error != null) {
            LOG.fine("compilation of " + fileName + " stopped: " + error);
        }
        return new CompileResult(ctx.module(), items, error);
    }

    /** 结束顶层函数（追加 ret void），之后不能再喂入源码 */
    public void finish() {
        ctx.finish();
    }

    public MirModule getModule() {
        return ctx.module();
    }

    /** 创建绑定了本会话原生函数的求值器 */
    public MirInterpreter newInterpreter() {
        return new MirInterpreter(natives);
    }

    private void installBuiltins() {
        for (NativeFunctions.Entry entry : natives.entries()) {
            List<String> params = new ArrayList<>(entry.arity);
            for (int i = 0; i < entry.arity; i++) {
                params.add("arg" + i);
            }
            ctx.module().declareFunction(entry.name, params);
        }
        for (Map.Entry<String, Double> constant : MathConstants.all().entrySet()) {
            ctx.symbols().define(constant.getKey(), ctx.builder().constDouble(constant.getValue()));
        }
    }
}
