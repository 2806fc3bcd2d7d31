package tbasic.codegen;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tbasic.ast.Node;
import tbasic.ast.Program;
import tbasic.ast.expr.BinaryOp;
import tbasic.ast.expr.Call;
import tbasic.ast.expr.Expr;
import tbasic.ast.expr.NumberLiteral;
import tbasic.ast.expr.VariableRef;
import tbasic.ast.stmt.Conditional;
import tbasic.ast.stmt.CountedLoop;
import tbasic.ast.stmt.Declare;
import tbasic.ast.stmt.Print;
import tbasic.ast.stmt.Stmt;
import tbasic.ir.BasicBlock;
import tbasic.ir.Constant;
import tbasic.ir.Function;
import tbasic.ir.FunctionType;
import tbasic.ir.GlobalString;
import tbasic.ir.Instruction;
import tbasic.ir.IrBuilder;
import tbasic.ir.IrType;
import tbasic.ir.IrVerifier;
import tbasic.ir.Module;
import tbasic.ir.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Lowers a program into an IR module in one forward pass.
 *
 * <ul>
 *   <li>all top-level statements go into {@code i32 main()}, which returns 0;</li>
 *   <li>every variable is a {@code double} stack slot, read with {@code load} on each use;</li>
 *   <li>{@code PRINT} calls {@code void print(double)}, created on first use, which forwards to
 *       the host {@code printf} with {@code "%f\n"};</li>
 *   <li>a condition is true when it compares unequal to {@code 0.0};</li>
 *   <li>{@code FOR} is lowered as a do-while: the body runs once before the first bound check.</li>
 * </ul>
 *
 * An instance compiles exactly one program.
 */
public final class CodeGenerator {

    private static final Logger logger = LoggerFactory.getLogger(CodeGenerator.class);

    public static final String ENTRY_FUNCTION = "main";
    public static final String PRINT_ROUTINE = "print";
    public static final String HOST_PRINTF = "printf";

    private static final Constant.Real ZERO = new Constant.Real(0.0);
    private static final Constant.Real STEP = new Constant.Real(1.0);

    private final Module module;
    private final IrBuilder builder = new IrBuilder();
    private final SymbolTable symbols = new SymbolTable();

    private Function printRoutine;  // null until the first PRINT
    private boolean used;

    public CodeGenerator(String moduleName) {
        this.module = new Module(moduleName);
    }

    /**
     * Makes an externally provided {@code double}-taking function visible to
     * {@link Call} nodes. Must happen before {@link #generate(Program)}.
     */
    public Function declareFunction(String name, IrType returnType, int paramCount) {
        if (used) throw new IllegalStateException("Functions must be declared before generation");
        if (name.equals(ENTRY_FUNCTION) || name.equals(PRINT_ROUTINE) || name.equals(HOST_PRINTF)) {
            throw new IllegalArgumentException("Reserved function name: " + name);
        }
        return module.addFunction(name,
                new FunctionType(returnType, Collections.nCopies(paramCount, IrType.DOUBLE), false));
    }

    public Module generate(Program program) {
        if (used) throw new IllegalStateException("CodeGenerator instances are single-use");
        used = true;

        Function main = module.addFunction(ENTRY_FUNCTION, new FunctionType(IrType.I32, List.of(), false));
        builder.positionAtEnd(main.appendBlock("entry"));

        emitBody(program.statements());
        builder.ret(new Constant.Int(IrType.I32, 0));

        List<String> problems = IrVerifier.verify(module);
        if (!problems.isEmpty()) {
            throw new IllegalStateException("Generated malformed IR: " + String.join("; ", problems));
        }

        logger.debug("Module '{}': {} functions, {} blocks in {}",
                module.name(), module.functions().size(), main.blocks().size(), ENTRY_FUNCTION);
        return module;
    }

    // ---------- statements ----------
    private void emitBody(List<Node> body) {
        for (Node n : body) emitNode(n);
    }

    private void emitNode(Node n) {
        if (n instanceof Expr e) {
            emitExpr(e);
        } else {
            emitStmt((Stmt) n);
        }
    }

    private void emitStmt(Stmt s) {
        if (s instanceof Declare d) {
            symbols.define(d.name(), builder.alloca(IrType.DOUBLE, d.name()));
            return;
        }
        if (s instanceof Print p) {
            Value v = requireNumber(emitExpr(p.value()), "PRINT");
            builder.call(printRoutine(), List.of(v), null);
            return;
        }
        if (s instanceof Conditional c) {
            emitConditional(c);
            return;
        }
        if (s instanceof CountedLoop loop) {
            emitCountedLoop(loop);
            return;
        }
        throw new IllegalStateException("Unsupported statement: " + s.getClass().getSimpleName());
    }

    private void emitConditional(Conditional c) {
        Value cond = requireNumber(emitExpr(c.condition()), "IF condition");
        Value flag = builder.fcmp(Instruction.FCmp.Predicate.ONE, cond, ZERO, "ifcond");

        Function fn = builder.currentFunction();
        BasicBlock thenBB = fn.appendBlock("then");
        BasicBlock elseBB = fn.appendBlock("else");
        BasicBlock mergeBB = fn.appendBlock("ifcont");
        logger.trace("IF lowered to {}/{}/{}", thenBB, elseBB, mergeBB);

        builder.condBr(flag, thenBB, elseBB);

        builder.positionAtEnd(thenBB);
        emitBody(c.thenBody());
        builder.br(mergeBB);

        builder.positionAtEnd(elseBB);
        if (c.hasElse()) emitBody(c.elseBody());
        builder.br(mergeBB);

        builder.positionAtEnd(mergeBB);
    }

    private void emitCountedLoop(CountedLoop loop) {
        Value start = requireNumber(emitExpr(loop.start()), "FOR start");
        // the bound is evaluated once, before the first iteration
        Value end = requireNumber(emitExpr(loop.end()), "FOR bound");

        Instruction.Alloca slot = symbols.lookup(loop.variable());
        if (slot == null) {
            slot = builder.alloca(IrType.DOUBLE, loop.variable());
            symbols.define(loop.variable(), slot);
        }
        builder.store(start, slot);

        Function fn = builder.currentFunction();
        BasicBlock loopBB = fn.appendBlock("loop");
        BasicBlock afterBB = fn.appendBlock("afterloop");
        logger.trace("FOR {} lowered to {}/{}", loop.variable(), loopBB, afterBB);

        builder.br(loopBB);
        builder.positionAtEnd(loopBB);

        emitBody(loop.body());

        Value current = builder.load(slot, IrType.DOUBLE, loop.variable());
        Value next = builder.fadd(current, STEP, "nextvar");
        builder.store(next, slot);
        Value again = builder.fcmp(Instruction.FCmp.Predicate.OLE, next, end, "loopcond");
        builder.condBr(again, loopBB, afterBB);

        builder.positionAtEnd(afterBB);
    }

    // ---------- expressions ----------
    private Value emitExpr(Expr e) {
        if (e instanceof NumberLiteral lit) {
            return new Constant.Real(lit.value());
        }
        if (e instanceof VariableRef v) {
            Instruction.Alloca slot = symbols.lookup(v.name());
            if (slot == null) throw CodegenException.undefinedVariable(v.name());
            return builder.load(slot, IrType.DOUBLE, v.name());
        }
        if (e instanceof BinaryOp b) {
            return emitBinary(b);
        }
        if (e instanceof Call c) {
            return emitCall(c);
        }
        throw new IllegalStateException("Unsupported expression: " + e.getClass().getSimpleName());
    }

    private Value emitBinary(BinaryOp b) {
        Value l = requireNumber(emitExpr(b.left()), "operand of '" + b.operator() + "'");
        Value r = requireNumber(emitExpr(b.right()), "operand of '" + b.operator() + "'");

        return switch (b.operator()) {
            case "+" -> builder.fadd(l, r, "addtmp");
            case "-" -> builder.fsub(l, r, "subtmp");
            case "*" -> builder.fmul(l, r, "multmp");
            case "/" -> builder.fdiv(l, r, "divtmp");
            default -> throw CodegenException.unsupportedOperator(b.operator());
        };
    }

    private Value emitCall(Call c) {
        List<Value> args = new ArrayList<>(c.args().size());
        for (Expr a : c.args()) args.add(emitExpr(a));

        Function callee = module.function(c.name());
        if (callee == null) throw CodegenException.undefinedFunction(c.name());

        FunctionType type = callee.type();
        if (!type.accepts(args.size())) {
            throw CodegenException.argumentMismatch(c.name(),
                    "expected " + type.paramTypes().size() + " arguments, got " + args.size());
        }
        for (int i = 0; i < type.paramTypes().size(); i++) {
            if (args.get(i).type() != type.paramTypes().get(i)) {
                throw CodegenException.argumentMismatch(c.name(),
                        "argument " + (i + 1) + " must be " + type.paramTypes().get(i).spelling());
            }
        }
        return builder.call(callee, args, "calltmp");
    }

    // ---------- print routine ----------
    private Function printRoutine() {
        if (printRoutine != null) return printRoutine;

        GlobalString format = module.addGlobalString("fmt", "%f\n");
        Function printf = module.function(HOST_PRINTF);
        if (printf == null) {
            printf = module.addFunction(HOST_PRINTF, new FunctionType(IrType.I32, List.of(IrType.PTR), true));
        }

        Function print = module.addFunction(PRINT_ROUTINE,
                new FunctionType(IrType.VOID, List.of(IrType.DOUBLE), false));

        // separate builder: the caller's insertion block must stay where it is
        IrBuilder body = new IrBuilder();
        body.positionAtEnd(print.appendBlock("entry"));
        body.call(printf, List.of(format, print.param(0)), "written");
        body.retVoid();

        logger.debug("Created print routine in module '{}'", module.name());
        printRoutine = print;
        return print;
    }

    private static Value requireNumber(Value v, String what) {
        if (v.type() != IrType.DOUBLE) throw CodegenException.nonNumeric(what);
        return v;
    }
}
