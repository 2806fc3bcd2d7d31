package tbasic.ir;

import java.util.List;

/**
 * Appends instructions at the end of the current insertion block. Branching
 * code creates its blocks up front, emits the branch, then repositions.
 */
public final class IrBuilder {
    private BasicBlock insertBlock;

    public void positionAtEnd(BasicBlock block) {
        this.insertBlock = block;
    }

    public BasicBlock insertBlock() {
        if (insertBlock == null) throw new IllegalStateException("No insertion block");
        return insertBlock;
    }

    public Function currentFunction() {
        return insertBlock().parent();
    }

    // ---------- memory ----------

    /** Slots are placed in the entry block of the current function, whatever the insertion point. */
    public Instruction.Alloca alloca(IrType type, String name) {
        Function fn = currentFunction();
        Instruction.Alloca a = new Instruction.Alloca(fn.uniqueName(name), type);
        fn.entryBlock().insertAlloca(a);
        return a;
    }

    public Instruction.Load load(Value address, IrType type, String name) {
        requirePointer(address);
        return emit(new Instruction.Load(currentFunction().uniqueName(name), type, address));
    }

    public void store(Value value, Value address) {
        requirePointer(address);
        emit(new Instruction.Store(value, address));
    }

    // ---------- arithmetic ----------

    public Instruction.FBinary fadd(Value lhs, Value rhs, String name) {
        return binary(Instruction.FBinary.Op.FADD, lhs, rhs, name);
    }

    public Instruction.FBinary fsub(Value lhs, Value rhs, String name) {
        return binary(Instruction.FBinary.Op.FSUB, lhs, rhs, name);
    }

    public Instruction.FBinary fmul(Value lhs, Value rhs, String name) {
        return binary(Instruction.FBinary.Op.FMUL, lhs, rhs, name);
    }

    public Instruction.FBinary fdiv(Value lhs, Value rhs, String name) {
        return binary(Instruction.FBinary.Op.FDIV, lhs, rhs, name);
    }

    private Instruction.FBinary binary(Instruction.FBinary.Op op, Value lhs, Value rhs, String name) {
        requireDouble(lhs);
        requireDouble(rhs);
        return emit(new Instruction.FBinary(currentFunction().uniqueName(name), op, lhs, rhs));
    }

    public Instruction.FCmp fcmp(Instruction.FCmp.Predicate predicate, Value lhs, Value rhs, String name) {
        requireDouble(lhs);
        requireDouble(rhs);
        return emit(new Instruction.FCmp(currentFunction().uniqueName(name), predicate, lhs, rhs));
    }

    // ---------- calls ----------

    public Instruction.Call call(Function callee, List<Value> args, String name) {
        FunctionType t = callee.type();
        if (!t.accepts(args.size())) {
            throw new IllegalArgumentException("Wrong argument count for " + callee.name() + ": " + args.size());
        }
        String result = t.returnType() == IrType.VOID ? null : currentFunction().uniqueName(name);
        return emit(new Instruction.Call(result, callee, args));
    }

    // ---------- terminators ----------

    public void br(BasicBlock target) {
        emit(new Instruction.Br(target));
    }

    public void condBr(Value condition, BasicBlock ifTrue, BasicBlock ifFalse) {
        if (condition.type() != IrType.I1) {
            throw new IllegalArgumentException("Branch condition must be i1, got " + condition.type());
        }
        emit(new Instruction.CondBr(condition, ifTrue, ifFalse));
    }

    public void ret(Value value) {
        emit(new Instruction.Ret(value));
    }

    public void retVoid() {
        emit(new Instruction.Ret(null));
    }

    // ---------- helpers ----------

    private <T extends Instruction> T emit(T insn) {
        insertBlock().append(insn);
        return insn;
    }

    private static void requireDouble(Value v) {
        if (v.type() != IrType.DOUBLE) throw new IllegalArgumentException("Expected double operand, got " + v.type());
    }

    private static void requirePointer(Value v) {
        if (v.type() != IrType.PTR) throw new IllegalArgumentException("Expected pointer operand, got " + v.type());
    }
}
