package tbasic.ir;

import java.util.List;

/**
 * Instruction set. Value-producing instructions carry the name they were
 * given by their function; {@link Terminator}s end a basic block.
 */
public sealed interface Instruction {

    record Alloca(String name, IrType allocatedType) implements Instruction, Value {
        @Override
        public IrType type() { return IrType.PTR; }
    }

    record Load(String name, IrType type, Value address) implements Instruction, Value {}

    record Store(Value value, Value address) implements Instruction {}

    record FBinary(String name, Op op, Value lhs, Value rhs) implements Instruction, Value {
        public enum Op {
            FADD("fadd"), FSUB("fsub"), FMUL("fmul"), FDIV("fdiv");

            private final String mnemonic;

            Op(String mnemonic) { this.mnemonic = mnemonic; }

            public String mnemonic() { return mnemonic; }
        }

        @Override
        public IrType type() { return IrType.DOUBLE; }
    }

    /** Ordered float comparison. */
    record FCmp(String name, Predicate predicate, Value lhs, Value rhs) implements Instruction, Value {
        public enum Predicate {
            ONE("one"),     // ordered and not equal
            OLE("ole");     // ordered and less than or equal

            private final String mnemonic;

            Predicate(String mnemonic) { this.mnemonic = mnemonic; }

            public String mnemonic() { return mnemonic; }
        }

        @Override
        public IrType type() { return IrType.I1; }
    }

    /** {@code name} is null for calls to void functions. */
    record Call(String name, Function callee, List<Value> args) implements Instruction, Value {
        public Call {
            args = List.copyOf(args);
        }

        @Override
        public IrType type() { return callee.type().returnType(); }
    }

    sealed interface Terminator extends Instruction {
        List<BasicBlock> successors();
    }

    record Br(BasicBlock target) implements Terminator {
        @Override
        public List<BasicBlock> successors() { return List.of(target); }
    }

    record CondBr(Value condition, BasicBlock ifTrue, BasicBlock ifFalse) implements Terminator {
        @Override
        public List<BasicBlock> successors() { return List.of(ifTrue, ifFalse); }
    }

    /** {@code value} is null for {@code ret void}. */
    record Ret(Value value) implements Terminator {
        @Override
        public List<BasicBlock> successors() { return List.of(); }
    }
}
