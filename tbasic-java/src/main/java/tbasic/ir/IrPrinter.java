package tbasic.ir;

import java.nio.charset.StandardCharsets;
import java.util.StringJoiner;

/**
 * Renders a module in LLVM textual syntax. Double constants are written as
 * their IEEE-754 bit pattern, which LLVM reads back exactly.
 */
public final class IrPrinter {
    private IrPrinter() {}

    public static String print(Module module) {
        StringBuilder sb = new StringBuilder();
        sb.append("; ModuleID = '").append(module.name()).append("'\n");
        sb.append("source_filename = \"").append(escape(module.name().getBytes(StandardCharsets.UTF_8))).append("\"\n");

        if (!module.globals().isEmpty()) sb.append('\n');
        for (GlobalString g : module.globals()) {
            byte[] bytes = g.text().getBytes(StandardCharsets.US_ASCII);
            sb.append('@').append(g.name())
                    .append(" = private unnamed_addr constant [").append(bytes.length + 1).append(" x i8] c\"")
                    .append(escape(bytes)).append("\\00\"\n");
        }

        for (Function f : module.functions()) {
            sb.append('\n');
            printFunction(sb, f);
        }
        return sb.toString();
    }

    private static void printFunction(StringBuilder sb, Function f) {
        FunctionType t = f.type();
        StringJoiner params = new StringJoiner(", ", "(", ")");

        if (f.isDeclaration()) {
            for (IrType p : t.paramTypes()) params.add(p.spelling());
            if (t.varArgs()) params.add("...");
            sb.append("declare ").append(t.returnType().spelling()).append(" @").append(f.name())
                    .append(params).append('\n');
            return;
        }

        for (Argument a : f.params()) params.add(a.type().spelling() + " %" + a.name());
        if (t.varArgs()) params.add("...");
        sb.append("define ").append(t.returnType().spelling()).append(" @").append(f.name())
                .append(params).append(" {\n");

        boolean first = true;
        for (BasicBlock b : f.blocks()) {
            if (!first) sb.append('\n');
            first = false;
            sb.append(b.label()).append(":\n");
            for (Instruction insn : b.instructions()) {
                sb.append("  ").append(instruction(insn)).append('\n');
            }
        }
        sb.append("}\n");
    }

    static String instruction(Instruction insn) {
        if (insn instanceof Instruction.Alloca a) {
            return "%" + a.name() + " = alloca " + a.allocatedType().spelling();
        }
        if (insn instanceof Instruction.Load l) {
            return "%" + l.name() + " = load " + l.type().spelling() + ", " + typed(l.address());
        }
        if (insn instanceof Instruction.Store s) {
            return "store " + typed(s.value()) + ", " + typed(s.address());
        }
        if (insn instanceof Instruction.FBinary b) {
            return "%" + b.name() + " = " + b.op().mnemonic() + " double " + operand(b.lhs()) + ", " + operand(b.rhs());
        }
        if (insn instanceof Instruction.FCmp c) {
            return "%" + c.name() + " = fcmp " + c.predicate().mnemonic() + " double "
                    + operand(c.lhs()) + ", " + operand(c.rhs());
        }
        if (insn instanceof Instruction.Call c) {
            return call(c);
        }
        if (insn instanceof Instruction.Br br) {
            return "br label %" + br.target().label();
        }
        if (insn instanceof Instruction.CondBr cb) {
            return "br " + typed(cb.condition()) + ", label %" + cb.ifTrue().label()
                    + ", label %" + cb.ifFalse().label();
        }
        if (insn instanceof Instruction.Ret r) {
            return r.value() == null ? "ret void" : "ret " + typed(r.value());
        }
        throw new IllegalStateException("Unknown instruction: " + insn);
    }

    private static String call(Instruction.Call c) {
        FunctionType t = c.callee().type();
        StringBuilder sb = new StringBuilder();
        if (c.name() != null) sb.append('%').append(c.name()).append(" = ");
        sb.append("call ").append(t.returnType().spelling()).append(' ');

        // variadic callees need the full function type at the call site
        if (t.varArgs()) {
            StringJoiner sig = new StringJoiner(", ", "(", ") ");
            for (IrType p : t.paramTypes()) sig.add(p.spelling());
            sig.add("...");
            sb.append(sig);
        }

        StringJoiner args = new StringJoiner(", ", "(", ")");
        for (Value v : c.args()) args.add(typed(v));
        return sb.append('@').append(c.callee().name()).append(args).toString();
    }

    private static String typed(Value v) {
        return v.type().spelling() + " " + operand(v);
    }

    static String operand(Value v) {
        if (v instanceof Constant.Real r) {
            return String.format("0x%016X", Double.doubleToRawLongBits(r.value()));
        }
        if (v instanceof Constant.Int i) return Long.toString(i.value());
        if (v instanceof GlobalString g) return "@" + g.name();
        if (v instanceof Argument a) return "%" + a.name();
        if (v instanceof Instruction.Alloca a) return "%" + a.name();
        if (v instanceof Instruction.Load l) return "%" + l.name();
        if (v instanceof Instruction.FBinary b) return "%" + b.name();
        if (v instanceof Instruction.FCmp c) return "%" + c.name();
        if (v instanceof Instruction.Call c && c.name() != null) return "%" + c.name();
        throw new IllegalStateException("Value has no operand form: " + v);
    }

    private static String escape(byte[] bytes) {
        StringBuilder sb = new StringBuilder();
        for (byte b : bytes) {
            if (b >= 0x20 && b < 0x7F && b != '"' && b != '\\') sb.append((char) b);
            else sb.append(String.format("\\%02X", b & 0xFF));
        }
        return sb.toString();
    }
}
