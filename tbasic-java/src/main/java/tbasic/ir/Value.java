package tbasic.ir;

/** Anything that can be an instruction operand. */
public sealed interface Value
        permits Constant, Argument, GlobalString,
        Instruction.Alloca, Instruction.Load, Instruction.FBinary,
        Instruction.FCmp, Instruction.Call {

    IrType type();
}
