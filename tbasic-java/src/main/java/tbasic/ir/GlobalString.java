package tbasic.ir;

/** A private NUL-terminated byte string; as an operand it is a pointer. */
public record GlobalString(String name, String text) implements Value {
    @Override
    public IrType type() { return IrType.PTR; }
}
