package tbasic.ir;

public sealed interface Constant extends Value {

    record Real(double value) implements Constant {
        @Override
        public IrType type() { return IrType.DOUBLE; }
    }

    record Int(IrType type, long value) implements Constant {}
}
