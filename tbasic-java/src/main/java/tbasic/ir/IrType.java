package tbasic.ir;

public enum IrType {
    VOID("void"),
    I1("i1"),
    I32("i32"),
    DOUBLE("double"),
    PTR("ptr");

    private final String spelling;

    IrType(String spelling) {
        this.spelling = spelling;
    }

    public String spelling() {
        return spelling;
    }
}
