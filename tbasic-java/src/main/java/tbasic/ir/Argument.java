package tbasic.ir;

public record Argument(String name, IrType type, int index) implements Value {}
