package tbasic.codegen;

import tbasic.CompileException;

public final class CodegenException extends CompileException {

    public enum Kind {
        UNDEFINED_VARIABLE,
        UNDEFINED_FUNCTION,
        UNSUPPORTED_OPERATOR,
        ARGUMENT_MISMATCH,
        NON_NUMERIC_VALUE
    }

    private final Kind kind;
    private final String name;

    private CodegenException(Kind kind, String name, String message) {
        super(message);
        this.kind = kind;
        this.name = name;
    }

    static CodegenException undefinedVariable(String name) {
        return new CodegenException(Kind.UNDEFINED_VARIABLE, name, "Undefined variable: " + name);
    }

    static CodegenException undefinedFunction(String name) {
        return new CodegenException(Kind.UNDEFINED_FUNCTION, name, "Undefined function: " + name);
    }

    static CodegenException unsupportedOperator(String op) {
        return new CodegenException(Kind.UNSUPPORTED_OPERATOR, op, "Unsupported binary operator: '" + op + "'");
    }

    static CodegenException argumentMismatch(String function, String detail) {
        return new CodegenException(Kind.ARGUMENT_MISMATCH, function, "Bad call to " + function + ": " + detail);
    }

    static CodegenException nonNumeric(String what) {
        return new CodegenException(Kind.NON_NUMERIC_VALUE, what, "Expected a numeric value for " + what);
    }

    public Kind kind() { return kind; }

    /** The variable, function or operator the error is about. */
    public String name() { return name; }
}
