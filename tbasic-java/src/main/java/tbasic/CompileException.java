package tbasic;

/**
 * Base of every user-facing compilation failure. The first error aborts the
 * whole compilation; there is no recovery and no partial output.
 */
public abstract class CompileException extends RuntimeException {

    protected CompileException(String message) {
        super(message);
    }
}
