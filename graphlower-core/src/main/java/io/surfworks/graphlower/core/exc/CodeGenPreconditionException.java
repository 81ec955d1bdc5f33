package io.surfworks.graphlower.core.exc;

/**
 * The requested code generation cannot run on this graph or host. Raised before any code
 * is generated.
 */
public final class CodeGenPreconditionException extends GraphLoweringError {

    public CodeGenPreconditionException(String message) {
        super(message);
    }

    public static CodeGenPreconditionException cppWrapper(String reason) {
        return new CodeGenPreconditionException("Cannot generate a C++ wrapper: " + reason);
    }
}
