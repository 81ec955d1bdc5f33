package io.surfworks.graphlower.graph;

/**
 * The kind of operation a traced graph node performs.
 */
public enum NodeKind {
    /** A graph input. */
    PLACEHOLDER,
    /** Access to a constant attribute (weight or buffer) of the traced module. */
    GET_ATTR,
    /** A call to an operator or builtin. */
    CALL_FUNCTION,
    /** A call to a submodule; never present in graphs handed to lowering. */
    CALL_MODULE,
    /** A method call on a value; never present in graphs handed to lowering. */
    CALL_METHOD,
    /** The graph output; its single argument is the list of returned values. */
    OUTPUT
}
