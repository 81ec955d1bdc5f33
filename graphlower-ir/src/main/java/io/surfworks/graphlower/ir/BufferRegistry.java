package io.surfworks.graphlower.ir;

import io.surfworks.graphlower.symbolic.SymExpr;
import io.surfworks.graphlower.tensor.ConstantTensor;

/**
 * The owner of the buffer list that IR nodes register themselves with when realized.
 */
public interface BufferRegistry {

    /**
     * Appends a buffer and assigns its name.
     *
     * @return the assigned name, {@code buf<N>} in registration order
     */
    String registerBuffer(Buffer buffer);

    /**
     * Records that {@code name} is written in place. Readers recorded so far are realized.
     */
    void markBufferMutated(String name);

    /**
     * Adds a tensor to the constant table and returns a box over its constant buffer.
     */
    TensorBox addTensorConstant(ConstantTensor value, String name);

    /**
     * Evaluates an expression at the example values of its symbols.
     */
    long sizeHint(SymExpr expr);

    RealizeThresholds thresholds();
}
