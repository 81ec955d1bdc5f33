package io.surfworks.graphlower.tensor;

/**
 * The statically known example value attached to a traced graph node.
 *
 * <p>A node produces either a tensor ({@link TensorMeta}), a symbolic integer
 * ({@link SymbolicScalar}), a concrete Python-style scalar ({@link ConstantScalar})
 * or a tuple of those ({@link TupleValue}).
 */
public sealed interface ExampleValue permits TensorMeta, SymbolicScalar, ConstantScalar, TupleValue {
}
