package io.surfworks.graphlower.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import io.surfworks.graphlower.core.constants.ConstantTable;
import io.surfworks.graphlower.ir.Buffer;
import io.surfworks.graphlower.ir.ExternKernelNode;
import io.surfworks.graphlower.ir.IrNode;

/**
 * Everything a scheduler and wrapper generator need from a lowered graph.
 *
 * @param name               graph name
 * @param graphInputs        input bindings by name: a {@code TensorBox} or a {@code SymExpr}
 * @param buffers            realized buffers in creation order
 * @param graphOutputs       output values in output order
 * @param constants          the constant table
 * @param userVisibleOutputs names of outputs the caller observes
 * @param mutatedInputs      names of graph inputs written in place
 * @param mutatedInputIdxs   positions of those inputs among the graph inputs
 * @param externKernelNodes  extern kernel calls, in creation order
 * @param deviceTypes        device types touched by inputs and buffers
 */
public record LoweredGraph(
        String name,
        Map<String, Object> graphInputs,
        List<Buffer> buffers,
        List<IrNode> graphOutputs,
        ConstantTable constants,
        Set<String> userVisibleOutputs,
        Set<String> mutatedInputs,
        List<Integer> mutatedInputIdxs,
        List<ExternKernelNode> externKernelNodes,
        Set<String> deviceTypes
) {

    public LoweredGraph {
        graphInputs = Collections.unmodifiableMap(new LinkedHashMap<>(graphInputs));
        buffers = List.copyOf(buffers);
        graphOutputs = Collections.unmodifiableList(new ArrayList<>(graphOutputs));
        userVisibleOutputs = Set.copyOf(userVisibleOutputs);
        mutatedInputs = Set.copyOf(mutatedInputs);
        mutatedInputIdxs = List.copyOf(mutatedInputIdxs);
        externKernelNodes = List.copyOf(externKernelNodes);
        deviceTypes = Set.copyOf(deviceTypes);
    }
}
