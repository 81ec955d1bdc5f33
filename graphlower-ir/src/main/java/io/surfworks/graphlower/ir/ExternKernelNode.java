package io.surfworks.graphlower.ir;

import java.util.List;

/**
 * Serializable record of one extern kernel call, shipped alongside ahead-of-time
 * compiled code.
 *
 * @param name    output buffer name
 * @param kernel  kernel called
 * @param inputs  names of the input buffers
 * @param args    rendered non-tensor arguments
 */
public record ExternKernelNode(String name, String kernel, List<String> inputs, List<String> args) {

    public ExternKernelNode {
        inputs = List.copyOf(inputs);
        args = List.copyOf(args);
    }
}
