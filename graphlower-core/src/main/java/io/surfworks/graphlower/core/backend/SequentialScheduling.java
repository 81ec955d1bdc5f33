package io.surfworks.graphlower.core.backend;

import java.util.ArrayList;
import java.util.List;

import io.surfworks.graphlower.ir.Buffer;
import io.surfworks.graphlower.ir.ConstantBuffer;
import io.surfworks.graphlower.ir.InputBuffer;

/**
 * One kernel per computed buffer, in creation order.
 */
public final class SequentialScheduling implements Scheduling {

    @Override
    public List<List<Buffer>> schedule(List<Buffer> buffers) {
        List<List<Buffer>> kernels = new ArrayList<>();
        for (Buffer buffer : buffers) {
            if (buffer instanceof InputBuffer || buffer instanceof ConstantBuffer) {
                continue;
            }
            kernels.add(List.of(buffer));
        }
        return kernels;
    }
}
